package tusklang.base;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemTest {

  @TempDir Path dir;

  @Test
  void testWriteAtomicallyCreatesTarget() throws IOException {
    Path target = dir.resolve("app.tsk");
    FileSystem.writeAtomically(target, "hello".getBytes(StandardCharsets.UTF_8));
    assertEquals("hello", Files.readString(target));
    assertThat(leftovers(), empty());
  }

  @Test
  void testWriteAtomicallyReplacesTarget() throws IOException {
    Path target = dir.resolve("app.tsk");
    Files.writeString(target, "old content that is longer");
    FileSystem.writeAtomically(target, "new".getBytes(StandardCharsets.UTF_8));
    assertEquals("new", Files.readString(target));
    assertThat(leftovers(), empty());
  }

  @Test
  void testWriteIntoMissingDirectoryFails() {
    Path target = dir.resolve("missing").resolve("app.tsk");
    assertThrows(IOException.class, () -> FileSystem.writeAtomically(target, new byte[] {1}));
    assertFalse(Files.exists(target));
  }

  @Test
  void testRenameTo() throws IOException {
    Path source = Files.writeString(dir.resolve("a"), "a");
    Path target = Files.writeString(dir.resolve("b"), "b");
    assertTrue(FileSystem.renameTo(source, target));
    assertFalse(Files.exists(source));
    assertEquals("a", Files.readString(target));
  }

  @Test
  void testRenameToRejectsBadArguments() {
    Path missing = dir.resolve("missing");
    assertThrows(IllegalArgumentException.class, () -> FileSystem.renameTo(missing, missing));
    assertThrows(
        IllegalArgumentException.class, () -> FileSystem.renameTo(missing, dir.resolve("x")));
  }

  private List<Path> leftovers() throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(p -> p.getFileName().toString().startsWith(FileSystem.TEMP_PREFIX))
          .collect(Collectors.toList());
    }
  }
}
