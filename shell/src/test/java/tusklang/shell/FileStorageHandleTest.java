package tusklang.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tusklang.lang.Document;
import tusklang.lang.value.StringValue;

class FileStorageHandleTest {

  @TempDir Path dir;

  @Test
  void testSaveAndLoad() throws IOException {
    FileStorageHandle handle = new FileStorageHandle(dir.resolve("app.shell"));
    assertFalse(handle.exists());
    assertThrows(NoSuchFileException.class, handle::read);

    Document doc = new Document();
    doc.setValue("app", "name", new StringValue("Shop"));
    ShellStore.save(doc, handle);

    assertTrue(handle.exists());
    assertEquals(doc, ShellStore.loadDocument(handle));
    try (Stream<Path> files = Files.list(dir)) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void testFailedSaveKeepsPreviousRecord() throws IOException {
    Path target = dir.resolve("missing-dir").resolve("app.shell");
    FileStorageHandle handle = new FileStorageHandle(target);
    ShellStore store = ShellStore.create(handle, ShellOptions.DEFAULT);
    store.createSection("app");
    assertThrows(IOException.class, store::save);
    assertTrue(store.isDirty());
    assertFalse(handle.exists());
  }

  @Test
  void testCorruptFileIsRejected() throws IOException {
    Path path = dir.resolve("app.shell");
    Files.writeString(path, "not a record");
    assertThrows(CorruptionException.class, () -> ShellStore.load(new FileStorageHandle(path)));
  }
}
