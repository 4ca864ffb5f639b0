package tusklang.shell;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import tusklang.lang.Section;
import tusklang.lang.value.ArrayValue;
import tusklang.lang.value.BoolValue;
import tusklang.lang.value.FujsenCode;
import tusklang.lang.value.MapValue;
import tusklang.lang.value.NullValue;
import tusklang.lang.value.NumberValue;
import tusklang.lang.value.StringValue;
import tusklang.lang.value.Value;

class ShellCodecTest {

  private static Section section() {
    return Section.builder("all")
        .addComments(List.of("# header"))
        .put("n", NullValue.INSTANCE)
        .put("t", BoolValue.TRUE, List.of("// flag"))
        .put("f", BoolValue.FALSE)
        .put("big", new NumberValue(new java.math.BigDecimal("1e400")))
        .put("s", new StringValue("héllo\nworld"))
        .put("list", ArrayValue.of(NumberValue.of(1), ArrayValue.EMPTY, MapValue.EMPTY))
        .put("map", new MapValue(Map.of("k", new StringValue("v"))))
        .put("code", FujsenCode.of("(x) => x * 2"))
        .put("anon", new FujsenCode("return 1;", List.of(), null))
        .build();
  }

  @Test
  void testSectionDecodesEqual() throws CorruptionException {
    for (boolean compress : new boolean[] {true, false}) {
      byte[] blob = ShellCodec.encodeSection(section(), compress);
      assertEquals(section(), ShellCodec.decodeSection("all", blob, compress));
    }
  }

  @Test
  void testGzipHeaderIsPinned() {
    byte[] gz = ShellCodec.gzip(new byte[] {1, 2, 3});
    assertEquals((byte) 0x1f, gz[0]);
    assertEquals((byte) 0x8b, gz[1]);
    assertEquals(0, gz[9]);
  }

  @Test
  void testTrailingBytesAreCorruption() {
    byte[] blob = ShellCodec.encodeSection(section(), false);
    byte[] longer = java.util.Arrays.copyOf(blob, blob.length + 1);
    CorruptionException e =
        assertThrows(
            CorruptionException.class, () -> ShellCodec.decodeSection("all", longer, false));
    assertThat(e.getMessage(), containsString("unread"));
  }

  @Test
  void testTruncationIsCorruption() {
    byte[] blob = ShellCodec.encodeSection(section(), false);
    for (int len = 0; len < blob.length; len += 5) {
      byte[] cut = java.util.Arrays.copyOf(blob, len);
      assertThrows(CorruptionException.class, () -> ShellCodec.decodeSection("all", cut, false));
    }
  }

  @Test
  void testUncompressedBlobReadAsCompressedIsCorruption() {
    byte[] blob = ShellCodec.encodeSection(section(), false);
    assertThrows(CorruptionException.class, () -> ShellCodec.decodeSection("all", blob, true));
  }

  @Test
  void testUnknownTagIsCorruption() {
    // no comments, one entry "k" with tag 42
    byte[] blob = {0, 0, 0, 0, 0, 0, 0, 1, 0, 0, 0, 1, 'k', 0, 0, 0, 0, 42};
    CorruptionException e =
        assertThrows(CorruptionException.class, () -> ShellCodec.decodeSection("s", blob, false));
    assertThat(e.getMessage(), containsString("42"));
  }

  @Test
  void testDeepNestingIsRejected() {
    Value v = NumberValue.of(1);
    for (int i = 0; i < ShellFormat.MAX_NESTING + 2; i++) {
      v = ArrayValue.of(v);
    }
    Section deep = Section.empty("deep").with("v", v);
    assertThrows(IllegalArgumentException.class, () -> ShellCodec.encodeSection(deep, false));
  }
}
