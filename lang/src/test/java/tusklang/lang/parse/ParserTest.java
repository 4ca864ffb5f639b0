package tusklang.lang.parse;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;
import tusklang.lang.Document;
import tusklang.lang.Section;
import tusklang.lang.TskFormatException;
import tusklang.lang.lex.LexException;
import tusklang.lang.value.ArrayValue;
import tusklang.lang.value.BoolValue;
import tusklang.lang.value.FujsenCode;
import tusklang.lang.value.MapValue;
import tusklang.lang.value.NullValue;
import tusklang.lang.value.NumberValue;
import tusklang.lang.value.StringValue;
import tusklang.lang.value.ValueType;

class ParserTest {

  private static final String SAMPLE =
      "# application settings\n"
          + "[app]\n"
          + "name = \"My App\"\n"
          + "version = 1.0\n"
          + "debug = true\n"
          + "\n"
          + "[database]\n"
          + "host: localhost\n"
          + "port = 5432\n"
          + "replicas = [db1, db2, \"db 3\"]\n"
          + "pool = { min = 1, max = 10 }\n"
          + "\n"
          + "[calc]\n"
          + "fujsen = \"\"\"\n"
          + "function total(price, qty) {\n"
          + "  return price * qty;\n"
          + "}\n"
          + "\"\"\"\n";

  @Test
  void testSample() throws TskFormatException {
    Document doc = Parser.parse(SAMPLE);
    assertEquals(List.of("app", "database", "calc"), doc.getSectionNames());

    Section app = doc.getSection("app");
    assertNotNull(app);
    assertEquals(new StringValue("My App"), app.get("name"));
    assertEquals(new NumberValue(new BigDecimal("1")), app.get("version"));
    assertEquals("1", app.getString("version", null));
    assertTrue(app.getBoolean("debug", false));

    Section db = doc.getSection("database");
    assertNotNull(db);
    assertEquals("localhost", db.getString("host", null));
    assertEquals(5432, db.getInt("port", 0));
    assertEquals(
        ArrayValue.of(new StringValue("db1"), new StringValue("db2"), new StringValue("db 3")),
        db.get("replicas"));
    MapValue pool = (MapValue) db.get("pool");
    assertNotNull(pool);
    assertThat(pool.entries().keySet(), contains("min", "max"));

    FujsenCode code = (FujsenCode) doc.getValue("calc", "fujsen");
    assertNotNull(code);
    assertEquals("function total(price, qty) {\n  return price * qty;\n}", code.body());
    assertEquals(List.of("price", "qty"), code.parameters());
    assertEquals("total", code.name());
  }

  @Test
  void testParseDropsComments() throws TskFormatException {
    Document doc = Parser.parse(SAMPLE);
    assertTrue(doc.getSection("app").getComments().isEmpty());
    assertTrue(doc.getTrailingComments().isEmpty());
  }

  @Test
  void testParseWithCommentsAttachesToFollowingItem() throws TskFormatException {
    Document doc =
        Parser.parseWithComments(
            "# head\n[s]\n// about a\na = 1 # inline\nb = 2\n/* tail */\n");
    Section s = doc.getSection("s");
    assertEquals(List.of("# head"), s.getComments());
    assertEquals(List.of("// about a"), s.getEntry("a").comments());
    assertEquals(List.of("# inline"), s.getEntry("b").comments());
    assertEquals(List.of("/* tail */"), doc.getTrailingComments());
  }

  @Test
  void testKeywordsAndNumbers() throws TskFormatException {
    Section s = Parser.parse("[s]\na = null\nb = false\nc = -1.5e2\nd = 1.2.3\ne = 'true'\n")
        .getSection("s");
    assertEquals(NullValue.INSTANCE, s.get("a"));
    assertEquals(BoolValue.FALSE, s.get("b"));
    assertEquals(new NumberValue(new BigDecimal("-150")), s.get("c"));
    assertEquals(new StringValue("1.2.3"), s.get("d"));
    assertEquals(new StringValue("true"), s.get("e"));
  }

  @Test
  void testDuplicateKeyLastWinsInPlace() throws TskFormatException {
    Section s = Parser.parse("[s]\na = 1\nb = 2\na = 3\n").getSection("s");
    assertThat(s.keys(), contains("a", "b"));
    assertEquals(3, s.getInt("a", 0));
  }

  @Test
  void testDuplicateSectionsMerge() throws TskFormatException {
    Document doc = Parser.parse("[a]\nx = 1\n[b]\ny = 2\n[a]\nx = 9\nz = 3\n");
    assertEquals(List.of("a", "b"), doc.getSectionNames());
    Section a = doc.getSection("a");
    assertThat(a.keys(), contains("x", "z"));
    assertEquals(9, a.getInt("x", 0));
  }

  @Test
  void testMultilineContainersAndObjectBlock() throws TskFormatException {
    Document doc =
        Parser.parse(
            "[s]\n"
                + "list = [\n"
                + "    1,\n"
                + "    2\n"
                + "    3,\n"
                + "]\n"
                + "server {\n"
                + "    host = example.org\n"
                + "    ports = [80, 443]\n"
                + "    tls: { enabled = true }\n"
                + "}\n");
    ArrayValue list = (ArrayValue) doc.getValue("s", "list");
    assertEquals(3, list.size());
    MapValue server = (MapValue) doc.getValue("s", "server");
    assertEquals(new StringValue("example.org"), server.get("host"));
    assertEquals(ValueType.ARRAY, server.get("ports").type());
    assertEquals(ValueType.MAP, server.get("tls").type());
  }

  @Test
  void testHeredocInsideArray() throws TskFormatException {
    ArrayValue a =
        (ArrayValue) Parser.parse("[s]\nfns = [\n\"\"\"\nx => x\n\"\"\"\n]\n").getValue("s", "fns");
    assertEquals(FujsenCode.of("x => x"), a.get(0));
  }

  @Test
  void testKeyBeforeSection() {
    ParseException e = assertThrows(ParseException.class, () -> Parser.parse("a = 1\n"));
    assertEquals(1, e.getLine());
    assertEquals(1, e.getColumn());
  }

  @Test
  void testMissingValue() {
    ParseException e = assertThrows(ParseException.class, () -> Parser.parse("[s]\na =\nb = 1"));
    assertEquals(2, e.getLine());
    assertThat(e.getMessage(), containsString("Expected a value"));
  }

  @Test
  void testMissingAssignment() {
    ParseException e = assertThrows(ParseException.class, () -> Parser.parse("[s]\na b\n"));
    assertEquals(2, e.getLine());
    assertEquals(3, e.getColumn());
  }

  @Test
  void testTrailingGarbageAfterHeader() {
    assertThrows(ParseException.class, () -> Parser.parse("[s] x = 1\n"));
  }

  @Test
  void testArraySeparators() {
    assertThrows(ParseException.class, () -> Parser.parse("[s]\na = [1,,2]\n"));
    assertThrows(ParseException.class, () -> Parser.parse("[s]\na = [,1]\n"));
    assertThrows(ParseException.class, () -> Parser.parse("[s]\na = [1, 2\n"));
    assertThrows(ParseException.class, () -> Parser.parse("[s]\na = { k = 1, , k2 = 2 }\n"));
  }

  @Test
  void testUnterminatedContainer() {
    ParseException e = assertThrows(ParseException.class, () -> Parser.parse("[s]\na = [1,\n"));
    assertThat(e.getMessage(), containsString("Unterminated array"));
  }

  @Test
  void testNestingLimit() throws TskFormatException {
    String shallow = "[s]\na = " + "[".repeat(3) + "]".repeat(3) + "\n";
    assertNotNull(new Parser(shallow, ParserOptions.DEFAULT.withMaxDepth(3)).parseDocument());
    String deep = "[s]\na = " + "[".repeat(4) + "]".repeat(4) + "\n";
    assertThrows(
        ParseException.class,
        () -> new Parser(deep, ParserOptions.DEFAULT.withMaxDepth(3)).parseDocument());
    String hostile = "[s]\na = " + "[".repeat(100_000);
    assertThrows(ParseException.class, () -> Parser.parse(hostile));
  }

  @Test
  void testLexErrorsPropagate() {
    assertThrows(LexException.class, () -> Parser.parse("[s]\na = \"open\n"));
  }

  @Test
  void testEmptyInput() throws TskFormatException {
    assertTrue(Parser.parse("").isEmpty());
    assertTrue(Parser.parse("\n\n# only a comment\n").isEmpty());
    assertTrue(Parser.parse("[empty]").getSection("empty").isEmpty());
  }
}
