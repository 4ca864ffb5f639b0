package tusklang.tsk;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tusklang.fujsen.FujsenDefinition;
import tusklang.fujsen.FujsenEngine;
import tusklang.fujsen.FujsenEvaluator;
import tusklang.fujsen.UndefinedVariableException;
import tusklang.lang.Document;
import tusklang.lang.Section;
import tusklang.lang.TskFormatException;
import tusklang.lang.value.NumberValue;
import tusklang.lang.value.StringValue;
import tusklang.lang.value.Value;
import tusklang.shell.CorruptionException;
import tusklang.shell.FileStorageHandle;
import tusklang.shell.MemoryStorageHandle;

class TskTest {

  /** Adds every bound number. */
  private static final FujsenEvaluator SUM =
      (body, params, bindings) -> {
        BigDecimal sum = BigDecimal.ZERO;
        for (Object v : bindings.values()) {
          sum = sum.add((BigDecimal) v);
        }
        return sum;
      };

  private static final String CONFIG =
      """
      [app]
      name = "Demo"
      count = 3

      [billing]
      # computes a total
      total = \"\"\"
      function total(price, fee) {
          return price + fee;
      }
      \"\"\"
      fujsen = \"\"\"
      return base + extra;
      \"\"\"
      currency = EUR
      """;

  @TempDir Path dir;

  @Test
  void testExampleScenario() throws TskFormatException {
    Document doc = Tsk.parse("[app]\nname = \"Demo\"\ncount = 3\n");
    assertThat(doc.getSectionNames(), contains("app"));
    assertEquals(new StringValue("Demo"), doc.getValue("app", "name"));
    assertEquals(NumberValue.of(3), doc.getValue("app", "count"));
    assertEquals(doc, Tsk.parse(Tsk.stringify(doc)));
  }

  @Test
  void testFromStringKeepsComments() throws TskFormatException {
    Tsk tsk = Tsk.fromString(CONFIG);
    assertThat(tsk.toString(), containsString("# computes a total\ntotal = "));
    assertEquals(tsk.getDocument(), Tsk.parseWithComments(tsk.toString()));
  }

  @Test
  void testFileRoundTrip() throws IOException, TskFormatException {
    Tsk tsk = Tsk.fromString(CONFIG);
    tsk.setValue("app", "count", 4);
    Path file = dir.resolve("app.tsk");
    tsk.toFile(file);
    Tsk read = Tsk.fromFile(file);
    assertEquals(4, read.getSection("app").getInt("count", 0));
    assertEquals(tsk.getDocument(), read.getDocument());
  }

  @Test
  void testFromFileReportsPosition() throws IOException {
    Path file = Files.writeString(dir.resolve("bad.tsk"), "[app]\nname = \"open\n");
    TskFormatException e = assertThrows(TskFormatException.class, () -> Tsk.fromFile(file));
    assertEquals(2, e.getLine());
  }

  @Test
  void testShellSaveAndLoad() throws IOException, TskFormatException {
    Tsk tsk = Tsk.fromString(CONFIG);
    MemoryStorageHandle handle = new MemoryStorageHandle("mem");
    assertSame(handle, tsk.save(handle));
    assertEquals(tsk.getDocument(), Tsk.load(handle));
    assertEquals(tsk.getDocument(), Tsk.fromShell(handle).getDocument());

    FileStorageHandle file = new FileStorageHandle(dir.resolve("app.shell"));
    Tsk.save(tsk.getDocument(), file);
    assertEquals(tsk.getDocument(), Tsk.load(file));
  }

  @Test
  void testLoadRejectsTskText() throws IOException {
    Path file = Files.writeString(dir.resolve("app.shell"), CONFIG);
    assertThrows(CorruptionException.class, () -> Tsk.load(new FileStorageHandle(file)));
  }

  @Test
  void testSectionOperations() throws TskFormatException {
    Tsk tsk = Tsk.fromString(CONFIG);
    tsk.setSection("db", Map.of("port", 5432));
    assertEquals(5432, tsk.getSection("db").getInt("port", 0));
    tsk.setSection(Section.empty("cache"));
    assertThat(tsk.getDocument().getSectionNames(), contains("app", "billing", "db", "cache"));
    assertTrue(tsk.deleteSection("app"));
    assertFalse(tsk.deleteSection("app"));
    assertNull(tsk.getSection("app"));
    assertNull(tsk.getValue("app", "name"));
  }

  @Test
  void testSetValueRejectsUnsupportedTypes() {
    Tsk tsk = new Tsk();
    assertThrows(IllegalArgumentException.class, () -> tsk.setValue("a", "b", new Object()));
  }

  @Test
  void testExecuteFujsen() throws Exception {
    Tsk tsk = Tsk.fromString(CONFIG).withEngine(new FujsenEngine(SUM));
    Value total =
        tsk.executeFujsen(
            "billing", "total", Map.of("price", NumberValue.of(10), "fee", NumberValue.of(2)));
    assertEquals(NumberValue.of(12), total);
  }

  @Test
  void testExecuteFujsenDefaultKey() throws Exception {
    Tsk tsk = Tsk.fromString(CONFIG).withEngine(new FujsenEngine(SUM));
    Map<String, Value> context = Map.of("base", NumberValue.of(1), "extra", NumberValue.of(2));
    assertEquals(NumberValue.of(3), tsk.executeFujsen("billing", context));
    assertEquals(NumberValue.of(3), tsk.executeFujsen("billing", "", context));
  }

  @Test
  void testExecuteFujsenMissingVariable() throws TskFormatException {
    Tsk tsk = Tsk.fromString(CONFIG).withEngine(new FujsenEngine(SUM));
    UndefinedVariableException e =
        assertThrows(
            UndefinedVariableException.class,
            () -> tsk.executeFujsen("billing", Map.of("base", NumberValue.of(1))));
    assertEquals(List.of("extra"), e.getNames());
  }

  @Test
  void testExecuteFujsenContractViolations() throws TskFormatException {
    Tsk tsk = Tsk.fromString(CONFIG);
    assertThrows(
        IllegalStateException.class, () -> tsk.executeFujsen("billing", "total", Map.of()));
    tsk.withEngine(new FujsenEngine(SUM));
    assertThrows(
        IllegalArgumentException.class, () -> tsk.executeFujsen("billing", "missing", Map.of()));
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> tsk.executeFujsen("billing", "currency", Map.of()));
    assertThat(e.getMessage(), containsString("string"));
  }

  @Test
  void testCallFujsenBindsArgumentsInOrder() throws Exception {
    Tsk tsk = Tsk.fromString(CONFIG).withEngine(new FujsenEngine(SUM));
    assertEquals(NumberValue.of(7), tsk.callFujsen("billing", "total", 5, 2));
    assertThrows(IllegalArgumentException.class, () -> tsk.callFujsen("billing", "total", 5));
  }

  @Test
  void testGetFujsenMap() throws TskFormatException {
    Tsk tsk = Tsk.fromString(CONFIG).withEngine(new FujsenEngine(SUM));
    Map<String, FujsenDefinition> map = tsk.getFujsenMap("billing");
    assertThat(map.keySet(), contains("total", "fujsen"));
    assertEquals("total", map.get("total").name());
    assertEquals("fujsen", map.get("fujsen").name());
    assertEquals(List.of("base", "extra"), map.get("fujsen").freeVariables());
    assertTrue(tsk.getFujsenMap("app").isEmpty());
    assertTrue(tsk.getFujsenMap("missing").isEmpty());
  }

  @Test
  void testSetFujsen() throws Exception {
    Tsk tsk = new Tsk().withEngine(new FujsenEngine(SUM));
    tsk.setFujsen("math", "add", "(a, b) => a + b");
    assertEquals(NumberValue.of(5), tsk.callFujsen("math", "add", 2, 3));
    String text = tsk.toString();
    assertThat(text, containsString("\"\"\"\n(a, b) => a + b\n\"\"\""));
    assertEquals(tsk.getDocument(), Tsk.parse(text));
  }
}
