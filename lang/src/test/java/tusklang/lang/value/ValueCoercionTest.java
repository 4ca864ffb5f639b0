package tusklang.lang.value;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class ValueCoercionTest {

  @Nested
  @DisplayName("to string")
  class ToString {
    @Test
    void testBoolRendersKeyword() {
      assertEquals("true", BoolValue.TRUE.asString("x"));
      assertEquals("false", BoolValue.FALSE.asString("x"));
    }

    @Test
    void testBoolIgnoresNullDefault() {
      Value v = BoolValue.TRUE;
      assertEquals("true", v.asString(null));
      assertEquals("false", BoolValue.FALSE.asString(null));
    }

    @ParameterizedTest
    @CsvSource({"3.50, 3.5", "1e3, 1000", "-0.0, 0", "+7, 7", "0.000100, 0.0001", "12, 12"})
    void testNumberRendersCanonically(String literal, String expected) {
      assertEquals(expected, new NumberValue(new BigDecimal(literal)).asString(null));
    }

    @Test
    void testHugeExponentStaysScientific() {
      String text = new NumberValue(new BigDecimal("1e999999")).asString(null);
      assertEquals("1E+999999", text);
      assertEquals(Values.parseNumber(text), new NumberValue(new BigDecimal("1e999999")));
    }

    @Test
    void testContainersUseDefault() {
      assertEquals("d", ArrayValue.of(new StringValue("a")).asString("d"));
      assertEquals("d", MapValue.EMPTY.asString("d"));
      assertEquals("d", FujsenCode.of("return 1").asString("d"));
      assertEquals("d", NullValue.INSTANCE.asString("d"));
      assertNull(NullValue.INSTANCE.asString(null));
    }
  }

  @Nested
  @DisplayName("to number")
  class ToNumber {
    @Test
    void testIntegralNumbers() {
      assertEquals(42, new NumberValue(new BigDecimal("42.000")).asInt(-1));
      assertEquals(-1, new NumberValue(new BigDecimal("42.5")).asInt(-1));
      assertEquals(-1, NumberValue.of(Long.MAX_VALUE).asInt(-1));
      assertEquals(Long.MAX_VALUE, NumberValue.of(Long.MAX_VALUE).asLong(-1));
      assertEquals(42.5, new NumberValue(new BigDecimal("42.5")).asDouble(0), 0.0);
    }

    @Test
    void testStringParsesDecimalLiterals() {
      assertEquals(8080, new StringValue("8080").asInt(-1));
      assertEquals(1000, new StringValue("1e3").asInt(-1));
      assertEquals(2.5, new StringValue("2.5").asDouble(0), 0.0);
      assertEquals(new BigDecimal("2.5"), new StringValue("2.5").asDecimal(null));
    }

    @ParameterizedTest
    @ValueSource(strings = {" 3", "3 ", "0x10", "1_000", "abc", "", "NaN", "Infinity"})
    void testStringWithoutDecimalLiteralUsesDefault(String text) {
      assertEquals(-1, new StringValue(text).asInt(-1));
      assertEquals(-1.0, new StringValue(text).asDouble(-1.0), 0.0);
    }

    @Test
    void testNonNumbersUseDefault() {
      assertEquals(7, BoolValue.TRUE.asInt(7));
      assertEquals(7, NullValue.INSTANCE.asInt(7));
      assertEquals(7L, ArrayValue.EMPTY.asLong(7L));
    }
  }

  @Nested
  @DisplayName("to boolean")
  class ToBoolean {
    @Test
    void testExactKeywordsOnly() {
      assertTrue(new StringValue("true").asBoolean(false));
      assertFalse(new StringValue("false").asBoolean(true));
      assertTrue(new StringValue("TRUE").asBoolean(true));
      assertFalse(new StringValue("yes").asBoolean(false));
      assertFalse(NumberValue.of(1).asBoolean(false));
    }
  }

  @Test
  void testNumberEqualityIsNumeric() {
    assertEquals(new NumberValue(new BigDecimal("3.50")), new NumberValue(new BigDecimal("3.5")));
    assertEquals(
        new NumberValue(new BigDecimal("3.50")).hashCode(),
        new NumberValue(new BigDecimal("3.5")).hashCode());
    assertEquals(NumberValue.of(0), new NumberValue(new BigDecimal("0.00")));
  }

  @Test
  void testMapEqualityIsOrderSensitive() {
    MapValue ab = (MapValue) Values.of(orderedMap("a", 1, "b", 2));
    MapValue ba = (MapValue) Values.of(orderedMap("b", 2, "a", 1));
    assertNotEquals(ab, ba);
    assertEquals(ab, Values.of(orderedMap("a", 1, "b", 2)));
  }

  @Test
  void testScalarClassification() {
    assertEquals(BoolValue.TRUE, Values.scalar("true"));
    assertEquals(NullValue.INSTANCE, Values.scalar("null"));
    assertEquals(new StringValue("True"), Values.scalar("True"));
    assertEquals(NumberValue.of(5), Values.scalar("+5"));
    assertEquals(new NumberValue(new BigDecimal("0.5")), Values.scalar(".5"));
    assertEquals(new StringValue("1.2.3"), Values.scalar("1.2.3"));
    assertEquals(new StringValue("1e99999999999"), Values.scalar("1e99999999999"));
  }

  @Test
  void testOfAndToJava() {
    Value v = Values.of(Map.of("list", List.of(1, 2.5, "x", true)));
    assertEquals(ValueType.MAP, v.type());
    Object back = Values.toJava(v);
    assertEquals(
        Map.of("list", List.of(BigDecimal.ONE, new BigDecimal("2.5"), "x", true)), back);
    assertNull(Values.toJava(NullValue.INSTANCE));
  }

  @Test
  void testOfRejectsUnrepresentable() {
    assertThrows(IllegalArgumentException.class, () -> Values.of(Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> Values.of(new Object()));
    assertThrows(IllegalArgumentException.class, () -> Values.of(Map.of(1, "x")));
    assertThrows(IllegalArgumentException.class, () -> Values.of(List.of(Double.NaN)));
  }

  @Test
  void testContainsFujsen() {
    assertTrue(Values.containsFujsen(ArrayValue.of(FujsenCode.of("x"))));
    assertTrue(Values.containsFujsen(Values.of(Map.of("f", FujsenCode.of("x")))));
    assertFalse(Values.containsFujsen(Values.of(List.of(1, "a"))));
  }

  private static Map<String, Object> orderedMap(String k1, Object v1, String k2, Object v2) {
    Map<String, Object> m = new java.util.LinkedHashMap<>();
    m.put(k1, v1);
    m.put(k2, v2);
    return m;
  }
}
