/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.lang.value;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Conversions between {@link Value}s, literal text and plain Java objects.
 */
public final class Values {

    /**
     * Decimal literal grammar shared by the parser and by string-to-number coercion.
     */
    public static final Pattern NUMBER_LITERAL =
        Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private Values() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Classifies an unquoted word: {@code true}, {@code false} and {@code null} are keywords,
     * anything matching {@link #NUMBER_LITERAL} is a number and everything else is a string.
     */
    public static Value scalar(String bare) {
        switch (bare) {
            case "true":
                return BoolValue.TRUE;
            case "false":
                return BoolValue.FALSE;
            case "null":
                return NullValue.INSTANCE;
            default:
                NumberValue number = parseNumber(bare);
                return number != null ? number : new StringValue(bare);
        }
    }

    /**
     * @return the number {@code text} spells, or {@code null} if it is not a decimal literal
     */
    public static @Nullable NumberValue parseNumber(String text) {
        if (!NUMBER_LITERAL.matcher(text).matches()) {
            return null;
        }
        try {
            return new NumberValue(new BigDecimal(text));
        } catch (NumberFormatException e) {
            // exponent out of int range
            return null;
        }
    }

    /**
     * Converts a host object into a value.
     *
     * <p>Accepted: {@code null}, {@link Value}, {@link Boolean}, any {@link Number} with a
     * finite value, {@link CharSequence}, {@link Character}, arrays and {@link Collection}s of
     * accepted objects, and {@link Map}s with string keys.</p>
     *
     * @throws IllegalArgumentException if the object, or anything nested in it, has no value
     *                                  representation
     */
    public static Value of(@Nullable Object o) {
        if (o == null) {
            return NullValue.INSTANCE;
        }
        if (o instanceof Value v) {
            return v;
        }
        if (o instanceof Boolean b) {
            return BoolValue.of(b);
        }
        if (o instanceof BigDecimal d) {
            return new NumberValue(d);
        }
        if (o instanceof BigInteger i) {
            return new NumberValue(new BigDecimal(i));
        }
        if (o instanceof Double || o instanceof Float) {
            return NumberValue.of(((Number) o).doubleValue());
        }
        if (o instanceof Long || o instanceof Integer || o instanceof Short
            || o instanceof Byte) {
            return NumberValue.of(((Number) o).longValue());
        }
        if (o instanceof CharSequence || o instanceof Character) {
            return new StringValue(o.toString());
        }
        if (o instanceof Object[] array) {
            return of(List.of(array));
        }
        if (o instanceof Collection<?> c) {
            List<Value> items = new ArrayList<>(c.size());
            for (Object item : c) {
                items.add(of(item));
            }
            return new ArrayValue(items);
        }
        if (o instanceof Map<?, ?> m) {
            Map<String, Value> entries = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet()) {
                if (!(e.getKey() instanceof String key)) {
                    throw new IllegalArgumentException(
                        "Map key is not a string: " + e.getKey());
                }
                entries.put(key, of(e.getValue()));
            }
            return new MapValue(entries);
        }
        throw new IllegalArgumentException(
            "No value representation for " + o.getClass().getName());
    }

    /**
     * Converts a value into plain Java objects: {@code null}, {@link Boolean},
     * {@link BigDecimal}, {@link String}, {@link List} and insertion-ordered {@link Map}.
     * Code values convert to their body text.
     */
    public static @Nullable Object toJava(Value value) {
        if (value instanceof BoolValue b) {
            return b.value();
        }
        if (value instanceof NumberValue n) {
            return n.value();
        }
        if (value instanceof StringValue s) {
            return s.value();
        }
        if (value instanceof ArrayValue a) {
            List<@Nullable Object> list = new ArrayList<>(a.size());
            for (Value item : a.items()) {
                list.add(toJava(item));
            }
            return list;
        }
        if (value instanceof MapValue m) {
            Map<String, @Nullable Object> map = new LinkedHashMap<>();
            m.entries().forEach((k, v) -> map.put(k, toJava(v)));
            return map;
        }
        if (value instanceof FujsenCode f) {
            return f.body();
        }
        return null;
    }

    /**
     * Whether a code value occurs anywhere in {@code value}, including nested containers.
     */
    public static boolean containsFujsen(Value value) {
        if (value instanceof FujsenCode) {
            return true;
        }
        if (value instanceof ArrayValue a) {
            return a.items().stream().anyMatch(Values::containsFujsen);
        }
        if (value instanceof MapValue m) {
            return m.entries().values().stream().anyMatch(Values::containsFujsen);
        }
        return false;
    }
}
