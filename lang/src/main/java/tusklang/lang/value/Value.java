/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.lang.value;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;

/**
 * An immutable configuration value.
 *
 * <p>The typed accessors implement a fixed coercion table and never throw: when a value cannot
 * be represented as the requested type the caller's default is returned. Only scalars coerce;
 * arrays, maps and code are never flattened into a string or number.</p>
 *
 * <table>
 *   <caption>Coercions</caption>
 *   <tr><th>from</th><th>to</th><th>rule</th></tr>
 *   <tr><td>Bool</td><td>String</td><td>{@code "true"} / {@code "false"}</td></tr>
 *   <tr><td>Number</td><td>String</td><td>canonical decimal rendering</td></tr>
 *   <tr><td>Number</td><td>int / long</td><td>only when integral and in range</td></tr>
 *   <tr><td>String</td><td>Number</td><td>decimal literal, no surrounding whitespace</td></tr>
 *   <tr><td>String</td><td>Bool</td><td>exactly {@code "true"} or {@code "false"}</td></tr>
 * </table>
 */
public interface Value {

    ValueType type();

    default boolean isNull() {
        return type() == ValueType.NULL;
    }

    default @Nullable String asString(@Nullable String def) {
        return def;
    }

    default int asInt(int def) {
        return def;
    }

    default long asLong(long def) {
        return def;
    }

    default double asDouble(double def) {
        return def;
    }

    default boolean asBoolean(boolean def) {
        return def;
    }

    default @Nullable BigDecimal asDecimal(@Nullable BigDecimal def) {
        return def;
    }
}
