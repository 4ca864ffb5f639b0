/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.lang.value;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An exact decimal number.
 *
 * <p>Equality is numeric: {@code 3.50} equals {@code 3.5}. The canonical text is the plain
 * decimal form without trailing zeros, so {@code 1e3} renders as {@code 1000}. Numbers whose
 * scale lies beyond {@value #MAX_PLAIN_SCALE} in either direction render in scientific notation
 * instead, which keeps {@code 1e999999} from expanding into a million digits.</p>
 */
public record NumberValue(BigDecimal value) implements Value {
    static final int MAX_PLAIN_SCALE = 64;

    public NumberValue {
        Objects.requireNonNull(value, "value");
    }

    public static NumberValue of(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    /**
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public static NumberValue of(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Not a finite number: " + value);
        }
        return new NumberValue(BigDecimal.valueOf(value));
    }

    @Override
    public ValueType type() {
        return ValueType.NUMBER;
    }

    /**
     * Canonical text of this number; parsing it yields an equal number.
     */
    public String canonical() {
        if (value.signum() == 0) {
            return "0";
        }
        BigDecimal stripped = value.stripTrailingZeros();
        int scale = stripped.scale();
        if (scale > MAX_PLAIN_SCALE || scale < -MAX_PLAIN_SCALE) {
            return stripped.toString();
        }
        return stripped.toPlainString();
    }

    public boolean isIntegral() {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    @Override
    public String asString(@Nullable String def) {
        return canonical();
    }

    @Override
    public int asInt(int def) {
        if (!isIntegral()) {
            return def;
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            return def;
        }
    }

    @Override
    public long asLong(long def) {
        if (!isIntegral()) {
            return def;
        }
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            return def;
        }
    }

    @Override
    public double asDouble(double def) {
        double d = value.doubleValue();
        return Double.isFinite(d) ? d : def;
    }

    @Override
    public BigDecimal asDecimal(@Nullable BigDecimal def) {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NumberValue other && value.compareTo(other.value) == 0;
    }

    @Override
    public int hashCode() {
        return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
    }

    @Override
    public String toString() {
        return canonical();
    }
}
