package tusklang.lang.value;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.Objects;

public record StringValue(String value) implements Value {

    public StringValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public ValueType type() {
        return ValueType.STRING;
    }

    @Override
    public String asString(@Nullable String def) {
        return value;
    }

    @Override
    public int asInt(int def) {
        var number = Values.parseNumber(value);
        return number == null ? def : number.asInt(def);
    }

    @Override
    public long asLong(long def) {
        var number = Values.parseNumber(value);
        return number == null ? def : number.asLong(def);
    }

    @Override
    public double asDouble(double def) {
        var number = Values.parseNumber(value);
        return number == null ? def : number.asDouble(def);
    }

    @Override
    public @Nullable BigDecimal asDecimal(@Nullable BigDecimal def) {
        var number = Values.parseNumber(value);
        return number == null ? def : number.value();
    }

    @Override
    public boolean asBoolean(boolean def) {
        return switch (value) {
            case "true" -> true;
            case "false" -> false;
            default -> def;
        };
    }

    @Override
    public String toString() {
        return value;
    }
}
