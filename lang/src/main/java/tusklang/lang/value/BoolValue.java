package tusklang.lang.value;

import org.jspecify.annotations.Nullable;

public record BoolValue(boolean value) implements Value {
    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public ValueType type() {
        return ValueType.BOOL;
    }

    @Override
    public String asString(@Nullable String def) {
        return Boolean.toString(value);
    }

    @Override
    public boolean asBoolean(boolean def) {
        return value;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
