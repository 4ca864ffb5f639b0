package tusklang.lang.value;

/**
 * The {@code null} literal.
 */
public record NullValue() implements Value {
    public static final NullValue INSTANCE = new NullValue();

    @Override
    public ValueType type() {
        return ValueType.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
