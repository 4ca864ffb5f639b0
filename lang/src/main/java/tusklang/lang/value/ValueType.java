package tusklang.lang.value;

/**
 * The variants a {@link Value} can take.
 */
public enum ValueType {
    NULL,
    BOOL,
    NUMBER,
    STRING,
    ARRAY,
    MAP,
    FUJSEN;

    /**
     * Whether values of this type can stand inline on a single line without nesting.
     */
    public boolean isScalar() {
        return this == NULL || this == BOOL || this == NUMBER || this == STRING;
    }
}
