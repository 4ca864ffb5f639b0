package tusklang.lang.value;

import java.util.List;

/**
 * An ordered, immutable list of values.
 */
public record ArrayValue(List<Value> items) implements Value {
    public static final ArrayValue EMPTY = new ArrayValue(List.of());

    public ArrayValue {
        items = List.copyOf(items);
    }

    public static ArrayValue of(Value... items) {
        return new ArrayValue(List.of(items));
    }

    @Override
    public ValueType type() {
        return ValueType.ARRAY;
    }

    public int size() {
        return items.size();
    }

    public Value get(int index) {
        return items.get(index);
    }
}
