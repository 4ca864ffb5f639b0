package tusklang.lang.value;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An ordered, immutable string-keyed map. Two maps are equal only when they hold equal entries
 * in the same order.
 */
public record MapValue(Map<String, Value> entries) implements Value {
    public static final MapValue EMPTY = new MapValue(Map.of());

    public MapValue {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public ValueType type() {
        return ValueType.MAP;
    }

    public @Nullable Value get(String key) {
        return entries.get(key);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MapValue other
               && new ArrayList<>(entries.entrySet()).equals(
            new ArrayList<>(other.entries.entrySet()));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
