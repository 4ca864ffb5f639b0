package tusklang.lang;

import tusklang.lang.value.Value;

import java.util.List;
import java.util.Objects;

/**
 * A key, its value, and the comment lines written immediately above it.
 *
 * @see Comments#normalize(List)
 */
public record Entry(String key, Value value, List<String> comments) {

    public Entry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        comments = Comments.normalize(comments);
    }

    public Entry(String key, Value value) {
        this(key, value, List.of());
    }
}
