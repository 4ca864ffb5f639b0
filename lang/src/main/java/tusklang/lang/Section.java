/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.lang;

import org.jspecify.annotations.Nullable;
import tusklang.lang.value.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A named, ordered group of key/value entries.
 *
 * <p>Sections are immutable. {@link #with(String, Value)} and {@link #without(String)} return a
 * modified copy; the owning {@link Document} replaces the section as a whole. Keys keep their
 * first insertion position when their value is replaced.</p>
 *
 * <p>The typed getters follow the value coercion rules and fall back to the given default for
 * missing keys as well as for values of the wrong type.</p>
 */
public final class Section {
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_.-]*");

    private final String name;
    private final List<String> comments;
    private final Map<String, Entry> entries;

    private Section(String name, List<String> comments, Map<String, Entry> entries) {
        this.name = name;
        this.comments = Comments.normalize(comments);
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Creates a section holding {@code values} in iteration order.
     *
     * @throws IllegalArgumentException if the name is not a valid section name
     */
    public static Section of(String name, Map<String, ? extends Value> values) {
        Builder builder = builder(name);
        values.forEach(builder::put);
        return builder.build();
    }

    public static Section empty(String name) {
        return builder(name).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Whether {@code name} may be used as a section name: a letter, digit or underscore followed
     * by letters, digits, underscores, dots and dashes.
     */
    public static boolean isValidName(String name) {
        return NAME.matcher(name).matches();
    }

    public String getName() {
        return name;
    }

    /**
     * Comment lines written above the section header, verbatim including their markers.
     */
    public List<String> getComments() {
        return comments;
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public Collection<Entry> entries() {
        return entries.values();
    }

    public @Nullable Entry getEntry(String key) {
        return entries.get(key);
    }

    public @Nullable Value get(String key) {
        Entry e = entries.get(key);
        return e == null ? null : e.value();
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Key/value view in insertion order.
     */
    public Map<String, Value> asMap() {
        Map<String, Value> map = new LinkedHashMap<>();
        entries.forEach((k, e) -> map.put(k, e.value()));
        return Collections.unmodifiableMap(map);
    }

    public @Nullable String getString(String key, @Nullable String def) {
        Value v = get(key);
        return v == null ? def : v.asString(def);
    }

    public int getInt(String key, int def) {
        Value v = get(key);
        return v == null ? def : v.asInt(def);
    }

    public long getLong(String key, long def) {
        Value v = get(key);
        return v == null ? def : v.asLong(def);
    }

    public double getDouble(String key, double def) {
        Value v = get(key);
        return v == null ? def : v.asDouble(def);
    }

    public boolean getBoolean(String key, boolean def) {
        Value v = get(key);
        return v == null ? def : v.asBoolean(def);
    }

    public @Nullable BigDecimal getDecimal(String key, @Nullable BigDecimal def) {
        Value v = get(key);
        return v == null ? def : v.asDecimal(def);
    }

    /**
     * Returns a copy with {@code key} set to {@code value}. An existing key keeps its position
     * and its comments.
     */
    public Section with(String key, Value value) {
        Builder b = toBuilder();
        b.put(key, value);
        return b.build();
    }

    /**
     * Returns a copy without {@code key}, or this section if the key is absent.
     */
    public Section without(String key) {
        if (!entries.containsKey(key)) {
            return this;
        }
        Map<String, Entry> copy = new LinkedHashMap<>(entries);
        copy.remove(key);
        return new Section(name, comments, copy);
    }

    public Section withComments(List<String> newComments) {
        return new Section(name, newComments, new LinkedHashMap<>(entries));
    }

    public Builder toBuilder() {
        Builder b = new Builder(name);
        b.comments.addAll(comments);
        b.entries.putAll(entries);
        return b;
    }

    /**
     * Equal when name, comments and entries match, entries in the same order.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Section other)) {
            return false;
        }
        return name.equals(other.name) && comments.equals(other.comments)
               && new ArrayList<>(entries.values()).equals(new ArrayList<>(other.entries.values()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, comments, entries);
    }

    @Override
    public String toString() {
        return "[" + name + "] " + asMap();
    }

    /**
     * Accumulates entries for a section. Putting a key twice replaces the value in place and
     * appends the new comments to the old ones.
     */
    public static final class Builder {
        private final String name;
        private final List<String> comments = new ArrayList<>();
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder(String name) {
            if (!isValidName(name)) {
                throw new IllegalArgumentException("Invalid section name: '" + name + "'");
            }
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public Builder addComments(List<String> lines) {
            comments.addAll(Comments.normalize(lines));
            return this;
        }

        public Builder put(String key, Value value) {
            return put(key, value, List.of());
        }

        public Builder put(String key, Value value, List<String> keyComments) {
            Entry old = entries.get(key);
            if (old != null && !old.comments().isEmpty()) {
                List<String> merged = new ArrayList<>(old.comments());
                merged.addAll(keyComments);
                entries.put(key, new Entry(key, value, merged));
            } else {
                entries.put(key, new Entry(key, value, keyComments));
            }
            return this;
        }

        public Section build() {
            return new Section(name, comments, new LinkedHashMap<>(entries));
        }
    }
}
