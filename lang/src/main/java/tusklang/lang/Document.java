/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.lang;

import org.jspecify.annotations.Nullable;
import tusklang.lang.value.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered set of uniquely named {@link Section}s.
 *
 * <p>Section order is insertion order and survives serialization. Replacing a section keeps its
 * position. The document also carries the comment lines that trail its last entry when it was
 * parsed with comments retained.</p>
 *
 * <p>Not thread-safe. A document has a single owner; share it only with external
 * synchronization.</p>
 */
public final class Document {
    private final Map<String, Section> sections = new LinkedHashMap<>();
    private List<String> trailingComments = List.of();

    public Document() {
    }

    public Document(Collection<Section> sections) {
        sections.forEach(this::setSection);
    }

    public @Nullable Section getSection(String name) {
        return sections.get(name);
    }

    public boolean hasSection(String name) {
        return sections.containsKey(name);
    }

    public List<String> getSectionNames() {
        return List.copyOf(sections.keySet());
    }

    public Collection<Section> getSections() {
        return Collections.unmodifiableCollection(sections.values());
    }

    public int size() {
        return sections.size();
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    /**
     * Adds a section, or replaces the section of the same name in its current position.
     */
    public void setSection(Section section) {
        sections.put(section.getName(), Objects.requireNonNull(section));
    }

    /**
     * Appends an empty section unless one with this name exists.
     *
     * @return {@code true} if the section was created
     *
     * @throws IllegalArgumentException if the name is not a valid section name
     */
    public boolean createSection(String name) {
        if (sections.containsKey(name)) {
            return false;
        }
        sections.put(name, Section.empty(name));
        return true;
    }

    /**
     * @return {@code true} if a section was removed
     */
    public boolean deleteSection(String name) {
        return sections.remove(name) != null;
    }

    public @Nullable Value getValue(String section, String key) {
        Section s = sections.get(section);
        return s == null ? null : s.get(key);
    }

    /**
     * Sets one key, creating the section when it does not exist yet.
     */
    public void setValue(String section, String key, Value value) {
        Section s = sections.get(section);
        setSection(s == null ? Section.builder(section).put(key, value).build()
                             : s.with(key, value));
    }

    /**
     * @return {@code true} if the key existed
     */
    public boolean removeValue(String section, String key) {
        Section s = sections.get(section);
        if (s == null || !s.containsKey(key)) {
            return false;
        }
        setSection(s.without(key));
        return true;
    }

    public List<String> getTrailingComments() {
        return trailingComments;
    }

    public void setTrailingComments(List<String> comments) {
        trailingComments = Comments.normalize(comments);
    }

    /**
     * Shallow copy; sections and values are immutable and shared.
     */
    public Document copy() {
        Document d = new Document(sections.values());
        d.trailingComments = trailingComments;
        return d;
    }

    /**
     * Equal when both hold equal sections in the same order and the same trailing comments.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Document other)) {
            return false;
        }
        return new ArrayList<>(sections.values()).equals(new ArrayList<>(other.sections.values()))
               && trailingComments.equals(other.trailingComments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sections, trailingComments);
    }

    @Override
    public String toString() {
        return "Document" + sections.values();
    }
}
