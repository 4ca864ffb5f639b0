/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.shell;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tusklang.lang.Document;
import tusklang.lang.Section;

import java.io.IOException;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link Document} bound to a {@link StorageHandle}.
 *
 * <p>Section operations work on the in-memory document and only mark the store dirty; nothing
 * reaches the handle until {@link #save()}. A save writes the whole record atomically. Sections
 * that have not changed since the last load or save keep their stored blobs and are not encoded
 * again.</p>
 *
 * <p>Not thread-safe. A store has a single owner, and saves to one handle from several stores
 * must be serialized by the caller.</p>
 */
public final class ShellStore {
    private static final Logger logger = LoggerFactory.getLogger(ShellStore.class);

    private final StorageHandle handle;
    private final ShellOptions options;
    private final Document document;

    /** Sections as last loaded or saved, with their stored blobs. */
    private final Map<Section, byte[]> storedBlobs = new IdentityHashMap<>();
    private List<Section> storedSections = List.of();
    private List<String> storedTrailing = List.of();
    private boolean dirty;
    private int lastEncodedCount;

    private ShellStore(StorageHandle handle, ShellOptions options, Document document) {
        this.handle = Objects.requireNonNull(handle, "handle");
        this.options = options;
        this.document = document;
    }

    /**
     * A store holding an empty document. The handle is not touched until {@link #save()}.
     */
    public static ShellStore create(StorageHandle handle, ShellOptions options) {
        ShellStore store = new ShellStore(handle, options, new Document());
        store.dirty = true;
        return store;
    }

    /**
     * A store holding {@code document}, which is taken over and not copied.
     */
    public static ShellStore wrap(Document document, StorageHandle handle, ShellOptions options) {
        ShellStore store = new ShellStore(handle, options, document);
        store.dirty = true;
        return store;
    }

    /**
     * Loads the record stored at {@code handle}. Later saves keep the record's compression.
     *
     * @throws CorruptionException if the record fails validation or does not decode
     * @throws UnsupportedVersionException if the record's version is not readable
     * @throws IOException if the handle cannot be read
     */
    public static ShellStore load(StorageHandle handle) throws IOException {
        ShellRecord record = ShellRecord.read(handle.read());
        ShellStore store = new ShellStore(handle, new ShellOptions(record.isCompressed()),
                                          record.toDocument());
        store.remember(record.blobs());
        logger.debug("Loaded {} from {}", record, handle.getName());
        return store;
    }

    /**
     * Loads {@code handle} if it holds a record, otherwise starts an empty store.
     */
    public static ShellStore open(StorageHandle handle, ShellOptions options) throws IOException {
        return handle.exists() ? load(handle) : create(handle, options);
    }

    public static Document loadDocument(StorageHandle handle) throws IOException {
        return ShellRecord.read(handle.read()).toDocument();
    }

    /**
     * Writes {@code document} to {@code handle} with default options.
     *
     * @return {@code handle}
     */
    public static StorageHandle save(Document document, StorageHandle handle) throws IOException {
        return save(document, handle, ShellOptions.DEFAULT);
    }

    public static StorageHandle save(Document document, StorageHandle handle,
                                     ShellOptions options) throws IOException {
        wrap(document, handle, options).save();
        return handle;
    }

    /**
     * Encodes the document and atomically replaces the stored record. On failure the previous
     * record stays in place and the store stays dirty.
     */
    public void save() throws IOException {
        Map<String, byte[]> blobs = new LinkedHashMap<>();
        Map<Section, byte[]> encoded = new IdentityHashMap<>();
        int fresh = 0;
        for (Section section : document.getSections()) {
            byte[] blob = storedBlobs.get(section);
            if (blob == null) {
                blob = ShellCodec.encodeSection(section, options.compress());
                fresh++;
            }
            blobs.put(section.getName(), blob);
            encoded.put(section, blob);
        }
        byte[] record = ShellRecord.write(blobs, document.getTrailingComments(),
                                          options.compress());
        handle.replace(record);

        storedBlobs.clear();
        storedBlobs.putAll(encoded);
        storedSections = new ArrayList<>(document.getSections());
        storedTrailing = document.getTrailingComments();
        dirty = false;
        lastEncodedCount = fresh;
        logger.debug("Saved {} sections ({} re-encoded, {} bytes) to {}", blobs.size(), fresh,
                     record.length, handle.getName());
    }

    private void remember(Map<String, byte[]> blobs) {
        storedSections = new ArrayList<>(document.getSections());
        for (Section section : storedSections) {
            storedBlobs.put(section, blobs.get(section.getName()));
        }
        storedTrailing = document.getTrailingComments();
        dirty = false;
    }

    public StorageHandle getHandle() {
        return handle;
    }

    public ShellOptions getOptions() {
        return options;
    }

    /**
     * The live document. Changes made to it directly are picked up by {@link #isDirty()} and
     * {@link #save()}.
     */
    public Document getDocument() {
        return document;
    }

    public List<String> listSections() {
        return document.getSectionNames();
    }

    public @Nullable Section getSection(String name) {
        return document.getSection(name);
    }

    /**
     * Adds an empty section.
     *
     * @return false if a section of that name already exists
     */
    public boolean createSection(String name) {
        boolean created = document.createSection(name);
        dirty |= created;
        return created;
    }

    public boolean deleteSection(String name) {
        boolean deleted = document.deleteSection(name);
        dirty |= deleted;
        return deleted;
    }

    public void setSection(Section section) {
        document.setSection(section);
        dirty = true;
    }

    /**
     * True if the document differs from what was last loaded or saved.
     */
    public boolean isDirty() {
        if (dirty) {
            return true;
        }
        List<Section> current = new ArrayList<>(document.getSections());
        if (current.size() != storedSections.size()
            || !document.getTrailingComments().equals(storedTrailing)) {
            return true;
        }
        for (int i = 0; i < current.size(); i++) {
            if (current.get(i) != storedSections.get(i)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of sections encoded by the last {@link #save()}; the rest reused stored blobs.
     */
    public int getLastEncodedCount() {
        return lastEncodedCount;
    }

    @Override
    public String toString() {
        return "ShellStore{" + handle.getName() + ", sections=" + document.size() + "}";
    }
}
