package tusklang.shell;

import java.io.IOException;

/**
 * Where a shell record lives. Implementations are supplied by the embedder;
 * {@link FileStorageHandle} and {@link MemoryStorageHandle} cover the common cases.
 *
 * <p>{@link #replace(byte[])} must be all-or-nothing: a reader sees either the previous record
 * or the new one. Concurrent writers to the same handle must be serialized by the caller.</p>
 */
public interface StorageHandle {

    /**
     * Name for logs and error messages.
     */
    String getName();

    boolean exists();

    /**
     * Reads the whole record.
     *
     * @throws java.nio.file.NoSuchFileException if nothing has been stored yet
     */
    byte[] read() throws IOException;

    /**
     * Atomically replaces the stored record.
     */
    void replace(byte[] record) throws IOException;
}
