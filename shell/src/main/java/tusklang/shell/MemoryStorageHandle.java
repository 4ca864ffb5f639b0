package tusklang.shell;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.NoSuchFileException;

/**
 * A record held in memory. Useful for tests and for embedders that move records over their
 * own transport.
 */
public class MemoryStorageHandle implements StorageHandle {
    private final String name;
    private volatile byte @Nullable [] data;

    public MemoryStorageHandle(String name) {
        this.name = name;
    }

    public MemoryStorageHandle(String name, byte[] data) {
        this.name = name;
        this.data = data.clone();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean exists() {
        return data != null;
    }

    @Override
    public byte[] read() throws IOException {
        byte[] d = data;
        if (d == null) {
            throw new NoSuchFileException(name);
        }
        return d.clone();
    }

    @Override
    public void replace(byte[] record) {
        data = record.clone();
    }

    @Override
    public String toString() {
        byte[] d = data;
        return "MemoryStorageHandle{" + name + ", " + (d == null ? "empty" : d.length + " bytes")
               + "}";
    }
}
