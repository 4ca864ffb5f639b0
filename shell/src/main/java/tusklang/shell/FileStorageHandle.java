package tusklang.shell;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tusklang.base.FileSystem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A record stored in a single file. Writes go to a temporary file in the same directory that
 * is then renamed over the target.
 */
public class FileStorageHandle implements StorageHandle {
    private static final Logger logger = LoggerFactory.getLogger(FileStorageHandle.class);

    private final Path path;

    public FileStorageHandle(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getName() {
        return path.toString();
    }

    @Override
    public boolean exists() {
        return Files.isRegularFile(path);
    }

    @Override
    public byte[] read() throws IOException {
        byte[] data = Files.readAllBytes(path);
        logger.debug("Read {} bytes from {}", data.length, path);
        return data;
    }

    @Override
    public void replace(byte[] record) throws IOException {
        FileSystem.writeAtomically(path, record);
    }

    @Override
    public String toString() {
        return "FileStorageHandle{" + path + "}";
    }
}
