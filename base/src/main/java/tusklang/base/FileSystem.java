package tusklang.base;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * File operations that never leave a half-written target behind.
 *
 * <p>Writers go through {@link #writeAtomically(Path, byte[])}: the data lands in a temporary
 * file in the target's directory, is forced to disk, and then replaces the target with a single
 * rename. Readers observe either the previous content or the new content.</p>
 *
 * <p>All methods are stateless and thread-safe. Concurrent writers to the same target are not
 * coordinated; the last rename wins.</p>
 */
public final class FileSystem {

    private static final Logger logger = LoggerFactory.getLogger(FileSystem.class);

    static final String TEMP_PREFIX = ".tsk-";
    static final String TEMP_SUFFIX = ".tmp";

    private FileSystem() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Replaces {@code target} with {@code data}.
     *
     * @param target the file to create or replace; its parent directory must exist
     * @param data   the complete new content
     *
     * @throws IOException if the data could not be written or the rename failed. The target is
     *                     left untouched in that case and the temporary file is removed.
     */
    public static void writeAtomically(Path target, byte[] data) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir == null) {
            throw new IOException("Target has no parent directory: " + target);
        }
        Path temp = Files.createTempFile(dir, TEMP_PREFIX, TEMP_SUFFIX);
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                                                        StandardOpenOption.TRUNCATE_EXISTING);
                 OutputStream os = Channels.newOutputStream(channel)) {
                os.write(data);
                os.flush();
                channel.force(true);
            }
            if (!renameTo(temp, target)) {
                throw new IOException("Unable to replace " + target);
            }
            logger.debug("Wrote {} bytes to {}", data.length, target);
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Moves {@code source} onto {@code target}, atomically where the file system allows it and
     * by a replacing move otherwise.
     *
     * @return {@code true} if the rename was successful, {@code false} if it failed (the failure
     * is logged)
     *
     * @throws IllegalArgumentException if both paths are the same or the source is missing
     */
    public static boolean renameTo(Path source, Path target) {
        if (source.equals(target)) {
            throw new IllegalArgumentException("Source and target paths are the same");
        }
        if (!Files.exists(source)) {
            throw new IllegalArgumentException("Source path does not exist: " + source);
        }

        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (AtomicMoveNotSupportedException e) {
            return tryRegularMove(source, target);
        } catch (IOException e) {
            logMoveError(source, target, e);
            return false;
        }
    }

    private static boolean tryRegularMove(Path source, Path target) {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            logMoveError(source, target, e);
            return false;
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.error("Unable to delete temporary file {}", temp, e);
        }
    }

    private static void logMoveError(Path source, Path target, IOException e) {
        logger.error("Failed to rename {} to {}", source, target, e);
    }
}
