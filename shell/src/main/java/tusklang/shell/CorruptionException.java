package tusklang.shell;

import java.io.Serial;

/**
 * The record is not a shell record, fails its checksum, or its payload does not decode.
 */
public class CorruptionException extends ShellStorageException {
    @Serial
    private static final long serialVersionUID = 1L;

    public CorruptionException(String message) {
        super(message);
    }

    public CorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
