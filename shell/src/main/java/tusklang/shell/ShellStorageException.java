package tusklang.shell;

import java.io.IOException;
import java.io.Serial;

/**
 * A stored record could not be accepted. Nothing of the record is returned when this is
 * thrown.
 */
public class ShellStorageException extends IOException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ShellStorageException(String message) {
        super(message);
    }

    public ShellStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
