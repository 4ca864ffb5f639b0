package tusklang.fujsen;

import java.io.Serial;

/**
 * Base class of the failures {@link FujsenEngine#execute} reports.
 */
public abstract class FujsenExecutionException extends Exception {
    @Serial
    private static final long serialVersionUID = 1L;

    protected FujsenExecutionException(String message) {
        super(message);
    }

    protected FujsenExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
