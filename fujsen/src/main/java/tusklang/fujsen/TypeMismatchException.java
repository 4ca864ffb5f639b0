package tusklang.fujsen;

import java.io.Serial;

/**
 * The evaluator returned something that has no value representation.
 */
public class TypeMismatchException extends FujsenExecutionException {
    @Serial
    private static final long serialVersionUID = 1L;

    public TypeMismatchException(String message) {
        super(message);
    }

    public TypeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
