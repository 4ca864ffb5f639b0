package tusklang.fujsen;

import java.io.Serial;

/**
 * Thrown by a {@link FujsenEvaluator} when the host runtime rejects or fails to run a body.
 */
public class EvaluationException extends Exception {
    @Serial
    private static final long serialVersionUID = 1L;

    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
