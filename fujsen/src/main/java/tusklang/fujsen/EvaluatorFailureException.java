package tusklang.fujsen;

import java.io.Serial;

/**
 * The evaluator raised an error. The message is the evaluator's own.
 */
public class EvaluatorFailureException extends FujsenExecutionException {
    @Serial
    private static final long serialVersionUID = 1L;

    public EvaluatorFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
