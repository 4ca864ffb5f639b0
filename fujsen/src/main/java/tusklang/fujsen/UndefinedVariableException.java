package tusklang.fujsen;

import java.io.Serial;
import java.util.List;

/**
 * A name the body needs is missing from the execution context.
 */
public class UndefinedVariableException extends FujsenExecutionException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final List<String> names;

    public UndefinedVariableException(List<String> names) {
        super("Undefined variable" + (names.size() == 1 ? " " : "s ") + String.join(", ", names));
        this.names = List.copyOf(names);
    }

    /**
     * Every missing name, in the order the body declares or uses them.
     */
    public List<String> getNames() {
        return names;
    }
}
