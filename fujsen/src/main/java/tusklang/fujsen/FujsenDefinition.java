package tusklang.fujsen;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A FUJSEN value prepared for execution.
 *
 * @param body          raw code, exactly as stored
 * @param name          function name from the signature, else the key it was defined from
 * @param parameters    formal parameters declared by the signature
 * @param freeVariables names the body reads without declaring them, in order of first use
 */
public record FujsenDefinition(String body, @Nullable String name, List<String> parameters,
                               List<String> freeVariables) {

    public FujsenDefinition {
        Objects.requireNonNull(body, "body");
        parameters = List.copyOf(parameters);
        freeVariables = List.copyOf(freeVariables);
    }

    /**
     * Names the execution context must provide: the declared parameters followed by every free
     * variable the body reads.
     */
    public List<String> requiredNames() {
        if (parameters.isEmpty()) {
            return freeVariables;
        }
        List<String> names = new ArrayList<>(parameters);
        for (String v : freeVariables) {
            if (!names.contains(v)) {
                names.add(v);
            }
        }
        return List.copyOf(names);
    }
}
