package tusklang.fujsen;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Host runtime that actually runs FUJSEN bodies.
 *
 * <p>Implementations are supplied by the embedder. The engine hands over the raw body, the
 * parameter names the body declares (empty when it declares none) and the bindings, ordered
 * with the declared parameters first. Binding values are plain Java objects as produced by
 * {@link tusklang.lang.value.Values#toJava}. When {@code parameterNames} is not empty the body
 * is a function expression or declaration and the adapter is expected to call it with the
 * bound parameter values in declaration order; otherwise the body is a statement list that
 * reads its free variables from the bindings.</p>
 *
 * <p>An evaluator enforces its own time and resource limits; the engine imposes none.</p>
 */
@FunctionalInterface
public interface FujsenEvaluator {

    /**
     * @return the result, convertible by {@link tusklang.lang.value.Values#of}
     *
     * @throws EvaluationException if the body fails to compile or run
     */
    @Nullable Object evaluate(String body, List<String> parameterNames,
                              Map<String, @Nullable Object> bindings)
        throws EvaluationException;
}
