/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.fujsen;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tusklang.lang.value.FujsenCode;
import tusklang.lang.value.Value;
import tusklang.lang.value.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Prepares and runs code-valued configuration entries.
 *
 * <p>{@link #define(Value)} turns a {@link FujsenCode} into a {@link FujsenDefinition}; nothing
 * is executed. {@link #execute(FujsenDefinition, Map)} checks the context, binds the names the
 * body needs and delegates to the {@link FujsenEvaluator}. The engine holds no per-call state
 * and may be shared between threads as long as its evaluator can.</p>
 */
public final class FujsenEngine {
    private static final Logger logger = LoggerFactory.getLogger(FujsenEngine.class);

    private final FujsenEvaluator evaluator;
    private final FreeVariableScanner scanner;

    public FujsenEngine(FujsenEvaluator evaluator) {
        this(evaluator, FreeVariableScanner.DEFAULT);
    }

    public FujsenEngine(FujsenEvaluator evaluator, FreeVariableScanner scanner) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    public FujsenDefinition define(Value value) {
        return define(value, null);
    }

    /**
     * @param fallbackName name to use when the body's signature has none, typically the key
     *                     the code was stored under
     *
     * @throws IllegalArgumentException if {@code value} is not code
     */
    public FujsenDefinition define(Value value, @Nullable String fallbackName) {
        if (!(value instanceof FujsenCode code)) {
            throw new IllegalArgumentException(
                "Not a FUJSEN value: " + value.type().name().toLowerCase());
        }
        String name = code.name() != null ? code.name() : fallbackName;
        return new FujsenDefinition(code.body(), name, code.parameters(),
                                    scanner.scan(code.body()));
    }

    /**
     * Runs a definition.
     *
     * <p>The required names are the declared parameters followed by the body's free variables;
     * each must be present in {@code context}. The evaluator receives them in that order.
     * Context entries the body does not reference are not passed on.</p>
     *
     * @throws UndefinedVariableException if a required name is missing from the context
     * @throws EvaluatorFailureException  if the evaluator fails
     * @throws TypeMismatchException      if the result has no value representation
     * @throws IllegalArgumentException   if the context contains code values
     */
    public Value execute(FujsenDefinition definition, Map<String, ? extends Value> context)
        throws FujsenExecutionException {
        context.forEach((k, v) -> {
            if (Values.containsFujsen(v)) {
                throw new IllegalArgumentException(
                    "Context entry '" + k + "' holds FUJSEN code; contexts carry data only");
            }
        });

        List<String> missing = new ArrayList<>();
        for (String name : definition.requiredNames()) {
            if (!context.containsKey(name)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new UndefinedVariableException(missing);
        }

        Map<String, @Nullable Object> bindings = new LinkedHashMap<>();
        for (String p : definition.parameters()) {
            bindings.put(p, Values.toJava(context.get(p)));
        }
        for (String v : definition.freeVariables()) {
            Value bound = context.get(v);
            if (bound != null && !bindings.containsKey(v)) {
                bindings.put(v, Values.toJava(bound));
            }
        }

        logger.debug("Executing {} with {}", describe(definition), bindings.keySet());
        Object result;
        try {
            result = evaluator.evaluate(definition.body(), definition.parameters(), bindings);
        } catch (EvaluationException | RuntimeException e) {
            logger.warn("Evaluation of {} failed: {}", describe(definition), e.getMessage());
            throw new EvaluatorFailureException(
                e.getMessage() != null ? e.getMessage() : e.getClass().getName(), e);
        }
        return wrapResult(definition, result);
    }

    /**
     * Defines and runs {@code code} in one step.
     */
    public Value execute(Value code, Map<String, ? extends Value> context)
        throws FujsenExecutionException {
        return execute(define(code), context);
    }

    private static Value wrapResult(FujsenDefinition definition, @Nullable Object result)
        throws TypeMismatchException {
        Value value;
        try {
            value = Values.of(result);
        } catch (IllegalArgumentException e) {
            throw new TypeMismatchException(
                describe(definition) + " returned an unrepresentable result: " + e.getMessage(),
                e);
        }
        if (Values.containsFujsen(value)) {
            throw new TypeMismatchException(describe(definition) + " returned FUJSEN code");
        }
        return value;
    }

    private static String describe(FujsenDefinition definition) {
        return definition.name() != null ? "'" + definition.name() + "'" : "anonymous FUJSEN";
    }
}
