package tusklang.lang.value;

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The parameter marker at the top of a FUJSEN body.
 *
 * <p>Recognized forms, after leading whitespace:</p>
 * <ul>
 *   <li>{@code function name(a, b) ...} and {@code async function ...}, name optional</li>
 *   <li>{@code (a, b) => ...}</li>
 *   <li>{@code a => ...}</li>
 * </ul>
 * <p>Default values ({@code b = 2}), type annotations ({@code b: int}), rest markers
 * ({@code ...rest}) and {@code $} prefixes are stripped. A body without a marker, or with one
 * whose parameter list cannot be read, has no declared parameters.</p>
 */
public record FujsenSignature(@Nullable String name, List<String> parameters) {
    public static final FujsenSignature NONE = new FujsenSignature(null, List.of());

    private static final Pattern FUNCTION = Pattern.compile(
        "^(?:async\\s+)?function\\s*\\*?\\s*([A-Za-z_$][\\w$]*)?\\s*\\(([^()]*)\\)");
    private static final Pattern ARROW = Pattern.compile("^(?:async\\s*)?\\(([^()]*)\\)\\s*=>");
    private static final Pattern SINGLE_ARROW =
        Pattern.compile("^(?:async\\s+)?\\$?([A-Za-z_][\\w]*)\\s*=>");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][\\w]*");

    public FujsenSignature {
        parameters = List.copyOf(parameters);
    }

    public static FujsenSignature detect(String body) {
        String head = StringUtils.stripStart(body, null);

        Matcher m = FUNCTION.matcher(head);
        if (m.find()) {
            List<String> params = splitParameters(m.group(2));
            return params == null ? new FujsenSignature(m.group(1), List.of())
                                  : new FujsenSignature(m.group(1), params);
        }
        m = ARROW.matcher(head);
        if (m.find()) {
            List<String> params = splitParameters(m.group(1));
            return params == null ? NONE : new FujsenSignature(null, params);
        }
        m = SINGLE_ARROW.matcher(head);
        if (m.find()) {
            return new FujsenSignature(null, List.of(m.group(1)));
        }
        return NONE;
    }

    /**
     * @return the cleaned names, or {@code null} if an entry is not a plain identifier
     */
    private static @Nullable List<String> splitParameters(String list) {
        List<String> result = new ArrayList<>();
        if (StringUtils.isBlank(list)) {
            return result;
        }
        for (String raw : list.split(",")) {
            String p = raw.strip();
            if (p.isEmpty()) {
                // trailing comma
                continue;
            }
            p = StringUtils.removeStart(p, "...");
            p = StringUtils.removeStart(p, "$");
            int cut = StringUtils.indexOfAny(p, '=', ':');
            if (cut >= 0) {
                p = p.substring(0, cut).strip();
            }
            if (!IDENTIFIER.matcher(p).matches()) {
                return null;
            }
            result.add(p);
        }
        return result;
    }
}
