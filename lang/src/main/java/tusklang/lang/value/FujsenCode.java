/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.lang.value;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * An executable code fragment stored as a value.
 *
 * <p>The body is kept byte-for-byte as written between the heredoc delimiters; the delimiters
 * themselves are not part of the value. {@code parameters} holds the formal parameter names
 * declared by the body's signature (empty when it declares none) and {@code name} the function
 * name, if the signature gives one.</p>
 *
 * @see FujsenSignature
 */
public record FujsenCode(String body, List<String> parameters, @Nullable String name)
    implements Value {

    public FujsenCode {
        Objects.requireNonNull(body, "body");
        parameters = List.copyOf(parameters);
    }

    /**
     * Wraps a body, inferring parameters and name from its leading signature.
     */
    public static FujsenCode of(String body) {
        FujsenSignature signature = FujsenSignature.detect(body);
        return new FujsenCode(body, signature.parameters(), signature.name());
    }

    @Override
    public ValueType type() {
        return ValueType.FUJSEN;
    }

    public boolean declaresParameters() {
        return !parameters.isEmpty();
    }

    @Override
    public String toString() {
        return "FujsenCode[" + (name == null ? "" : name) + parameters + ", " + body.length()
               + " chars]";
    }
}
