package tusklang.lang.parse;

import tusklang.lang.TskFormatException;
import tusklang.lang.lex.Token;

import java.io.Serial;

/**
 * Thrown when a well-formed token sequence does not form a valid document.
 */
public class ParseException extends TskFormatException {
    @Serial
    private static final long serialVersionUID = 1L;

    public ParseException(String message, int line, int column) {
        super(message, line, column);
    }

    public ParseException(String message, Token at) {
        this(message, at.line(), at.column());
    }
}
