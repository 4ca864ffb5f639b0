package tusklang.lang.lex;

import tusklang.lang.TskFormatException;

import java.io.Serial;

/**
 * Thrown when the input cannot be split into tokens.
 */
public class LexException extends TskFormatException {
    @Serial
    private static final long serialVersionUID = 1L;

    /** Value of {@link #getUnexpectedChar()} when input ended prematurely. */
    public static final int END_OF_INPUT = -1;

    private final int offset;
    private final int unexpectedChar;

    public LexException(String message, int offset, int line, int column, int unexpectedChar) {
        super(message, line, column);
        this.offset = offset;
        this.unexpectedChar = unexpectedChar;
    }

    /**
     * Zero-based character offset into the input.
     */
    public int getOffset() {
        return offset;
    }

    /**
     * The offending character, or {@link #END_OF_INPUT}.
     */
    public int getUnexpectedChar() {
        return unexpectedChar;
    }
}
