package tusklang.lang;

import java.io.Serial;

/**
 * Thrown when TSK text is malformed. Carries the 1-based line and column of the offending
 * input.
 */
public class TskFormatException extends Exception {
    @Serial
    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public TskFormatException(String message, int line, int column) {
        super(message + " at line " + line + ", column " + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
