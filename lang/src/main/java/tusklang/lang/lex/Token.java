package tusklang.lang.lex;

/**
 * A lexical token with the 1-based position of its first character.
 */
public record Token(TokenType type, String text, int line, int column, int offset) {

    /**
     * Human readable form for error messages.
     */
    public String describe() {
        return switch (type) {
            case EOF -> "end of input";
            case NEWLINE -> "end of line";
            case SECTION -> "section header [" + text + "]";
            case HEREDOC -> "multi-line block";
            case KEY, SCALAR, STRING -> type.name().toLowerCase() + " '" + text + "'";
            default -> "'" + text + "'";
        };
    }
}
