package tusklang.lang.lex;

public enum TokenType {
    /** {@code [name]}; the token text is the trimmed name. */
    SECTION,
    /** A bare or quoted key; the text is the unescaped key. */
    KEY,
    /** {@code =} or {@code :}. */
    ASSIGN,
    /** A quoted string; the text is unescaped. */
    STRING,
    /** An unquoted word, classified later. */
    SCALAR,
    /** A {@code """} or {@code <<TAG} block; the text is the verbatim body. */
    HEREDOC,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    NEWLINE,
    /** A comment, text including its marker. */
    COMMENT,
    EOF
}
