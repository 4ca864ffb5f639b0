/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.lang.lex;

import org.jspecify.annotations.Nullable;
import tusklang.lang.Section;

import java.util.ArrayDeque;
import java.util.Deque;

import static tusklang.lang.lex.TokenType.*;

/**
 * Splits TSK text into tokens in a single left-to-right pass with one token of lookahead.
 *
 * <p>The lexer tracks whether it is positioned where a value may start: after {@code =} or
 * {@code :}, and anywhere directly inside an array. In that state unquoted text is read as a
 * {@link TokenType#SCALAR} running to the end of the line, or inside a container to the next
 * {@code ,}, {@code ]} or {@code }}. Elsewhere unquoted text is a {@link TokenType#KEY}.</p>
 *
 * <p>Line breaks are significant because they terminate top-level assignments; runs of
 * spaces and tabs are skipped. A comment marker ({@code #}, {@code //}, {@code /*}) inside an
 * unquoted value only opens a comment when whitespace precedes it, so URLs and {@code a#b}
 * remain values.</p>
 *
 * <p>Instances are single-use and not thread-safe.</p>
 */
public final class Lexer {
    private static final String TRIPLE_QUOTE = "\"\"\"";

    private final String text;
    private final int len;
    private final Deque<Character> nesting = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean expectValue;
    private @Nullable Token peeked;

    private int tokenStart;
    private int tokenLine;
    private int tokenColumn;

    public Lexer(String text) {
        this.text = text;
        this.len = text.length();
        if (len > 0 && text.charAt(0) == '\uFEFF') {
            pos = lineStart = 1;
        }
    }

    /**
     * Consumes and returns the next token. Returns {@link TokenType#EOF} repeatedly once the
     * input is exhausted.
     */
    public Token next() throws LexException {
        if (peeked != null) {
            Token t = peeked;
            peeked = null;
            return t;
        }
        return scan();
    }

    /**
     * Returns the next token without consuming it.
     */
    public Token peek() throws LexException {
        if (peeked == null) {
            peeked = scan();
        }
        return peeked;
    }

    private Token scan() throws LexException {
        skipBlanks();
        mark();
        if (pos >= len) {
            return emit(EOF, "");
        }
        char c = text.charAt(pos);
        if (c == '\n' || c == '\r') {
            advanceTo(pos + 1);
            return emit(NEWLINE, "\n");
        }
        if (isCommentStart(pos)) {
            return scanComment();
        }
        if (expectValue || (!nesting.isEmpty() && nesting.peek() == '[')) {
            Token t = scanValue(c);
            if (t.type() != COMMA) {
                expectValue = false;
            }
            return t;
        }
        return scanStructure(c);
    }

    private Token scanStructure(char c) throws LexException {
        switch (c) {
            case '[':
                if (!nesting.isEmpty()) {
                    throw unexpected(pos, c);
                }
                return scanHeader();
            case '{':
                pos++;
                nesting.push('{');
                return emit(LBRACE, "{");
            case '}':
                return close('{', RBRACE, c);
            case ',':
                pos++;
                return emit(COMMA, ",");
            case '=':
            case ':':
                pos++;
                expectValue = true;
                return emit(ASSIGN, String.valueOf(c));
            case '"':
            case '\'':
                return emit(KEY, scanQuoted());
            default:
                if (!isKeyChar(c)) {
                    throw unexpected(pos, c);
                }
                int start = pos;
                while (pos < len && isKeyChar(text.charAt(pos))) {
                    pos++;
                }
                return emit(KEY, text.substring(start, pos));
        }
    }

    private Token scanValue(char c) throws LexException {
        switch (c) {
            case ',':
                pos++;
                return emit(COMMA, ",");
            case ']':
                return close('[', RBRACKET, c);
            case '}':
                return close('{', RBRACE, c);
            case '[':
                pos++;
                nesting.push('[');
                return emit(LBRACKET, "[");
            case '{':
                pos++;
                nesting.push('{');
                return emit(LBRACE, "{");
            case '"':
                if (text.startsWith(TRIPLE_QUOTE, pos)) {
                    return scanHeredoc(TRIPLE_QUOTE, pos + TRIPLE_QUOTE.length());
                }
                return emit(STRING, scanQuoted());
            case '\'':
                return emit(STRING, scanQuoted());
            case '<':
                if (pos + 2 < len && text.charAt(pos + 1) == '<'
                    && isTagStart(text.charAt(pos + 2))) {
                    int end = pos + 2;
                    while (end < len && isTagPart(text.charAt(end))) {
                        end++;
                    }
                    return scanHeredoc(text.substring(pos + 2, end), end);
                }
                return scanBare();
            default:
                return scanBare();
        }
    }

    private Token close(char opener, TokenType type, char c) throws LexException {
        if (nesting.isEmpty() || nesting.peek() != opener) {
            throw unexpected(pos, c);
        }
        nesting.pop();
        pos++;
        return emit(type, String.valueOf(c));
    }

    private Token scanHeader() throws LexException {
        int nameStart = pos + 1;
        int p = nameStart;
        while (p < len && text.charAt(p) != ']' && !isLineBreak(text.charAt(p))) {
            p++;
        }
        if (p >= len) {
            throw error("Unterminated section header", p, LexException.END_OF_INPUT);
        }
        if (text.charAt(p) != ']') {
            throw error("Unterminated section header", p, text.charAt(p));
        }
        String raw = text.substring(nameStart, p);
        String name = raw.strip();
        if (name.isEmpty()) {
            throw error("Empty section name", p, ']');
        }
        if (!Section.isValidName(name)) {
            int offset = nameStart + raw.indexOf(name.charAt(0));
            for (int i = 0; i < name.length(); i++) {
                char ch = name.charAt(i);
                boolean ok = Character.isLetterOrDigit(ch) && ch < 128 || ch == '_'
                             || i > 0 && (ch == '.' || ch == '-');
                if (!ok) {
                    throw error("Invalid character in section name", offset + i, ch);
                }
            }
            throw error("Invalid section name", offset, name.charAt(0));
        }
        pos = p + 1;
        return emit(SECTION, name);
    }

    private Token scanBare() {
        int start = pos;
        boolean inContainer = !nesting.isEmpty();
        while (pos < len) {
            char ch = text.charAt(pos);
            if (isLineBreak(ch)) {
                break;
            }
            if (inContainer && (ch == ',' || ch == ']' || ch == '}')) {
                break;
            }
            if (pos > start && isCommentStart(pos)
                && Character.isWhitespace(text.charAt(pos - 1))) {
                break;
            }
            pos++;
        }
        return emit(SCALAR, text.substring(start, pos).stripTrailing());
    }

    private String scanQuoted() throws LexException {
        char quote = text.charAt(pos);
        int p = pos + 1;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (p >= len) {
                throw error("Unterminated string", p, LexException.END_OF_INPUT);
            }
            char ch = text.charAt(p);
            if (ch == quote) {
                pos = p + 1;
                return sb.toString();
            }
            if (isLineBreak(ch)) {
                throw error("Unterminated string", p, ch);
            }
            if (ch != '\\') {
                sb.append(ch);
                p++;
                continue;
            }
            if (p + 1 >= len) {
                throw error("Unterminated string", p + 1, LexException.END_OF_INPUT);
            }
            char e = text.charAt(p + 1);
            switch (e) {
                case '"', '\'', '\\', '/' -> sb.append(e);
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case '0' -> sb.append('\0');
                case 'u' -> {
                    sb.append(unicodeEscape(p));
                    p += 4;
                }
                default -> throw error("Invalid escape sequence '\\" + e + "'", p + 1, e);
            }
            p += 2;
        }
    }

    private char unicodeEscape(int backslash) throws LexException {
        int digits = backslash + 2;
        int value = 0;
        for (int i = 0; i < 4; i++) {
            if (digits + i >= len) {
                throw error("Truncated unicode escape", digits + i, LexException.END_OF_INPUT);
            }
            char h = text.charAt(digits + i);
            int d = Character.digit(h, 16);
            if (d < 0) {
                throw error("Invalid unicode escape", digits + i, h);
            }
            value = value * 16 + d;
        }
        return (char) value;
    }

    /**
     * Reads a heredoc body. The terminator is the first following line whose stripped content
     * equals the delimiter; the body is everything in between, minus the newline ending the
     * last body line.
     */
    private Token scanHeredoc(String delimiter, int afterOpener) throws LexException {
        int p = afterOpener;
        while (p < len && (text.charAt(p) == ' ' || text.charAt(p) == '\t')) {
            p++;
        }
        if (p >= len) {
            throw error("Unterminated multi-line block", pos, LexException.END_OF_INPUT);
        }
        if (!isLineBreak(text.charAt(p))) {
            throw error("Unexpected text after multi-line opener", p, text.charAt(p));
        }
        int bodyStart = skipLineBreak(p);
        int lineBegin = bodyStart;
        while (true) {
            int eol = lineBegin;
            while (eol < len && !isLineBreak(text.charAt(eol))) {
                eol++;
            }
            if (text.substring(lineBegin, eol).strip().equals(delimiter)) {
                // only the final line break character is dropped, a CR before it stays
                String body = lineBegin > bodyStart ? text.substring(bodyStart, lineBegin - 1) : "";
                advanceTo(eol);
                return emit(HEREDOC, body);
            }
            if (eol >= len) {
                throw error("Unterminated multi-line block, expected " + delimiter, tokenStart,
                            LexException.END_OF_INPUT);
            }
            lineBegin = skipLineBreak(eol);
        }
    }

    private Token scanComment() throws LexException {
        int start = pos;
        if (text.startsWith("/*", pos)) {
            int end = text.indexOf("*/", pos + 2);
            if (end < 0) {
                throw error("Unterminated block comment", pos, LexException.END_OF_INPUT);
            }
            advanceTo(end + 2);
            return emit(COMMENT, text.substring(start, end + 2));
        }
        while (pos < len && !isLineBreak(text.charAt(pos))) {
            pos++;
        }
        return emit(COMMENT, text.substring(start, pos).stripTrailing());
    }

    private boolean isCommentStart(int p) {
        char c = text.charAt(p);
        if (c == '#') {
            return true;
        }
        return c == '/' && p + 1 < len && (text.charAt(p + 1) == '/' || text.charAt(p + 1) == '*');
    }

    private void skipBlanks() {
        while (pos < len) {
            char c = text.charAt(pos);
            if (c != ' ' && c != '\t' && c != '\f' && c != '\u000B') {
                return;
            }
            pos++;
        }
    }

    private int skipLineBreak(int p) {
        if (text.charAt(p) == '\r' && p + 1 < len && text.charAt(p + 1) == '\n') {
            return p + 2;
        }
        return p + 1;
    }

    /**
     * Moves to {@code target}, counting the line breaks passed on the way.
     */
    private void advanceTo(int target) {
        while (pos < target) {
            char c = text.charAt(pos);
            if (isLineBreak(c)) {
                pos = skipLineBreak(pos);
                line++;
                lineStart = pos;
            } else {
                pos++;
            }
        }
    }

    private void mark() {
        tokenStart = pos;
        tokenLine = line;
        tokenColumn = pos - lineStart + 1;
    }

    private Token emit(TokenType type, String value) {
        return new Token(type, value, tokenLine, tokenColumn, tokenStart);
    }

    private LexException unexpected(int offset, char c) {
        return error("Unexpected character '" + c + "'", offset, c);
    }

    /**
     * Builds an error for an offset on the line of the current token.
     */
    private LexException error(String message, int offset, int c) {
        int column = tokenColumn + (offset - tokenStart);
        return new LexException(message, offset, tokenLine, column, c);
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }

    static boolean isKeyChar(char c) {
        return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9' || c == '_'
               || c == '-' || c == '.' || c == '$';
    }

    private static boolean isTagStart(char c) {
        return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c == '_';
    }

    private static boolean isTagPart(char c) {
        return isTagStart(c) || c >= '0' && c <= '9';
    }
}
