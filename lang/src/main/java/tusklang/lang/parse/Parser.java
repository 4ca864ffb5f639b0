/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.lang.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tusklang.lang.Document;
import tusklang.lang.Section;
import tusklang.lang.TskFormatException;
import tusklang.lang.lex.Lexer;
import tusklang.lang.lex.Token;
import tusklang.lang.lex.TokenType;
import tusklang.lang.value.ArrayValue;
import tusklang.lang.value.FujsenCode;
import tusklang.lang.value.MapValue;
import tusklang.lang.value.StringValue;
import tusklang.lang.value.Value;
import tusklang.lang.value.Values;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive descent parser producing a {@link Document} from TSK text.
 *
 * <p>Grammar, informally:</p>
 * <pre>
 * document   := (header | assignment | comment | blank)*
 * header     := '[' name ']' EOL
 * assignment := key ('=' | ':') value EOL | key map EOL
 * value      := scalar | string | heredoc | array | map
 * array      := '[' (value (',' | EOL))* value? ']'
 * map        := '{' (key ('=' | ':') value (',' | EOL))* '}'
 * </pre>
 *
 * <p>Redefining a key replaces its value in place. Redeclaring a section merges into the
 * earlier one. The first error aborts the parse; no partial document is ever returned.</p>
 *
 * <p>Instances are single-use. The static entry points are safe to call concurrently.</p>
 */
public final class Parser {
    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private final Lexer lexer;
    private final ParserOptions options;
    private final List<String> pendingComments = new ArrayList<>();

    public Parser(String text, ParserOptions options) {
        this.lexer = new Lexer(text);
        this.options = options;
    }

    /**
     * Parses {@code text}, discarding comments.
     *
     * @throws TskFormatException on the first lexical or structural error
     */
    public static Document parse(String text) throws TskFormatException {
        return new Parser(text, ParserOptions.DEFAULT).parseDocument();
    }

    /**
     * Parses {@code text}, attaching each comment to the section header or key that follows
     * it. Comments after the last entry become the document's trailing comments; comments
     * inside arrays and maps are dropped.
     *
     * @throws TskFormatException on the first lexical or structural error
     */
    public static Document parseWithComments(String text) throws TskFormatException {
        return new Parser(text, ParserOptions.WITH_COMMENTS).parseDocument();
    }

    public Document parseDocument() throws TskFormatException {
        Map<String, Section.Builder> sections = new LinkedHashMap<>();
        Section.Builder current = null;

        while (true) {
            Token t = lexer.next();
            switch (t.type()) {
                case EOF -> {
                    Document doc = new Document();
                    sections.values().forEach(b -> doc.setSection(b.build()));
                    doc.setTrailingComments(takeComments());
                    logger.debug("Parsed {} sections", doc.size());
                    return doc;
                }
                case NEWLINE -> {
                }
                case COMMENT -> addComment(t);
                case SECTION -> {
                    current = sections.computeIfAbsent(t.text(), Section::builder);
                    current.addComments(takeComments());
                    expectLineEnd("section header");
                }
                case KEY -> {
                    if (current == null) {
                        throw new ParseException(
                            "Key '" + t.text() + "' appears before any section header", t);
                    }
                    List<String> comments = takeComments();
                    Value value = parseAssignment(t, 0);
                    current.put(t.text(), value, comments);
                    expectLineEnd("value of '" + t.text() + "'");
                }
                default -> throw new ParseException("Unexpected " + t.describe(), t);
            }
        }
    }

    /**
     * Parses what follows a key: {@code = value}, {@code : value} or a {@code { ... }} block.
     */
    private Value parseAssignment(Token key, int depth) throws TskFormatException {
        Token t = lexer.next();
        if (t.type() == TokenType.LBRACE) {
            return parseMap(t, depth + 1);
        }
        if (t.type() != TokenType.ASSIGN) {
            throw new ParseException(
                "Expected '=' or ':' after key '" + key.text() + "' but found " + t.describe(), t);
        }
        Token v = lexer.next();
        if (depth > 0) {
            // inside a map the value may start on the next line
            while (v.type() == TokenType.NEWLINE || v.type() == TokenType.COMMENT) {
                v = lexer.next();
            }
        }
        return parseValue(v, depth);
    }

    private Value parseValue(Token t, int depth) throws TskFormatException {
        return switch (t.type()) {
            case STRING -> new StringValue(t.text());
            case SCALAR -> Values.scalar(t.text());
            case HEREDOC -> FujsenCode.of(t.text());
            case LBRACKET -> parseArray(t, depth + 1);
            case LBRACE -> parseMap(t, depth + 1);
            default -> throw new ParseException("Expected a value but found " + t.describe(), t);
        };
    }

    private ArrayValue parseArray(Token open, int depth) throws TskFormatException {
        checkDepth(open, depth);
        List<Value> items = new ArrayList<>();
        boolean afterItem = false;
        while (true) {
            Token t = lexer.next();
            switch (t.type()) {
                case RBRACKET -> {
                    return new ArrayValue(items);
                }
                case EOF -> throw new ParseException(
                    "Unterminated array opened at line " + open.line(), t);
                case NEWLINE -> afterItem = false;
                case COMMENT -> {
                }
                case COMMA -> {
                    if (!afterItem) {
                        throw new ParseException("Unexpected ',' in array", t);
                    }
                    afterItem = false;
                }
                default -> {
                    if (afterItem) {
                        throw new ParseException(
                            "Expected ',' or ']' but found " + t.describe(), t);
                    }
                    items.add(parseValue(t, depth));
                    afterItem = true;
                }
            }
        }
    }

    private MapValue parseMap(Token open, int depth) throws TskFormatException {
        checkDepth(open, depth);
        Map<String, Value> entries = new LinkedHashMap<>();
        boolean afterItem = false;
        while (true) {
            Token t = lexer.next();
            switch (t.type()) {
                case RBRACE -> {
                    return new MapValue(entries);
                }
                case EOF -> throw new ParseException(
                    "Unterminated map opened at line " + open.line(), t);
                case NEWLINE -> afterItem = false;
                case COMMENT -> {
                }
                case COMMA -> {
                    if (!afterItem) {
                        throw new ParseException("Unexpected ',' in map", t);
                    }
                    afterItem = false;
                }
                case KEY -> {
                    if (afterItem) {
                        throw new ParseException(
                            "Expected ',' or '}' but found " + t.describe(), t);
                    }
                    Value value = parseAssignment(t, depth);
                    entries.put(t.text(), value);
                    afterItem = true;
                }
                default -> throw new ParseException(
                    "Expected a key or '}' but found " + t.describe(), t);
            }
        }
    }

    private void expectLineEnd(String after) throws TskFormatException {
        Token t = lexer.peek();
        if (t.type() == TokenType.COMMENT) {
            addComment(lexer.next());
            t = lexer.peek();
        }
        if (t.type() == TokenType.NEWLINE) {
            lexer.next();
        } else if (t.type() != TokenType.EOF) {
            throw new ParseException(
                "Expected end of line after " + after + " but found " + t.describe(), t);
        }
    }

    private void checkDepth(Token open, int depth) throws ParseException {
        if (depth > options.maxDepth()) {
            throw new ParseException("Nesting deeper than " + options.maxDepth() + " levels",
                                     open);
        }
    }

    private void addComment(Token t) {
        if (options.retainComments()) {
            pendingComments.add(t.text());
        }
    }

    private List<String> takeComments() {
        if (pendingComments.isEmpty()) {
            return List.of();
        }
        List<String> taken = List.copyOf(pendingComments);
        pendingComments.clear();
        return taken;
    }
}
