/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.lang.text;

import com.machinezoo.noexception.Exceptions;
import org.apache.commons.lang3.StringUtils;
import tusklang.lang.Document;
import tusklang.lang.Entry;
import tusklang.lang.Section;
import tusklang.lang.value.ArrayValue;
import tusklang.lang.value.BoolValue;
import tusklang.lang.value.FujsenCode;
import tusklang.lang.value.MapValue;
import tusklang.lang.value.NumberValue;
import tusklang.lang.value.StringValue;
import tusklang.lang.value.Value;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Renders documents as TSK text.
 *
 * <p>Output re-parses to an equal document: sections and keys keep their order, numbers are
 * written canonically, strings are quoted whenever a bare word would read back as something
 * else, and code bodies are written verbatim between heredoc delimiters. Comments retained by
 * the parser are written above the header or key they belong to.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class TskWriter {
    static final String INDENT = "    ";
    static final int MAX_INLINE_WIDTH = 80;
    static final String HEREDOC_QUOTES = "\"\"\"";
    static final String HEREDOC_TAG = "FUJSEN";

    private static final Pattern BARE_STRING = Pattern.compile("[A-Za-z_][A-Za-z0-9_./@%+-]*");
    private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z0-9_$.-]+");

    private TskWriter() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String stringify(Document document) {
        StringWriter w = new StringWriter();
        try {
            writeTo(document, w);
        } catch (IOException e) {
            throw new UncheckedIOException("StringWriter failed", e);
        }
        return w.toString();
    }

    /**
     * Writes the document to {@code w}. The writer is flushed but not closed.
     */
    public static void writeTo(Document document, Writer w) throws IOException {
        boolean[] first = {true};
        document.getSections().forEach(Exceptions.sneak().consumer(section -> {
            if (!first[0]) {
                w.write('\n');
            }
            first[0] = false;
            writeSection(section, w);
        }));
        if (!document.getTrailingComments().isEmpty()) {
            if (!document.isEmpty()) {
                w.write('\n');
            }
            writeComments(document.getTrailingComments(), "", w);
        }
        w.flush();
    }

    private static void writeSection(Section section, Writer w) throws IOException {
        writeComments(section.getComments(), "", w);
        w.write('[');
        w.write(section.getName());
        w.write("]\n");
        for (Entry e : section.entries()) {
            writeComments(e.comments(), "", w);
            w.write(key(e.key()));
            w.write(" = ");
            w.write(value(e.value(), ""));
            w.write('\n');
        }
    }

    /**
     * Comments arrive normalized by {@link tusklang.lang.Comments}, one line or block each.
     */
    private static void writeComments(Iterable<String> comments, String indent, Writer w)
        throws IOException {
        for (String c : comments) {
            w.write(indent);
            w.write(c);
            w.write('\n');
        }
    }

    /**
     * Renders a single value as it would appear after {@code key = }. Multi-line forms are
     * indented relative to {@code indent}.
     */
    public static String value(Value value, String indent) {
        if (value instanceof StringValue s) {
            return string(s.value());
        }
        if (value instanceof NumberValue n) {
            return n.canonical();
        }
        if (value instanceof BoolValue b) {
            return Boolean.toString(b.value());
        }
        if (value instanceof FujsenCode f) {
            return heredoc(f.body());
        }
        if (value instanceof ArrayValue a) {
            return array(a, indent);
        }
        if (value instanceof MapValue m) {
            return map(m, indent);
        }
        return "null";
    }

    private static String array(ArrayValue a, String indent) {
        if (a.size() == 0) {
            return "[]";
        }
        if (a.items().stream().allMatch(v -> v.type().isScalar())) {
            StringBuilder sb = new StringBuilder("[");
            for (int i = 0; i < a.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(value(a.get(i), indent));
            }
            sb.append(']');
            if (fitsInline(sb, indent)) {
                return sb.toString();
            }
        }
        String inner = indent + INDENT;
        StringBuilder sb = new StringBuilder("[\n");
        for (Value item : a.items()) {
            sb.append(inner).append(value(item, inner)).append('\n');
        }
        return sb.append(indent).append(']').toString();
    }

    private static String map(MapValue m, String indent) {
        if (m.size() == 0) {
            return "{}";
        }
        if (m.entries().values().stream().allMatch(v -> v.type().isScalar())) {
            StringBuilder sb = new StringBuilder("{ ");
            boolean first = true;
            for (Map.Entry<String, Value> e : m.entries().entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                sb.append(key(e.getKey())).append(" = ").append(value(e.getValue(), indent));
            }
            sb.append(" }");
            if (fitsInline(sb, indent)) {
                return sb.toString();
            }
        }
        String inner = indent + INDENT;
        StringBuilder sb = new StringBuilder("{\n");
        for (Map.Entry<String, Value> e : m.entries().entrySet()) {
            sb.append(inner).append(key(e.getKey())).append(" = ")
              .append(value(e.getValue(), inner)).append('\n');
        }
        return sb.append(indent).append('}').toString();
    }

    private static boolean fitsInline(CharSequence rendered, String indent) {
        return indent.length() + rendered.length() <= MAX_INLINE_WIDTH
               && StringUtils.indexOfAny(rendered, '\n', '\r') < 0;
    }

    /**
     * The body between delimiters that no body line can be mistaken for.
     */
    static String heredoc(String body) {
        String delimiter = HEREDOC_QUOTES;
        if (collides(body, delimiter)) {
            delimiter = HEREDOC_TAG;
            for (int n = 1; collides(body, delimiter); n++) {
                delimiter = HEREDOC_TAG + "_" + n;
            }
            return "<<" + delimiter + "\n" + body + "\n" + delimiter;
        }
        return delimiter + "\n" + body + "\n" + delimiter;
    }

    private static boolean collides(String body, String delimiter) {
        for (String line : body.split("\r\n|\r|\n", -1)) {
            if (line.strip().equals(delimiter)) {
                return true;
            }
        }
        return false;
    }

    static String key(String key) {
        return BARE_KEY.matcher(key).matches() ? key : quote(key);
    }

    static String string(String s) {
        if (BARE_STRING.matcher(s).matches() && !"true".equals(s) && !"false".equals(s)
            && !"null".equals(s)) {
            return s;
        }
        return quote(s);
    }

    static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
