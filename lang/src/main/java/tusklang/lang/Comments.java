package tusklang.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Puts comment lines into the form the parser produces, so written comments read back
 * unchanged.
 *
 * <p>Each resulting string is a single {@code #} or {@code //} line without trailing
 * whitespace, or one complete {@code /* ... *}{@code /} block. Text without a marker becomes
 * {@code #} lines. A line comment spanning several lines is split, with the marker repeated on
 * every line.</p>
 */
public final class Comments {
    private Comments() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws IllegalArgumentException for a block comment that is not closed exactly at its
     *                                  end
     */
    public static List<String> normalize(List<String> comments) {
        if (comments.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>(comments.size());
        for (String c : comments) {
            if (c.startsWith("/*")) {
                int close = c.indexOf("*/", 2);
                if (close < 0 || close != c.length() - 2) {
                    throw new IllegalArgumentException(
                        "Block comment must end with its only '*/': " + c);
                }
                out.add(c);
                continue;
            }
            String marker = c.startsWith("//") ? "//" : "#";
            boolean marked = c.startsWith("#") || c.startsWith("//");
            String[] lines = c.split("\r\n|\r|\n", -1);
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i].stripTrailing();
                if (marked && i == 0 || line.startsWith("#") || line.startsWith("//")) {
                    out.add(line);
                } else {
                    out.add(line.isEmpty() ? marker : marker + " " + line);
                }
            }
        }
        return List.copyOf(out);
    }
}
