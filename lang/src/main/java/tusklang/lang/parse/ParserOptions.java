package tusklang.lang.parse;

/**
 * Parser settings.
 *
 * @param retainComments attach comments to the sections and keys they precede
 * @param maxDepth       deepest allowed nesting of arrays and maps
 */
public record ParserOptions(boolean retainComments, int maxDepth) {
    public static final int DEFAULT_MAX_DEPTH = 64;

    public static final ParserOptions DEFAULT = new ParserOptions(false, DEFAULT_MAX_DEPTH);
    public static final ParserOptions WITH_COMMENTS = new ParserOptions(true, DEFAULT_MAX_DEPTH);

    public ParserOptions {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }

    public ParserOptions withMaxDepth(int depth) {
        return new ParserOptions(retainComments, depth);
    }
}
