package tusklang.shell;

/**
 * Options for writing shell records.
 *
 * @param compress gzip each section blob
 */
public record ShellOptions(boolean compress) {
    public static final ShellOptions DEFAULT = new ShellOptions(true);
    public static final ShellOptions UNCOMPRESSED = new ShellOptions(false);
}
