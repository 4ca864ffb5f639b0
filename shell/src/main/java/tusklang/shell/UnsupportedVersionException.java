package tusklang.shell;

import java.io.Serial;

public class UnsupportedVersionException extends ShellStorageException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final long version;

    public UnsupportedVersionException(long version) {
        super("Unsupported shell record version " + version + ", this build reads versions "
              + ShellFormat.MIN_SUPPORTED_VERSION + " to " + ShellFormat.CURRENT_VERSION);
        this.version = version;
    }

    public long getVersion() {
        return version;
    }
}
