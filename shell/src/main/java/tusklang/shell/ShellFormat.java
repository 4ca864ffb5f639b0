package tusklang.shell;

import tusklang.base.Sha256;

import java.nio.charset.StandardCharsets;

/**
 * Constants of the binary shell record.
 *
 * <pre>
 * offset  size  field
 *      0     4  magic "TSKS"
 *      4     4  format version, unsigned big-endian
 *      8    32  SHA-256 of the payload
 *     40     -  payload
 *
 * payload:
 *   flags          u32   bit 0: section blobs are gzip-compressed
 *   section count  u32
 *   index          per section: name (u16 length + UTF-8), offset u32, length u32
 *   trailing       u32 count, then strings
 *   data           section blobs, offsets relative to the start of this area
 * </pre>
 *
 * <p>Strings are a u32 byte length followed by UTF-8.</p>
 */
public final class ShellFormat {
    static final byte[] MAGIC = "TSKS".getBytes(StandardCharsets.US_ASCII);

    public static final int CURRENT_VERSION = 1;
    public static final int MIN_SUPPORTED_VERSION = 1;

    static final int FLAG_GZIP = 1;
    static final int KNOWN_FLAGS = FLAG_GZIP;

    static final int VERSION_OFFSET = 4;
    static final int CHECKSUM_OFFSET = 8;
    static final int PAYLOAD_OFFSET = CHECKSUM_OFFSET + Sha256.HASH_SIZE;

    // value tags
    static final byte TAG_NULL = 0;
    static final byte TAG_FALSE = 1;
    static final byte TAG_TRUE = 2;
    static final byte TAG_NUMBER = 3;
    static final byte TAG_STRING = 4;
    static final byte TAG_ARRAY = 5;
    static final byte TAG_MAP = 6;
    static final byte TAG_FUJSEN = 7;

    static final int MAX_NESTING = 1024;

    private ShellFormat() {
        throw new UnsupportedOperationException("Constants class");
    }
}
