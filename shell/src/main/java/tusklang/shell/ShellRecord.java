/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.shell;

import org.jspecify.annotations.Nullable;
import tusklang.base.Sha256;
import tusklang.lang.Comments;
import tusklang.lang.Document;
import tusklang.lang.Section;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A shell record whose header, checksum and index have been validated. Sections are decoded
 * on demand through the index, so reading one section does not decode the others.
 *
 * @see ShellFormat
 */
public final class ShellRecord {
    private final int version;
    private final int flags;
    private final byte[] checksum;
    /** name to stored blob, in record order */
    private final Map<String, byte[]> blobs;
    private final List<String> trailingComments;

    private ShellRecord(int version, int flags, byte[] checksum, Map<String, byte[]> blobs,
                        List<String> trailingComments) {
        this.version = version;
        this.flags = flags;
        this.checksum = checksum;
        this.blobs = blobs;
        this.trailingComments = trailingComments;
    }

    /**
     * Validates {@code data} as a shell record.
     *
     * @throws CorruptionException if the magic or checksum do not match, or the index does
     *                             not decode
     * @throws UnsupportedVersionException if the format version is not one this build reads
     */
    public static ShellRecord read(byte[] data) throws ShellStorageException {
        if (data.length < ShellFormat.MAGIC.length
            || !Arrays.equals(data, 0, ShellFormat.MAGIC.length, ShellFormat.MAGIC, 0,
                              ShellFormat.MAGIC.length)) {
            throw new CorruptionException("Not a shell record: bad magic");
        }
        if (data.length < ShellFormat.PAYLOAD_OFFSET) {
            throw new CorruptionException("Shell record header is truncated");
        }
        ByteBuffer buf = ByteBuffer.wrap(data);
        long version = Integer.toUnsignedLong(buf.getInt(ShellFormat.VERSION_OFFSET));
        if (version < ShellFormat.MIN_SUPPORTED_VERSION
            || version > ShellFormat.CURRENT_VERSION) {
            throw new UnsupportedVersionException(version);
        }

        byte[] expected = Arrays.copyOfRange(data, ShellFormat.CHECKSUM_OFFSET,
                                             ShellFormat.PAYLOAD_OFFSET);
        byte[] actual = Sha256.digest(data, ShellFormat.PAYLOAD_OFFSET,
                                      data.length - ShellFormat.PAYLOAD_OFFSET);
        if (!Sha256.matches(expected, actual)) {
            throw new CorruptionException(
                "Checksum mismatch: stored " + Sha256.toHex(expected) + ", computed "
                + Sha256.toHex(actual));
        }

        ByteBuffer payload = ByteBuffer.wrap(data, ShellFormat.PAYLOAD_OFFSET,
                                             data.length - ShellFormat.PAYLOAD_OFFSET).slice();
        try {
            return readPayload((int) version, expected, payload);
        } catch (BufferUnderflowException e) {
            throw new CorruptionException("Shell record payload is truncated", e);
        }
    }

    private static ShellRecord readPayload(int version, byte[] checksum, ByteBuffer payload)
        throws CorruptionException {
        int flags = payload.getInt();
        if ((flags & ~ShellFormat.KNOWN_FLAGS) != 0) {
            throw new CorruptionException("Unknown flags 0x" + Integer.toHexString(flags));
        }
        int count = ShellCodec.readCount(payload);
        String[] names = new String[count];
        long[] offsets = new long[count];
        long[] lengths = new long[count];
        for (int i = 0; i < count; i++) {
            names[i] = readName(payload);
            offsets[i] = Integer.toUnsignedLong(payload.getInt());
            lengths[i] = Integer.toUnsignedLong(payload.getInt());
        }
        List<String> trailing = ShellCodec.readStrings(payload);

        ByteBuffer dataArea = payload.slice();
        Map<String, byte[]> blobs = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            if (!Section.isValidName(names[i])) {
                throw new CorruptionException("Invalid section name '" + names[i] + "'");
            }
            if (offsets[i] + lengths[i] > dataArea.remaining()) {
                throw new CorruptionException(
                    "Section '" + names[i] + "' lies outside the data area");
            }
            byte[] blob = new byte[(int) lengths[i]];
            dataArea.get((int) offsets[i], blob);
            if (blobs.put(names[i], blob) != null) {
                throw new CorruptionException("Section '" + names[i] + "' is stored twice");
            }
        }
        try {
            trailing = Comments.normalize(trailing);
        } catch (IllegalArgumentException e) {
            throw new CorruptionException("Invalid trailing comment", e);
        }
        return new ShellRecord(version, flags, checksum, blobs, trailing);
    }

    private static String readName(ByteBuffer in) throws CorruptionException {
        int length = Short.toUnsignedInt(in.getShort());
        if (length > in.remaining()) {
            throw new CorruptionException("Section name exceeds the remaining data");
        }
        byte[] utf8 = new byte[length];
        in.get(utf8);
        return new String(utf8, StandardCharsets.UTF_8);
    }

    /**
     * Builds a record from already encoded section blobs.
     *
     * @param blobs section name to blob, in document order
     */
    static byte[] write(Map<String, byte[]> blobs, List<String> trailingComments,
                        boolean compressed) {
        ByteArrayOutputStream payloadBytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(payloadBytes)) {
            out.writeInt(compressed ? ShellFormat.FLAG_GZIP : 0);
            out.writeInt(blobs.size());
            long offset = 0;
            for (Map.Entry<String, byte[]> e : blobs.entrySet()) {
                byte[] name = e.getKey().getBytes(StandardCharsets.UTF_8);
                if (name.length > 0xFFFF) {
                    throw new IllegalArgumentException("Section name too long: " + e.getKey());
                }
                out.writeShort(name.length);
                out.write(name);
                out.writeInt((int) offset);
                out.writeInt(e.getValue().length);
                offset += e.getValue().length;
            }
            if (offset > 0xFFFFFFFFL) {
                throw new IllegalArgumentException("Sections exceed 4 GiB");
            }
            ShellCodec.writeStrings(out, trailingComments);
            for (byte[] blob : blobs.values()) {
                out.write(blob);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ByteArrayOutputStream failed", e);
        }
        byte[] payload = payloadBytes.toByteArray();

        ByteBuffer record = ByteBuffer.allocate(ShellFormat.PAYLOAD_OFFSET + payload.length);
        record.put(ShellFormat.MAGIC);
        record.putInt(ShellFormat.CURRENT_VERSION);
        record.put(Sha256.digest(payload));
        record.put(payload);
        return record.array();
    }

    public int getVersion() {
        return version;
    }

    public boolean isCompressed() {
        return (flags & ShellFormat.FLAG_GZIP) != 0;
    }

    public String getChecksumHex() {
        return Sha256.toHex(checksum);
    }

    public List<String> sectionNames() {
        return List.copyOf(blobs.keySet());
    }

    public boolean hasSection(String name) {
        return blobs.containsKey(name);
    }

    /**
     * Decodes a single section, or returns null if the record has none of that name.
     */
    public @Nullable Section section(String name) throws CorruptionException {
        byte[] blob = blobs.get(name);
        return blob == null ? null : ShellCodec.decodeSection(name, blob, isCompressed());
    }

    public List<String> getTrailingComments() {
        return trailingComments;
    }

    /**
     * Decodes every section. Either the whole document decodes or nothing is returned.
     */
    public Document toDocument() throws CorruptionException {
        Document doc = new Document();
        for (Map.Entry<String, byte[]> e : blobs.entrySet()) {
            doc.setSection(ShellCodec.decodeSection(e.getKey(), e.getValue(), isCompressed()));
        }
        doc.setTrailingComments(trailingComments);
        return doc;
    }

    /** Stored blobs, for reuse when saving unchanged sections. */
    Map<String, byte[]> blobs() {
        return Collections.unmodifiableMap(blobs);
    }

    @Override
    public String toString() {
        return "ShellRecord{version=" + version + ", sections=" + blobs.size() + ", checksum="
               + getChecksumHex() + "}";
    }
}
