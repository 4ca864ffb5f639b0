/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.shell;

import tusklang.lang.Entry;
import tusklang.lang.Section;
import tusklang.lang.value.ArrayValue;
import tusklang.lang.value.BoolValue;
import tusklang.lang.value.FujsenCode;
import tusklang.lang.value.MapValue;
import tusklang.lang.value.NullValue;
import tusklang.lang.value.NumberValue;
import tusklang.lang.value.StringValue;
import tusklang.lang.value.Value;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Binary encoding of single sections. A section blob holds the section's comments followed by
 * its entries in order; the name lives in the record index.
 */
final class ShellCodec {
    /** Offset of the OS field in a gzip header. */
    private static final int GZIP_OS_OFFSET = 9;

    private ShellCodec() {
        throw new UnsupportedOperationException("Utility class");
    }

    static byte[] encodeSection(Section section, boolean compress) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            writeStrings(out, section.getComments());
            out.writeInt(section.size());
            for (Entry e : section.entries()) {
                writeString(out, e.key());
                writeStrings(out, e.comments());
                writeValue(out, e.value(), 0);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("ByteArrayOutputStream failed", e);
        }
        byte[] blob = bytes.toByteArray();
        return compress ? gzip(blob) : blob;
    }

    static Section decodeSection(String name, byte[] blob, boolean compressed)
        throws CorruptionException {
        ByteBuffer in = ByteBuffer.wrap(compressed ? gunzip(name, blob) : blob);
        try {
            Section.Builder builder = Section.builder(name);
            builder.addComments(readStrings(in));
            int count = readCount(in);
            for (int i = 0; i < count; i++) {
                String key = readString(in);
                List<String> comments = readStrings(in);
                builder.put(key, readValue(in, 0), comments);
            }
            if (in.hasRemaining()) {
                throw new CorruptionException(
                    "Section '" + name + "' has " + in.remaining() + " unread bytes");
            }
            return builder.build();
        } catch (BufferUnderflowException e) {
            throw new CorruptionException("Section '" + name + "' is truncated", e);
        } catch (IllegalArgumentException e) {
            throw new CorruptionException("Section '" + name + "' does not decode", e);
        }
    }

    static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] utf8 = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(utf8.length);
        out.write(utf8);
    }

    static void writeStrings(DataOutputStream out, List<String> strings) throws IOException {
        out.writeInt(strings.size());
        for (String s : strings) {
            writeString(out, s);
        }
    }

    static String readString(ByteBuffer in) throws CorruptionException {
        int length = readCount(in);
        if (length > in.remaining()) {
            throw new CorruptionException(
                "String of " + length + " bytes exceeds the " + in.remaining() + " remaining");
        }
        ByteBuffer slice = in.slice();
        slice.limit(length);
        in.position(in.position() + length);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                                         .onMalformedInput(CodingErrorAction.REPORT)
                                         .onUnmappableCharacter(CodingErrorAction.REPORT)
                                         .decode(slice)
                                         .toString();
        } catch (CharacterCodingException e) {
            throw new CorruptionException("Invalid UTF-8 in string", e);
        }
    }

    static List<String> readStrings(ByteBuffer in) throws CorruptionException {
        int count = readCount(in);
        List<String> strings = new ArrayList<>(Math.min(count, in.remaining() / 4));
        for (int i = 0; i < count; i++) {
            strings.add(readString(in));
        }
        return strings;
    }

    /**
     * Reads an unsigned 32 bit count. Each counted item takes at least one byte, so a count
     * larger than what is left cannot be genuine.
     */
    static int readCount(ByteBuffer in) throws CorruptionException {
        long count = Integer.toUnsignedLong(in.getInt());
        if (count > in.remaining()) {
            throw new CorruptionException("Count " + count + " exceeds the remaining data");
        }
        return (int) count;
    }

    private static void writeValue(DataOutputStream out, Value value, int depth)
        throws IOException {
        if (depth > ShellFormat.MAX_NESTING) {
            throw new IllegalArgumentException(
                "Values nested deeper than " + ShellFormat.MAX_NESTING + " levels");
        }
        if (value instanceof BoolValue b) {
            out.writeByte(b.value() ? ShellFormat.TAG_TRUE : ShellFormat.TAG_FALSE);
        } else if (value instanceof NumberValue n) {
            out.writeByte(ShellFormat.TAG_NUMBER);
            writeString(out, n.value().toString());
        } else if (value instanceof StringValue s) {
            out.writeByte(ShellFormat.TAG_STRING);
            writeString(out, s.value());
        } else if (value instanceof ArrayValue a) {
            out.writeByte(ShellFormat.TAG_ARRAY);
            out.writeInt(a.size());
            for (Value item : a.items()) {
                writeValue(out, item, depth + 1);
            }
        } else if (value instanceof MapValue m) {
            out.writeByte(ShellFormat.TAG_MAP);
            out.writeInt(m.size());
            for (Map.Entry<String, Value> e : m.entries().entrySet()) {
                writeString(out, e.getKey());
                writeValue(out, e.getValue(), depth + 1);
            }
        } else if (value instanceof FujsenCode f) {
            out.writeByte(ShellFormat.TAG_FUJSEN);
            writeString(out, f.body());
            if (f.name() == null) {
                out.writeByte(0);
            } else {
                out.writeByte(1);
                writeString(out, f.name());
            }
            writeStrings(out, f.parameters());
        } else {
            out.writeByte(ShellFormat.TAG_NULL);
        }
    }

    private static Value readValue(ByteBuffer in, int depth) throws CorruptionException {
        if (depth > ShellFormat.MAX_NESTING) {
            throw new CorruptionException(
                "Values nested deeper than " + ShellFormat.MAX_NESTING + " levels");
        }
        byte tag = in.get();
        return switch (tag) {
            case ShellFormat.TAG_NULL -> NullValue.INSTANCE;
            case ShellFormat.TAG_FALSE -> BoolValue.FALSE;
            case ShellFormat.TAG_TRUE -> BoolValue.TRUE;
            case ShellFormat.TAG_NUMBER -> readNumber(in);
            case ShellFormat.TAG_STRING -> new StringValue(readString(in));
            case ShellFormat.TAG_ARRAY -> {
                int count = readCount(in);
                List<Value> items = new ArrayList<>(count);
                for (int i = 0; i < count; i++) {
                    items.add(readValue(in, depth + 1));
                }
                yield new ArrayValue(items);
            }
            case ShellFormat.TAG_MAP -> {
                int count = readCount(in);
                Map<String, Value> entries = new LinkedHashMap<>();
                for (int i = 0; i < count; i++) {
                    String key = readString(in);
                    entries.put(key, readValue(in, depth + 1));
                }
                yield new MapValue(entries);
            }
            case ShellFormat.TAG_FUJSEN -> {
                String body = readString(in);
                String name = in.get() != 0 ? readString(in) : null;
                yield new FujsenCode(body, readStrings(in), name);
            }
            default -> throw new CorruptionException("Unknown value tag " + tag);
        };
    }

    private static NumberValue readNumber(ByteBuffer in) throws CorruptionException {
        String text = readString(in);
        try {
            return new NumberValue(new BigDecimal(text));
        } catch (NumberFormatException e) {
            throw new CorruptionException("Invalid number '" + text + "'", e);
        }
    }

    static byte[] gzip(byte[] data) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(data.length / 2 + 32);
        try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
            out.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException("ByteArrayOutputStream failed", e);
        }
        byte[] compressed = bytes.toByteArray();
        // The OS byte differs between platforms; pin it so equal input gives equal records
        compressed[GZIP_OS_OFFSET] = 0;
        return compressed;
    }

    private static byte[] gunzip(String name, byte[] data) throws CorruptionException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new CorruptionException("Section '" + name + "' does not decompress", e);
        }
    }
}
