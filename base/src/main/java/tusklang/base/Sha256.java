/* This code is part of TuskLang. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package tusklang.base;

import org.bouncycastle.util.encoders.Hex;
import org.jspecify.annotations.Nullable;

import java.lang.ref.SoftReference;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * SHA-256 hashing with pooled digests. Storage records are checksummed on every save and load,
 * so digest instances are recycled through a soft-referenced pool instead of being looked up
 * each time. Thread-safe.
 */
public final class Sha256 {
    /**
     * Size (in bytes) of this hash
     */
    public static final int HASH_SIZE = 32;

    private static final Queue<SoftReference<MessageDigest>> digests =
        new ConcurrentLinkedQueue<>();

    private Sha256() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Takes a digest from the pool, creating one when the pool is empty.
     *
     * @throws IllegalStateException if the platform has no SHA-256 provider
     */
    public static MessageDigest getMessageDigest() {
        SoftReference<MessageDigest> ref;
        while ((ref = digests.poll()) != null) {
            MessageDigest md = ref.get();
            if (md != null) {
                return md;
            }
        }
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Resets a digest and hands it back to the pool.
     *
     * @throws IllegalArgumentException if the digest is not SHA-256
     */
    public static void returnMessageDigest(@Nullable MessageDigest md) {
        if (md == null) {
            return;
        }
        String algo = md.getAlgorithm();
        if (!("SHA-256".equals(algo) || "SHA256".equals(algo))) {
            throw new IllegalArgumentException("Expected SHA-256 algorithm but got: " + algo);
        }
        md.reset();
        digests.add(new SoftReference<>(md));
    }

    public static byte[] digest(byte[] data) {
        return digest(data, 0, data.length);
    }

    /**
     * Hashes {@code length} bytes of {@code data} starting at {@code offset}.
     */
    public static byte[] digest(byte[] data, int offset, int length) {
        MessageDigest md = getMessageDigest();
        try {
            md.update(data, offset, length);
            return md.digest();
        } finally {
            returnMessageDigest(md);
        }
    }

    /**
     * Lower-case hexadecimal rendering of a digest, for log and error messages.
     */
    public static String toHex(byte[] digest) {
        return Hex.toHexString(digest);
    }

    /**
     * Compares two digests in time independent of where they first differ.
     */
    public static boolean matches(byte[] expected, byte[] actual) {
        return MessageDigest.isEqual(expected, actual);
    }
}
