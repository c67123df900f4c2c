package de.bsommerfeld.mandump.repodata.hash;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Digest helpers for repository fingerprints.
 *
 * <p>All fingerprints are rendered as weak entity tags of the form
 * {@code W/"<unpadded base64url digest>"} so they can be handed out as opaque
 * cache-validation tokens.
 */
public final class HashUtil {

    private static final String ALGORITHM = "SHA-1";
    private static final Base64.Encoder ETAG_ENCODING = Base64.getUrlEncoder().withoutPadding();

    private HashUtil() {}

    /**
     * Returns a fresh SHA-1 digest.
     */
    public static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform implementation must provide SHA-1
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }

    /**
     * Computes the raw SHA-1 digest of a byte array.
     */
    public static byte[] sha1(byte[] data) {
        MessageDigest digest = sha1();
        digest.update(data);
        return digest.digest();
    }

    /**
     * Feeds a little-endian 64-bit integer into the digest.
     */
    public static void updateLong(MessageDigest digest, long value) {
        digest.update(ByteBuffer.allocate(Long.BYTES)
                .order(ByteOrder.LITTLE_ENDIAN)
                .putLong(value)
                .array());
    }

    /**
     * Feeds the UTF-8 bytes of a string into the digest.
     */
    public static void updateString(MessageDigest digest, String value) {
        digest.update(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Wraps a finished digest as a weak entity tag.
     */
    public static String etag(byte[] digest) {
        return "W/\"" + ETAG_ENCODING.encodeToString(digest) + "\"";
    }
}
