package aisp.java17.parser;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/// SHA-256 helpers for content fingerprints. Equal content always yields equal digests.
public final class Sha256 {
    private Sha256() {}

    public static byte[] digest(String text) {
        return messageDigest().digest(text.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] digest(byte[] bytes) {
        return messageDigest().digest(bytes);
    }

    public static String hex(byte[] digest) {
        final var out = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            out.append(HEX[(b >>> 4) & 0x0F]).append(HEX[b & 0x0F]);
        }
        return out.toString();
    }

    public static String hex(String text) {
        return hex(digest(text));
    }

    /// First eight bytes of the digest as a long, for seeding deterministic generators.
    public static long seed(String text) {
        final byte[] d = digest(text);
        long seed = 0L;
        for (int i = 0; i < 8; i++) {
            seed = (seed << 8) | (d[i] & 0xFFL);
        }
        return seed;
    }

    private static MessageDigest messageDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is required by the Java platform.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final char[] HEX = "0123456789abcdef".toCharArray();
}
