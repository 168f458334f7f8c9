package br.edu.ifba.kgraph.utils;

import org.jetbrains.annotations.NotNull;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hex digests used for content fingerprints and identifier prefixes.
 */
public final class HashUtil {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HashUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * SHA-256 of raw bytes, hex-encoded. Used as the document fingerprint.
     */
    @NotNull
    public static String sha256Hex(@NotNull byte[] content) {
        return hex(digest("SHA-256", content));
    }

    /**
     * SHA-256 of the UTF-8 encoding of a string, hex-encoded.
     */
    @NotNull
    public static String sha256Hex(@NotNull String content) {
        return sha256Hex(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * MD5 of the UTF-8 encoding of a string, hex-encoded. Not used for security.
     */
    @NotNull
    public static String md5Hex(@NotNull String content) {
        return hex(digest("MD5", content.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] digest(String algorithm, byte[] content) {
        try {
            return MessageDigest.getInstance(algorithm).digest(content);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 and MD5 are mandatory for every Java platform
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }

    private static String hex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0f];
        }
        return new String(out);
    }
}
