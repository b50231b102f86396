package com.tanumd.core.util;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers used for attachment integrity.
 *
 * <p>Digests travel through metadata as 64 lowercase hex characters.
 */
public final class Digests {

    /** Length of a SHA-256 digest in bytes. */
    public static final int SHA256_LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private Digests() {
        // Utility class
    }

    /**
     * Computes the SHA-256 digest of a byte array.
     *
     * @param data input bytes
     * @return 32-byte digest
     */
    public static byte[] sha256(byte[] data) {
        return newSha256().digest(data);
    }

    /**
     * Computes the SHA-256 digest of the remaining bytes of a buffer without moving its position.
     *
     * @param data input buffer
     * @return 32-byte digest
     */
    public static byte[] sha256(ByteBuffer data) {
        MessageDigest digest = newSha256();
        digest.update(data.duplicate());
        return digest.digest();
    }

    /**
     * Computes the SHA-256 digest of a byte array as lowercase hex.
     *
     * @param data input bytes
     * @return 64 character hex string
     */
    public static String sha256Hex(byte[] data) {
        return HEX.formatHex(sha256(data));
    }

    /**
     * Computes the SHA-256 digest of a buffer's remaining bytes as lowercase hex.
     *
     * @param data input buffer (position is not changed)
     * @return 64 character hex string
     */
    public static String sha256Hex(ByteBuffer data) {
        return HEX.formatHex(sha256(data));
    }

    /**
     * Checks whether a string is a well-formed hex SHA-256 digest (either case).
     *
     * @param value candidate string
     * @return true if 64 hex characters
     */
    public static boolean isSha256Hex(String value) {
        if (value == null || value.length() != SHA256_LENGTH * 2) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
            if (!hex) {
                return false;
            }
        }
        return true;
    }

    /**
     * Encodes bytes as lowercase hex.
     *
     * @param bytes input bytes
     * @return hex string
     */
    public static String toHex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
