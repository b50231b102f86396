package com.tanumd.core.codec;

import com.tanumd.core.error.TmdFormatException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Framing of the hybrid {@code .tmd} layout.
 *
 * <p>A {@code .tmd} file is {@code <markdown bytes><zip bytes>}. The ZIP end-of-central-directory
 * (EOCD) comment holds the trailer: the 5-byte signature {@code "TMD1\0"} followed by the
 * markdown length as an unsigned 64-bit little-endian integer. ZIP offsets are relative to the
 * start of the archive, not of the file.
 *
 * <p>Every offset taken from the input is range-checked before use.
 */
public final class TmdTrailer {

    /** Trailer signature. */
    static final byte[] SIGNATURE = "TMD1\0".getBytes(StandardCharsets.US_ASCII);

    /** Full trailer length: signature plus the 8-byte markdown length. */
    public static final int LENGTH = SIGNATURE.length + Long.BYTES;

    static final int EOCD_SIZE = 22;
    static final int MAX_COMMENT_LENGTH = 0xFFFF;
    private static final int MAX_EOCD_SCAN = MAX_COMMENT_LENGTH + EOCD_SIZE;
    private static final int COMMENT_LENGTH_OFFSET = 20;
    private static final byte[] EOCD_SIGNATURE = {'P', 'K', 0x05, 0x06};

    private TmdTrailer() {
        // Utility class
    }

    /**
     * Location of the two halves of a {@code .tmd} file.
     *
     * @param markdownLength length of the markdown prefix; the archive starts here
     * @param eocdOffset absolute offset of the EOCD record
     */
    public record Split(int markdownLength, int eocdOffset) {

        /**
         * Copies the markdown prefix.
         *
         * @param file whole file
         * @return markdown bytes
         */
        public byte[] markdown(byte[] file) {
            return Arrays.copyOfRange(file, 0, markdownLength);
        }

        /**
         * Copies the archive part.
         *
         * @param file whole file
         * @return ZIP bytes
         */
        public byte[] archive(byte[] file) {
            return Arrays.copyOfRange(file, markdownLength, file.length);
        }
    }

    /**
     * Encodes the trailer for a markdown prefix of the given length.
     *
     * @param markdownLength prefix length in bytes
     * @return 13 trailer bytes
     */
    public static byte[] encode(long markdownLength) {
        if (markdownLength < 0) {
            throw new IllegalArgumentException("markdown length must not be negative: " + markdownLength);
        }
        return ByteBuffer.allocate(LENGTH)
            .order(ByteOrder.LITTLE_ENDIAN)
            .put(SIGNATURE)
            .putLong(markdownLength)
            .array();
    }

    /**
     * Joins a markdown prefix and an archive written with an empty comment, installing the
     * trailer as the archive comment.
     *
     * @param markdown markdown bytes
     * @param archive ZIP bytes whose EOCD comment is empty
     * @return complete {@code .tmd} bytes
     * @throws TmdFormatException if the archive has no EOCD or already carries a comment
     */
    public static byte[] join(byte[] markdown, byte[] archive) {
        return join(markdown, archive, encode(markdown.length));
    }

    static byte[] join(byte[] markdown, byte[] archive, byte[] trailer) {
        if (trailer.length > MAX_COMMENT_LENGTH) {
            throw new TmdFormatException("trailer of " + trailer.length + " bytes exceeds the ZIP comment limit");
        }
        int eocd = findEocd(archive);
        if (commentLength(archive, eocd) != 0 || eocd + EOCD_SIZE != archive.length) {
            throw new TmdFormatException("archive already carries an EOCD comment");
        }
        int length = Math.addExact(Math.addExact(markdown.length, archive.length), trailer.length);
        ByteBuffer out = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        out.put(markdown);
        out.put(archive, 0, eocd + COMMENT_LENGTH_OFFSET);
        out.putShort((short) trailer.length);
        out.put(trailer);
        return out.array();
    }

    /**
     * Locates the markdown prefix and the archive in a {@code .tmd} file.
     *
     * @param file whole file
     * @return split positions
     * @throws TmdFormatException if no valid trailer is found or its length is out of range
     */
    public static Split split(byte[] file) {
        int eocd = findEocd(file);
        int commentLength = commentLength(file, eocd);
        if (commentLength != LENGTH) {
            throw new TmdFormatException(
                "TMD trailer must be " + LENGTH + " bytes, found ZIP comment of " + commentLength + " bytes");
        }
        int commentStart = eocd + EOCD_SIZE;
        if (!Arrays.equals(file, commentStart, commentStart + SIGNATURE.length, SIGNATURE, 0, SIGNATURE.length)) {
            throw new TmdFormatException("missing TMD comment signature");
        }
        long markdownLength = ByteBuffer.wrap(file, commentStart + SIGNATURE.length, Long.BYTES)
            .order(ByteOrder.LITTLE_ENDIAN)
            .getLong();
        // A negative value is an unsigned length above Long.MAX_VALUE.
        if (markdownLength < 0 || markdownLength > eocd) {
            throw new TmdFormatException("markdown length " + Long.toUnsignedString(markdownLength)
                + " exceeds archive start bound " + eocd);
        }
        return new Split((int) markdownLength, eocd);
    }

    /**
     * Finds the EOCD record whose comment ends exactly at the end of the buffer.
     *
     * <p>The scan walks backwards over at most the last 65535 + 22 bytes.
     *
     * @param buffer archive or {@code .tmd} bytes
     * @return absolute EOCD offset
     * @throws TmdFormatException if no consistent EOCD record exists
     */
    static int findEocd(byte[] buffer) {
        if (buffer.length < EOCD_SIZE) {
            throw new TmdFormatException("file of " + buffer.length + " bytes is too small to contain a ZIP archive");
        }
        int lowest = Math.max(0, buffer.length - MAX_EOCD_SCAN);
        boolean signatureSeen = false;
        for (int i = buffer.length - EOCD_SIZE; i >= lowest; i--) {
            if (!isEocdSignature(buffer, i)) {
                continue;
            }
            signatureSeen = true;
            if ((long) i + EOCD_SIZE + commentLength(buffer, i) == buffer.length) {
                return i;
            }
        }
        if (signatureSeen) {
            throw new TmdFormatException("ZIP end of central directory comment length does not match the file size");
        }
        throw new TmdFormatException("ZIP end of central directory record not found");
    }

    private static boolean isEocdSignature(byte[] buffer, int offset) {
        return buffer[offset] == EOCD_SIGNATURE[0]
            && buffer[offset + 1] == EOCD_SIGNATURE[1]
            && buffer[offset + 2] == EOCD_SIGNATURE[2]
            && buffer[offset + 3] == EOCD_SIGNATURE[3];
    }

    private static int commentLength(byte[] buffer, int eocd) {
        int at = eocd + COMMENT_LENGTH_OFFSET;
        return (buffer[at] & 0xFF) | (buffer[at + 1] & 0xFF) << 8;
    }
}
