package com.tanumd.core.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Strict UTF-8 decoding. Malformed or unmappable input is an error, never replaced.
 */
public final class Utf8 {

    private Utf8() {
        // Utility class
    }

    /**
     * Decodes bytes that must be valid UTF-8.
     *
     * @param bytes encoded text
     * @return decoded text
     * @throws CharacterCodingException if the bytes are not valid UTF-8
     */
    public static String decodeStrict(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
    }
}
