package com.tanumd.core.util;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Digests}.
 */
class DigestsTest {

    private static final String ABC_SHA256 = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";
    private static final String EMPTY_SHA256 = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    @Test
    void sha256Hex_knownVector_matches() {
        assertThat(Digests.sha256Hex("abc".getBytes(StandardCharsets.US_ASCII))).isEqualTo(ABC_SHA256);
    }

    @Test
    void sha256Hex_emptyInput_matchesEmptyDigest() {
        assertThat(Digests.sha256Hex(new byte[0])).isEqualTo(EMPTY_SHA256);
    }

    @Test
    void sha256Hex_buffer_doesNotConsumeBuffer() {
        ByteBuffer buffer = ByteBuffer.wrap("xabc".getBytes(StandardCharsets.US_ASCII));
        buffer.position(1);

        String digest = Digests.sha256Hex(buffer);

        assertThat(digest).isEqualTo(ABC_SHA256);
        assertThat(buffer.position()).isEqualTo(1);
    }

    @Test
    void sha256_returnsThirtyTwoBytes() {
        assertThat(Digests.sha256(new byte[] {1, 2, 3})).hasSize(Digests.SHA256_LENGTH);
    }

    @Test
    void isSha256Hex_acceptsBothCasesAndRejectsOtherStrings() {
        assertThat(Digests.isSha256Hex(ABC_SHA256)).isTrue();
        assertThat(Digests.isSha256Hex(ABC_SHA256.toUpperCase())).isTrue();
        assertThat(Digests.isSha256Hex(ABC_SHA256.substring(1))).isFalse();
        assertThat(Digests.isSha256Hex(ABC_SHA256.replace('a', 'g'))).isFalse();
        assertThat(Digests.isSha256Hex(null)).isFalse();
    }

    @Test
    void isSha256Hex_rejectsNonAsciiDigits() {
        String fullWidth = "\uFF10" + ABC_SHA256.substring(1);

        assertThat(fullWidth).hasSize(64);
        assertThat(Digests.isSha256Hex(fullWidth)).isFalse();
    }
}
