package com.tanumd.core.codec;

import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.error.AttachmentException;
import com.tanumd.core.error.AttachmentException.Reason;
import com.tanumd.core.error.TmdFormatException;
import com.tanumd.core.model.ArchiveLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Decoding must reject archives whose content disagrees with their metadata.
 */
class TamperDetectionTest {

    private static final String PIXEL_PATH = "images/pixel.png";
    private static final byte[] PIXEL = {(byte) 0x89, 0x50, 0x4E, 0x47};

    private TmdDocument doc;
    private byte[] archive;

    @BeforeEach
    void setUp() throws IOException {
        doc = TmdDocument.create("# Tamper\n");
        doc.addAttachment(PIXEL_PATH, "image/png", PIXEL);
        archive = TmdCodec.encode(doc, Format.TMDZ);
    }

    @AfterEach
    void tearDown() {
        doc.close();
    }

    @Test
    void truncatedAttachment_failsWithLengthMismatch() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive,
            entries -> entries.put(PIXEL_PATH, Arrays.copyOf(PIXEL, 3)));

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(AttachmentException.class)
            .hasMessageContaining("length mismatch")
            .satisfies(e -> assertThat(((AttachmentException) e).reason()).isEqualTo(Reason.LENGTH_MISMATCH));
    }

    @Test
    void flippedBit_failsWithDigestMismatch() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive, entries -> {
            byte[] flipped = PIXEL.clone();
            flipped[2] ^= 0x01;
            entries.put(PIXEL_PATH, flipped);
        });

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(AttachmentException.class)
            .hasMessageContaining("sha256 mismatch")
            .satisfies(e -> assertThat(((AttachmentException) e).reason()).isEqualTo(Reason.DIGEST_MISMATCH));
    }

    @Test
    void flippedBit_withoutVerification_isAccepted() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive, entries -> {
            byte[] flipped = PIXEL.clone();
            flipped[2] ^= 0x01;
            entries.put(PIXEL_PATH, flipped);
        });

        try (TmdDocument decoded = TmdCodec.decode(tampered, Format.TMDZ, new ReadMode(false, false))) {
            assertThat(decoded.attachmentByPath(PIXEL_PATH)).isPresent();
        }
    }

    @Test
    void flippedBit_lazyMode_failsOnFirstAccess() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive, entries -> {
            byte[] flipped = PIXEL.clone();
            flipped[0] ^= 0x01;
            entries.put(PIXEL_PATH, flipped);
        });

        try (TmdDocument decoded = TmdCodec.decode(tampered, Format.TMDZ, new ReadMode(false, true))) {
            var meta = decoded.attachmentByPath(PIXEL_PATH).orElseThrow();
            assertThatThrownBy(() -> decoded.attachmentData(meta.id()))
                .isInstanceOf(AttachmentException.class)
                .satisfies(e -> assertThat(((AttachmentException) e).reason()).isEqualTo(Reason.DIGEST_MISMATCH));
        }
    }

    @Test
    void undeclaredEntry_isRejected() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive,
            entries -> entries.put("images/extra.png", new byte[] {1}));

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("undeclared entry `images/extra.png`");
    }

    @Test
    void missingAttachmentEntry_isRejected() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive, entries -> entries.remove(PIXEL_PATH));

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("missing entry for attachment `images/pixel.png`");
    }

    @Test
    void missingRequiredEntry_isRejected() throws IOException {
        for (String required : ArchiveLayout.METADATA_ENTRIES) {
            byte[] tampered = ArchiveRewriter.rewrite(archive, entries -> entries.remove(required));

            assertThatThrownBy(() -> TmdCodec.decode(tampered))
                .isInstanceOf(TmdFormatException.class)
                .hasMessageContaining("missing required entry `" + required + "`");
        }
    }

    @Test
    void futureMajorVersion_isRejected() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive, entries -> {
            String manifest = new String(entries.get(ArchiveLayout.MANIFEST), StandardCharsets.UTF_8);
            entries.put(ArchiveLayout.MANIFEST,
                manifest.replaceFirst("\"major\"\\s*:\\s*1", "\"major\" : 2")
                    .getBytes(StandardCharsets.UTF_8));
        });

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("unsupported tmd_version 2.0.0");
    }

    @Test
    void malformedManifest_isRejected() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive,
            entries -> entries.put(ArchiveLayout.MANIFEST, "{not json".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("failed to parse manifest.json");
    }

    @Test
    void nullManifestDocument_isRejected() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive,
            entries -> entries.put(ArchiveLayout.MANIFEST, "null".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("manifest.json must contain a JSON object");
    }

    @Test
    void nullAttachmentDeclaration_isRejected() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive, entries -> {
            entries.put(ArchiveLayout.ATTACHMENTS, "{\"attachments\":[null]}".getBytes(StandardCharsets.UTF_8));
            entries.remove(PIXEL_PATH);
        });

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("failed to parse attachments.json");
    }

    @Test
    void danglingCoverImage_isRejected() throws IOException {
        UUID pixel = doc.attachmentByPath(PIXEL_PATH).orElseThrow().id();
        doc.setCoverImage(pixel);
        byte[] withCover = TmdCodec.encode(doc, Format.TMDZ);
        UUID stranger = UUID.randomUUID();
        byte[] tampered = ArchiveRewriter.rewrite(withCover, entries -> {
            String manifest = new String(entries.get(ArchiveLayout.MANIFEST), StandardCharsets.UTF_8);
            entries.put(ArchiveLayout.MANIFEST,
                manifest.replace(pixel.toString(), stranger.toString()).getBytes(StandardCharsets.UTF_8));
        });

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("cover image " + stranger + " does not name a declared attachment");
    }

    @Test
    void corruptDatabase_isRejected() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive,
            entries -> entries.put(ArchiveLayout.DATABASE, "not a database".getBytes(StandardCharsets.UTF_8)));

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("is not a SQLite database");
    }

    @Test
    void invalidUtf8IndexMarkdown_isRejectedForTmdz() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive,
            entries -> entries.put(ArchiveLayout.MARKDOWN, new byte[] {(byte) 0xFF, (byte) 0xFE}));

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("index.md is not valid UTF-8");
    }

    @Test
    void traversalPathInIndex_isRejected() throws IOException {
        byte[] tampered = ArchiveRewriter.rewrite(archive, entries -> {
            String index = new String(entries.get(ArchiveLayout.ATTACHMENTS), StandardCharsets.UTF_8);
            entries.put(ArchiveLayout.ATTACHMENTS,
                index.replace(PIXEL_PATH, "../evil.png").getBytes(StandardCharsets.UTF_8));
            entries.put("../evil.png", entries.remove(PIXEL_PATH));
        });

        assertThatThrownBy(() -> TmdCodec.decode(tampered))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("invalid attachment path");
    }

    @Test
    void truncatedTmdFile_isRejected() throws IOException {
        byte[] tmd = TmdCodec.encode(doc, Format.TMD);
        byte[] truncated = Arrays.copyOf(tmd, tmd.length - 5);

        assertThatThrownBy(() -> TmdCodec.decode(truncated, Format.TMD, ReadMode.defaults()))
            .isInstanceOf(TmdFormatException.class);
    }

    @Test
    void tmdzDecodedAsTmd_isRejected() {
        assertThatThrownBy(() -> TmdCodec.decode(archive, Format.TMD, ReadMode.defaults()))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("TMD trailer must be 13 bytes");
    }
}
