package com.tanumd.core.workspace;

import com.tanumd.core.codec.Format;
import com.tanumd.core.codec.TmdCodec;
import com.tanumd.core.document.TmdDocument;
import com.tanumd.core.error.TmdFormatException;
import com.tanumd.core.model.ArchiveLayout;
import com.tanumd.core.model.AttachmentMeta;
import com.tanumd.core.util.Digests;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Workspace}.
 */
class WorkspaceTest {

    private static final byte[] PIXEL = {(byte) 0x89, 0x50, 0x4E, 0x47};

    @TempDir
    Path tempDir;

    @Test
    void scaffold_createsStarterLayout() throws IOException {
        Path dir = tempDir.resolve("notes");

        Workspace.scaffold(dir, "Field Notes");

        assertThat(dir.resolve("images")).isDirectory();
        assertThat(dir.resolve("data")).isDirectory();
        assertThat(Files.readString(dir.resolve("index.md"))).startsWith("# Field Notes\n");
        try (TmdDocument doc = Workspace.read(dir)) {
            assertThat(doc.manifest().title()).isEqualTo("Field Notes");
            assertThat(doc.attachments()).isEmpty();
            assertThat(doc.databaseVersion()).isZero();
        }
    }

    @Test
    void scaffold_blankTitle_usesDefault() throws IOException {
        Path dir = tempDir.resolve("untitled");

        Workspace.scaffold(dir, " ");

        assertThat(Files.readString(dir.resolve("index.md"))).startsWith("# New TMD Document");
    }

    @Test
    void scaffold_existingDirectory_throws() {
        assertThatThrownBy(() -> Workspace.scaffold(tempDir, "x"))
            .isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    void writeThenRead_roundTripsDocument() throws IOException {
        Path dir = tempDir.resolve("ws");
        try (TmdDocument doc = TmdDocument.create("# Round trip\n")) {
            doc.setTitle("Round trip");
            UUID id = doc.addAttachment("images/pixel.png", "image/png", PIXEL);
            doc.describeAttachment(id, "Pixel", null, null);
            doc.resetDatabase("CREATE TABLE t(x INTEGER);", 3);

            Workspace.write(doc, dir);

            assertThat(dir.resolve("images/pixel.png")).hasBinaryContent(PIXEL);
            assertThat(dir.resolve(ArchiveLayout.DATABASE)).isRegularFile();
            try (TmdDocument read = Workspace.read(dir)) {
                assertThat(read.markdown()).isEqualTo("# Round trip\n");
                assertThat(read.manifest()).isEqualTo(doc.manifest());
                assertThat(read.attachments()).isEqualTo(doc.attachments());
                assertThat(read.databaseVersion()).isEqualTo(3);
            }
        }
    }

    @Test
    void read_editedAttachmentFile_recomputesDigest() throws IOException {
        Path dir = tempDir.resolve("ws");
        try (TmdDocument doc = TmdDocument.create("")) {
            doc.addAttachment("data/values.csv", "text/csv", "a,b\n".getBytes(StandardCharsets.UTF_8));
            Workspace.write(doc, dir);
        }
        byte[] edited = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);
        Files.write(dir.resolve("data/values.csv"), edited);

        try (TmdDocument read = Workspace.read(dir)) {
            AttachmentMeta meta = read.attachmentByPath("data/values.csv").orElseThrow();
            assertThat(meta.length()).isEqualTo(edited.length);
            assertThat(meta.sha256()).isEqualTo(Digests.sha256Hex(edited));
            assertThat(meta.mime()).isEqualTo("text/csv");
        }
    }

    @Test
    void read_withoutIndex_discoversFiles() throws IOException {
        Path dir = tempDir.resolve("ws");
        Workspace.scaffold(dir, "Discovery");
        Files.write(dir.resolve("images/logo.png"), PIXEL);
        Files.writeString(dir.resolve("data/notes.txt"), "hello");
        Files.writeString(dir.resolve(".hidden"), "skip me");

        try (TmdDocument doc = Workspace.read(dir)) {
            assertThat(doc.attachments()).extracting(AttachmentMeta::logicalPath)
                .containsExactly("data/notes.txt", "images/logo.png");
            assertThat(doc.attachmentByPath("images/logo.png")).map(AttachmentMeta::mime).contains("image/png");
        }
    }

    @Test
    void read_coverWithoutMatchingAttachment_isCleared() throws IOException {
        Path dir = tempDir.resolve("ws");
        try (TmdDocument doc = TmdDocument.create("# Cover\n")) {
            doc.setCoverImage(doc.addAttachment("images/cover.png", "image/png", PIXEL));
            Workspace.write(doc, dir);
        }
        Files.delete(dir.resolve(ArchiveLayout.ATTACHMENTS));

        try (TmdDocument read = Workspace.read(dir)) {
            assertThat(read.manifest().coverImage()).isNull();
            assertThat(read.attachmentByPath("images/cover.png")).isPresent();

            try (TmdDocument decoded = TmdCodec.decode(TmdCodec.encode(read, Format.TMDZ))) {
                assertThat(decoded.manifest().coverImage()).isNull();
            }
        }
    }

    @Test
    void read_indexPathEscapingDirectory_throws() throws IOException {
        Path dir = tempDir.resolve("ws");
        Workspace.scaffold(dir, "Escape");
        Files.writeString(dir.resolve(ArchiveLayout.ATTACHMENTS), """
            {"attachments":[{"id":"%s","logical_path":"../outside.bin","mime":"application/octet-stream","length":1}]}
            """.formatted(UUID.randomUUID()));

        assertThatThrownBy(() -> Workspace.read(dir))
            .isInstanceOf(TmdFormatException.class)
            .hasMessageContaining("escapes the workspace directory");
    }

    @Test
    void read_missingIndexMarkdown_throws() {
        assertThatThrownBy(() -> Workspace.read(tempDir)).isInstanceOf(IOException.class);
    }

    @Test
    void workspaceAndContainer_produceEqualDocuments() throws IOException {
        Path dir = tempDir.resolve("ws");
        Workspace.scaffold(dir, "Pack me");
        Files.write(dir.resolve("images/pixel.png"), PIXEL);
        Path packed = tempDir.resolve("packed.tmd");

        try (TmdDocument doc = Workspace.read(dir)) {
            TmdCodec.write(doc, packed, Format.TMD);
            try (TmdDocument unpacked = TmdCodec.read(packed)) {
                assertThat(unpacked.markdown()).isEqualTo(doc.markdown());
                assertThat(unpacked.attachments()).isEqualTo(doc.attachments());
            }
        }
    }
}
