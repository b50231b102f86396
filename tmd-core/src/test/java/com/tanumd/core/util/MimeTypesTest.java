package com.tanumd.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MimeTypes}.
 */
class MimeTypesTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest
    @CsvSource({
        "images/pixel.png, image/png",
        "photo.JPG, image/jpeg",
        "data/table.csv, text/csv",
        "notes.md, text/markdown",
        "archive, application/octet-stream",
        "images.d/blob, application/octet-stream",
        "trailing., application/octet-stream"
    })
    void fromName_usesExtensionTable(String name, String expected) {
        assertThat(MimeTypes.fromName(name)).isEqualTo(expected);
    }

    @Test
    void probe_knownExtension_usesTable() throws IOException {
        Path file = Files.write(tempDir.resolve("logo.svg"), new byte[] {'<'});

        assertThat(MimeTypes.probe(file)).isEqualTo("image/svg+xml");
    }

    @Test
    void probe_unknownExtension_neverReturnsBlank() throws IOException {
        Path file = Files.write(tempDir.resolve("blob.xyz123"), new byte[] {0});

        assertThat(MimeTypes.probe(file)).isNotBlank();
    }
}
