package com.tanumd.core.codec;

import com.tanumd.core.document.TmdDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FormatTest {

    @Test
    void sniff_zipHeader_isTmdz() {
        assertThat(Format.sniff(new byte[] {'P', 'K', 3, 4, 0})).contains(Format.TMDZ);
    }

    @Test
    void sniff_markdown_isTmd() {
        assertThat(Format.sniff("# Title".getBytes(StandardCharsets.UTF_8))).contains(Format.TMD);
        assertThat(Format.sniff(new byte[] {'P', 'K'})).contains(Format.TMD);
    }

    @Test
    void sniff_markdownStartingWithZipMagic_isTmd() throws IOException {
        String markdown = "PK\u0003\u0004 looks like a ZIP header\n";
        try (TmdDocument doc = TmdDocument.create(markdown)) {
            byte[] tmd = TmdCodec.encode(doc, Format.TMD);

            assertThat(Format.sniff(tmd)).contains(Format.TMD);
            try (TmdDocument decoded = TmdCodec.decode(tmd)) {
                assertThat(decoded.markdown()).isEqualTo(markdown);
            }
        }
    }

    @Test
    void sniff_empty_isEmpty() {
        assertThat(Format.sniff(new byte[0])).isEmpty();
        assertThat(Format.sniff(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "doc.tmd, TMD",
        "DOC.TMD, TMD",
        "archive.tmdz, TMDZ",
        "dir/nested/x.Tmdz, TMDZ"
    })
    void fromFileName_knownExtensions(String name, Format expected) {
        assertThat(Format.fromFileName(name)).contains(expected);
        assertThat(Format.fromPath(Path.of(name))).contains(expected);
    }

    @Test
    void fromFileName_otherExtensions_isEmpty() {
        assertThat(Format.fromFileName("notes.md")).isEmpty();
        assertThat(Format.fromFileName("workspace")).isEmpty();
        assertThat(Format.fromPath(null)).isEmpty();
    }

    @Test
    void extension_hasNoDot() {
        assertThat(Format.TMD.extension()).isEqualTo("tmd");
        assertThat(Format.TMDZ.extension()).isEqualTo("tmdz");
    }
}
