package com.tanumd.core.config;

import com.tanumd.core.codec.Format;
import com.tanumd.core.codec.ReadMode;
import com.tanumd.core.codec.WriteMode;
import com.tanumd.core.db.DbOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("tmd.yaml");
        Files.writeString(configFile, """
            read:
              verifyHashes: false
              lazyAttachments: true

            write:
              computeHashes: true
              dedupByHash: true
              defaultFormat: tmdz

            database:
              pageSize: 8192
              journalMode: truncate
              synchronous: NORMAL
            """);

        TmdConfig config = ConfigLoader.load(configFile);

        assertThat(config.read().toReadMode()).isEqualTo(new ReadMode(false, true));
        assertThat(config.read().toReadMode().defersAttachments()).isTrue();
        assertThat(config.write().toWriteMode()).isEqualTo(new WriteMode(true, true));
        assertThat(config.write().effectiveFormat()).isEqualTo(Format.TMDZ);
        assertThat(config.database().toDbOptions()).isEqualTo(new DbOptions(8192, "TRUNCATE", "NORMAL"));
    }

    @Test
    void load_formatName_ignoresCase() throws IOException {
        Path lower = tempDir.resolve("lower.yaml");
        Files.writeString(lower, """
            write:
              defaultFormat: tmdz
            """);
        Path mixed = tempDir.resolve("mixed.yaml");
        Files.writeString(mixed, """
            write:
              defaultFormat: TmdZ
            """);

        assertThat(ConfigLoader.load(lower).write().effectiveFormat()).isEqualTo(Format.TMDZ);
        assertThat(ConfigLoader.load(mixed).write().effectiveFormat()).isEqualTo(Format.TMDZ);
    }

    @Test
    void load_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tmd.yaml");
        Files.writeString(configFile, """
            write:
              dedupByHash: true
            """);

        TmdConfig config = ConfigLoader.load(configFile);

        assertThat(config.read().toReadMode()).isEqualTo(ReadMode.defaults());
        assertThat(config.write().toWriteMode()).isEqualTo(new WriteMode(true, true));
        assertThat(config.write().effectiveFormat()).isEqualTo(Format.TMD);
        assertThat(config.database().toDbOptions()).isEqualTo(DbOptions.defaults());
    }

    @Test
    void load_missingFile_returnsDefaults() {
        TmdConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(TmdConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tmd.yaml");
        Files.writeString(configFile, "read: [unclosed");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(TmdConfig.defaults());
    }

    @Test
    void load_invalidDatabaseOptions_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tmd.yaml");
        Files.writeString(configFile, """
            database:
              pageSize: 1000
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(TmdConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("tmd.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(TmdConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(TmdConfig.defaults());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("tmd.yaml");
        Files.writeString(configFile, """
            read:
              verifyHashes: false
              somethingNew: 1
            future:
              enabled: true
            """);

        assertThat(ConfigLoader.load(configFile).read().verifyHashes()).isFalse();
    }
}
