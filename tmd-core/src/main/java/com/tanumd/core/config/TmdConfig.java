package com.tanumd.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tanumd.core.codec.Format;
import com.tanumd.core.codec.ReadMode;
import com.tanumd.core.codec.WriteMode;
import com.tanumd.core.db.DbOptions;

/**
 * Tool configuration, loaded from {@code tmd.yaml}.
 *
 * <p>Every field is optional; absent values fall back to the library defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * read:
 *   verifyHashes: true
 *   lazyAttachments: false
 *
 * write:
 *   computeHashes: true
 *   dedupByHash: false
 *   defaultFormat: tmd
 *
 * database:
 *   pageSize: 4096
 *   journalMode: DELETE
 *   synchronous: FULL
 * }</pre>
 *
 * @param read decoding options
 * @param write encoding options
 * @param database options for new and materialized databases
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TmdConfig(
    @JsonProperty("read") ReadConfig read,
    @JsonProperty("write") WriteConfig write,
    @JsonProperty("database") DatabaseConfig database
) {
    /**
     * Compact constructor filling absent sections.
     */
    public TmdConfig {
        read = read == null ? new ReadConfig(null, null) : read;
        write = write == null ? new WriteConfig(null, null, null) : write;
        database = database == null ? new DatabaseConfig(null, null, null) : database;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static TmdConfig defaults() {
        return new TmdConfig(null, null, null);
    }

    /**
     * Decoding options.
     *
     * @param verifyHashes verify attachment digests while reading (default true)
     * @param lazyAttachments defer attachment loading when not verifying (default false)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReadConfig(
        @JsonProperty("verifyHashes") Boolean verifyHashes,
        @JsonProperty("lazyAttachments") Boolean lazyAttachments
    ) {
        public ReadMode toReadMode() {
            ReadMode defaults = ReadMode.defaults();
            return new ReadMode(
                verifyHashes == null ? defaults.verifyHashes() : verifyHashes,
                lazyAttachments == null ? defaults.lazyAttachments() : lazyAttachments);
        }
    }

    /**
     * Encoding options.
     *
     * @param computeHashes check digests before writing (default true)
     * @param dedupByHash reuse checksums of identical content (default false)
     * @param defaultFormat layout used when a target has no recognized extension (default tmd)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WriteConfig(
        @JsonProperty("computeHashes") Boolean computeHashes,
        @JsonProperty("dedupByHash") Boolean dedupByHash,
        @JsonProperty("defaultFormat") Format defaultFormat
    ) {
        public WriteMode toWriteMode() {
            WriteMode defaults = WriteMode.defaults();
            return new WriteMode(
                computeHashes == null ? defaults.computeHashes() : computeHashes,
                dedupByHash == null ? defaults.dedupByHash() : dedupByHash);
        }

        public Format effectiveFormat() {
            return defaultFormat == null ? Format.TMD : defaultFormat;
        }
    }

    /**
     * SQLite settings.
     *
     * @param pageSize page size in bytes
     * @param journalMode journal mode
     * @param synchronous synchronous level
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DatabaseConfig(
        @JsonProperty("pageSize") Integer pageSize,
        @JsonProperty("journalMode") String journalMode,
        @JsonProperty("synchronous") String synchronous
    ) {
        public DbOptions toDbOptions() {
            return new DbOptions(pageSize, journalMode, synchronous);
        }
    }
}
