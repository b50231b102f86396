package com.tanumd.core.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@code tmd.yaml} into a {@link TmdConfig}.
 *
 * <p>A missing, unreadable or invalid file yields {@link TmdConfig#defaults()} and a warning;
 * loading never fails.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TmdConfig config = ConfigLoader.load(Path.of("tmd.yaml"));
 * TmdDocument doc = TmdCodec.read(path, null, config.read().toReadMode(),
 *     config.database().toDbOptions());
 * }</pre>
 */
public final class ConfigLoader {

    /** Conventional configuration file name. */
    public static final String DEFAULT_FILE_NAME = "tmd.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code tmd.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static TmdConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return TmdConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return TmdConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            TmdConfig config = YAML_MAPPER.readValue(configPath.toFile(), TmdConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return TmdConfig.defaults();
            }
            // Fail fast on database values SQLite would reject later.
            config.database().toDbOptions();
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return TmdConfig.defaults();
        }
    }
}
