package com.tanumd.cli;

import com.tanumd.core.config.ConfigLoader;
import com.tanumd.core.config.TmdConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Shared {@code --config} option.
 */
public class ConfigOption {

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: ${DEFAULT-VALUE})"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    /**
     * Loads the configuration, falling back to defaults.
     *
     * @return configuration
     */
    public TmdConfig load() {
        return ConfigLoader.load(configPath);
    }
}
