package com.dotprint.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading dotprint configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code dotprint.yaml} into {@link DotPrintConfig}
 * records. If the file is missing or invalid, returns {@link DotPrintConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DotPrintConfig config = ConfigLoader.load(Paths.get("dotprint.yaml"));
 * GeneratorConfig layout = config.render().toGeneratorConfig();
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link DotPrintConfig#defaults()}.
     *
     * @param configPath path to {@code dotprint.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static DotPrintConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return DotPrintConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return DotPrintConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            DotPrintConfig config = YAML_MAPPER.readValue(configPath.toFile(), DotPrintConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return DotPrintConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return DotPrintConfig.defaults();
        }
    }
}
