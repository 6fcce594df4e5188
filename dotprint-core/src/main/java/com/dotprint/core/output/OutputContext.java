package com.dotprint.core.output;

import java.util.Map;
import java.util.Objects;

/**
 * Settings handed to an {@link OutputTarget} when writing.
 *
 * @param outputDirectory directory files are written to
 * @param settings target-specific settings
 */
public record OutputContext(
    String outputDirectory,
    Map<String, String> settings
) {
    /**
     * Compact constructor with validation.
     */
    public OutputContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Gets a setting value.
     *
     * @param key setting key
     * @return setting value or null
     */
    public String getSetting(String key) {
        return settings.get(key);
    }

    /**
     * Gets a setting with a default.
     *
     * @param key setting key
     * @param defaultValue default value
     * @return setting value or default
     */
    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
