package com.dotprint.core.config;

import com.dotprint.core.generator.GeneratorConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Root configuration for dotprint.
 *
 * <p>Loaded from {@code dotprint.yaml}. Missing sections or values take their
 * defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * render:
 *   lineWidth: 100
 *   ribbonFraction: 0.5
 *   indent: 2
 *
 * output:
 *   directory: "./build/dot"
 *   target: filesystem
 * }</pre>
 *
 * @param render layout settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DotPrintConfig(
    @JsonProperty("render") RenderSettings render,
    @JsonProperty("output") OutputSettings output
) {
    /** Default output directory. */
    public static final String DEFAULT_DIRECTORY = ".";

    /** Default output target id. */
    public static final String DEFAULT_TARGET = "filesystem";

    /**
     * Compact constructor; absent sections become defaults.
     */
    public DotPrintConfig {
        if (render == null) {
            render = new RenderSettings(null, null, null);
        }
        if (output == null) {
            output = new OutputSettings(null, null, null);
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return default configuration
     */
    public static DotPrintConfig defaults() {
        return new DotPrintConfig(null, null);
    }

    /**
     * Layout settings.
     *
     * @param lineWidth preferred maximum line width
     * @param ribbonFraction fraction of the line available to non-indentation text
     * @param indent statement indentation
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RenderSettings(
        @JsonProperty("lineWidth") Integer lineWidth,
        @JsonProperty("ribbonFraction") Double ribbonFraction,
        @JsonProperty("indent") Integer indent
    ) {
        /**
         * Converts these settings to a generator configuration, filling gaps with
         * defaults.
         *
         * @return generator config
         */
        public GeneratorConfig toGeneratorConfig() {
            GeneratorConfig defaults = GeneratorConfig.defaults();
            return new GeneratorConfig(
                lineWidth != null ? lineWidth : defaults.lineWidth(),
                ribbonFraction != null ? ribbonFraction : defaults.ribbonFraction(),
                indent != null ? indent : defaults.indent()
            );
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory path
     * @param target output target id ({@code filesystem} or {@code console})
     * @param settings target-specific settings, e.g. {@code console.showHeaders}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("target") String target,
        @JsonProperty("settings") Map<String, String> settings
    ) {
        /**
         * Compact constructor; absent settings become an empty map.
         */
        public OutputSettings {
            settings = settings == null ? Map.of() : Map.copyOf(settings);
        }

        public String directoryOrDefault() {
            return directory != null ? directory : DEFAULT_DIRECTORY;
        }

        public String targetOrDefault() {
            return target != null ? target : DEFAULT_TARGET;
        }
    }
}
