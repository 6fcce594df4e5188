package com.dotprint.core.generator;

import com.dotprint.core.printing.DotRenderer;

/**
 * Layout settings for generated DOT documents.
 *
 * <p>Layout only affects readability; any settings produce equivalent DOT.
 *
 * @param lineWidth preferred maximum line width
 * @param ribbonFraction fraction of the line available to non-indentation text
 * @param indent indentation of statements inside the graph body
 */
public record GeneratorConfig(
    int lineWidth,
    double ribbonFraction,
    int indent
) {
    /** Default statement indentation. */
    public static final int DEFAULT_INDENT = 4;

    /**
     * Compact constructor; out-of-range values fall back to the defaults.
     */
    public GeneratorConfig {
        if (lineWidth <= 0) {
            lineWidth = DotRenderer.DEFAULT_WIDTH;
        }
        if (!(ribbonFraction > 0.0 && ribbonFraction <= 1.0)) {
            ribbonFraction = DotRenderer.DEFAULT_RIBBON_FRACTION;
        }
        if (indent < 0) {
            indent = DEFAULT_INDENT;
        }
    }

    /**
     * Creates a default configuration: 80 columns, ribbon 0.4, indent 4.
     *
     * @return default generator config
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DotRenderer.DEFAULT_WIDTH, DotRenderer.DEFAULT_RIBBON_FRACTION, DEFAULT_INDENT);
    }
}
