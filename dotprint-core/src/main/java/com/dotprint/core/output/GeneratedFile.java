package com.dotprint.core.output;

import java.util.Objects;

/**
 * A generated document waiting to be written to a target.
 *
 * @param relativePath path relative to the output directory (e.g., "pipeline.dot")
 * @param content document text
 * @param contentType media type, e.g. {@code text/vnd.graphviz}
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Media type of DOT documents.
     */
    public static final String DOT_CONTENT_TYPE = "text/vnd.graphviz";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
