package com.dotprint.core.output;

import com.dotprint.core.generator.GeneratedDiagram;

import java.util.List;
import java.util.Objects;

/**
 * The documents produced by one run.
 *
 * @param files generated files in output order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Wraps generated DOT diagrams, one file per diagram.
     *
     * @param diagrams generated diagrams
     * @return the output
     */
    public static GeneratedOutput of(List<GeneratedDiagram> diagrams) {
        return new GeneratedOutput(diagrams.stream()
            .map(diagram -> new GeneratedFile(diagram.fileName(), diagram.content(), GeneratedFile.DOT_CONTENT_TYPE))
            .toList());
    }
}
