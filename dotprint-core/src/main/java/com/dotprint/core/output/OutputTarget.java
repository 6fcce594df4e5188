package com.dotprint.core.output;

/**
 * A destination for generated DOT documents.
 *
 * <p>Targets are discovered with {@link java.util.ServiceLoader} and selected by
 * {@link #getId()}, e.g. with {@code --target console} on the command line.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.dotprint.core.output.OutputTarget}
 *
 * @see GeneratedOutput
 * @see OutputContext
 */
public interface OutputTarget {

    /**
     * Returns the unique, lowercase identifier of this target (e.g., "filesystem").
     *
     * @return target identifier
     */
    String getId();

    /**
     * Writes the generated files.
     *
     * @param output files to write
     * @param context output directory and target settings
     * @throws IllegalStateException if the files cannot be written
     */
    void write(GeneratedOutput output, OutputContext context);
}
