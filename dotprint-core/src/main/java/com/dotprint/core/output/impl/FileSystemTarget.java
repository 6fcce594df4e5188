package com.dotprint.core.output.impl;

import com.dotprint.core.output.GeneratedFile;
import com.dotprint.core.output.GeneratedOutput;
import com.dotprint.core.output.OutputContext;
import com.dotprint.core.output.OutputTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes generated documents below the output directory, overwriting existing files.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * OutputContext context = new OutputContext("./build/graphs", Map.of());
 * new FileSystemTarget().write(GeneratedOutput.of(List.of(diagram)), context);
 * // Creates: ./build/graphs/pipeline.dot
 * }</pre>
 */
public class FileSystemTarget implements OutputTarget {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemTarget.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void write(GeneratedOutput output, OutputContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        logger.info("Writing {} files to: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath()).normalize();
        if (!targetPath.startsWith(outputDir)) {
            throw new IllegalStateException("File escapes the output directory: " + file.relativePath());
        }

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(targetPath, file.content());
            logger.info("Wrote file: {} ({} chars)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
