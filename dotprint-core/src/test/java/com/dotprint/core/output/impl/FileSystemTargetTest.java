package com.dotprint.core.output.impl;

import com.dotprint.core.output.GeneratedFile;
import com.dotprint.core.output.GeneratedOutput;
import com.dotprint.core.output.OutputContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemTarget}.
 */
class FileSystemTargetTest {

    private FileSystemTarget target;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        target = new FileSystemTarget();
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(target.getId()).isEqualTo("filesystem");
    }

    @Test
    void write_withSingleFile_writesFileToOutputDirectory() throws IOException {
        // Given
        String content = "digraph G {\n}\n";
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("G.dot", content, GeneratedFile.DOT_CONTENT_TYPE)));
        OutputContext context = new OutputContext(tempDir.toString(), Map.of());

        // When
        target.write(output, context);

        // Then
        assertThat(Files.readString(tempDir.resolve("G.dot"))).isEqualTo(content);
    }

    @Test
    void write_withNestedPath_createsDirectoryStructure() throws IOException {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("graphs/deps/G.dot", "graph {\n}\n", GeneratedFile.DOT_CONTENT_TYPE)));

        target.write(output, new OutputContext(tempDir.toString(), Map.of()));

        assertThat(tempDir.resolve("graphs/deps/G.dot")).exists();
    }

    @Test
    void write_withMissingOutputDirectory_createsIt() {
        Path outputDir = tempDir.resolve("new/dir");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.dot", "graph {\n}\n", GeneratedFile.DOT_CONTENT_TYPE)));

        target.write(output, new OutputContext(outputDir.toString(), Map.of()));

        assertThat(outputDir.resolve("a.dot")).exists();
    }

    @Test
    void write_withExistingFile_overwritesIt() throws IOException {
        Files.writeString(tempDir.resolve("a.dot"), "old");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.dot", "new", GeneratedFile.DOT_CONTENT_TYPE)));

        target.write(output, new OutputContext(tempDir.toString(), Map.of()));

        assertThat(Files.readString(tempDir.resolve("a.dot"))).isEqualTo("new");
    }

    @Test
    void write_withPathOutsideOutputDirectory_throws() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("../escape.dot", "graph {\n}\n", GeneratedFile.DOT_CONTENT_TYPE)));
        OutputContext context = new OutputContext(tempDir.resolve("out").toString(), Map.of());

        assertThatThrownBy(() -> target.write(output, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escape.dot");
    }

    @Test
    void write_whenOutputDirectoryIsAFile_throws() throws IOException {
        Path file = Files.writeString(tempDir.resolve("occupied"), "x");
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.dot", "graph {\n}\n", GeneratedFile.DOT_CONTENT_TYPE)));

        assertThatThrownBy(() -> target.write(output, new OutputContext(file.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class);
    }
}
