package com.dotprint.core.output.impl;

import com.dotprint.core.output.GeneratedFile;
import com.dotprint.core.output.GeneratedOutput;
import com.dotprint.core.output.OutputContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConsoleTarget}.
 */
class ConsoleTargetTest {

    private ByteArrayOutputStream buffer;
    private ConsoleTarget target;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        target = new ConsoleTarget(new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static GeneratedOutput twoFiles() {
        return new GeneratedOutput(List.of(
            new GeneratedFile("a.dot", "graph a {\n}\n", GeneratedFile.DOT_CONTENT_TYPE),
            new GeneratedFile("b.dot", "graph b {\n}\n", GeneratedFile.DOT_CONTENT_TYPE)));
    }

    @Test
    void getId_returnsConsole() {
        assertThat(target.getId()).isEqualTo("console");
    }

    @Test
    void write_singleFileWithDefaults_printsContentOnly() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("a.dot", "digraph {\n}\n", GeneratedFile.DOT_CONTENT_TYPE)));

        target.write(output, new OutputContext(".", Map.of()));

        assertThat(printed()).isEqualTo("digraph {\n}\n");
    }

    @Test
    void write_multipleFiles_separatesWithCommentLine() {
        target.write(twoFiles(), new OutputContext(".", Map.of("console.separator", "==")));

        String separator = "# " + "==".repeat(40) + System.lineSeparator();
        assertThat(printed()).isEqualTo("graph a {\n}\n" + separator + "graph b {\n}\n");
    }

    @Test
    void write_withHeaders_printsFileNames() {
        target.write(twoFiles(), new OutputContext(".", Map.of("console.showHeaders", "true")));

        assertThat(printed())
            .contains("// a.dot")
            .contains("// b.dot")
            .doesNotContain("\u001B[");
    }

    @Test
    void write_withColors_usesAnsiCodes() {
        target.write(twoFiles(), new OutputContext(".", Map.of(
            "console.showHeaders", "true",
            "console.colors", "true")));

        assertThat(printed()).contains("\u001B[36m// a.dot\u001B[0m");
    }
}
