package com.dotprint.core.output;

import com.dotprint.core.generator.GeneratedDiagram;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OutputTargets} discovery and the output records.
 */
class OutputTargetsTest {

    @Test
    void all_findsRegisteredTargets() {
        assertThat(OutputTargets.all())
            .extracting(OutputTarget::getId)
            .containsExactly("filesystem", "console");
    }

    @Test
    void find_ignoresCase() {
        assertThat(OutputTargets.find("CONSOLE")).isPresent();
        assertThat(OutputTargets.find("confluence")).isEmpty();
    }

    @Test
    void generatedOutput_ofDiagrams_usesFileNames() {
        GeneratedOutput output = GeneratedOutput.of(List.of(new GeneratedDiagram("G", "digraph G {\n}\n", "dot")));

        assertThat(output.files()).hasSize(1);
        assertThat(output.files().get(0).relativePath()).isEqualTo("G.dot");
        assertThat(output.files().get(0).contentType()).isEqualTo(GeneratedFile.DOT_CONTENT_TYPE);
    }

    @Test
    void outputContext_settings() {
        OutputContext context = new OutputContext("out", Map.of("console.colors", "true"));

        assertThat(context.getSetting("console.colors")).isEqualTo("true");
        assertThat(context.getSetting("missing")).isNull();
        assertThat(context.getSettingOrDefault("missing", "x")).isEqualTo("x");
        assertThat(new OutputContext("out", null).settings()).isEmpty();
    }

    @Test
    void records_rejectNulls() {
        assertThatThrownBy(() -> new OutputContext(null, Map.of())).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new GeneratedFile("a.dot", null, null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new GeneratedOutput(null)).isInstanceOf(NullPointerException.class);
    }
}
