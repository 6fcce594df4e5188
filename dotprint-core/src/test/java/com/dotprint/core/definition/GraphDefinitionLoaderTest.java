package com.dotprint.core.definition;

import com.dotprint.core.generator.DotGenerator;
import com.dotprint.core.generator.GeneratorConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GraphDefinitionLoader}.
 */
class GraphDefinitionLoaderTest {

    private final GraphDefinitionLoader loader = new GraphDefinitionLoader();

    @TempDir
    Path tempDir;

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(GraphDefinitionLoaderTest.class.getResource("/definitions/" + name).toURI());
    }

    @Test
    void load_fixture_readsAllSections() throws URISyntaxException {
        GraphDefinition definition = loader.load(fixture("pipeline.yaml"));

        assertThat(definition.name()).isEqualTo("pipeline");
        assertThat(definition.directed()).isTrue();
        assertThat(definition.graph()).containsKeys("colorscheme", "rankdir");
        assertThat(definition.nodes()).extracting(GraphDefinition.NodeDefinition::id).containsExactly("parse", "emit");
        assertThat(definition.edges()).hasSize(1);
        assertThat(definition.edges().get(0).from()).isEqualTo("parse");
    }

    @Test
    void load_fixture_rendersExpectedDot() throws URISyntaxException {
        GraphDefinition definition = loader.load(fixture("pipeline.yaml"));

        String dot = new DotGenerator()
            .generate(new DefinitionConverter().convert(definition), new GeneratorConfig(120, 1.0, 4))
            .content();

        // X11 colors are qualified once the graph has switched to a brewer scheme
        assertThat(dot).isEqualTo("""
            digraph pipeline {
                graph [colorscheme=blues9, rankdir=LR];
                node [shape=box, style="filled,rounded"];
                edge [color="/X11/gray"];
                parse [label="Parse\\nsource", fillcolor=3];
                emit [label=<<b>emit</b>>, penwidth=2];
                parse -> emit [arrowhead=vee, color="/X11/red:#0000ff"];
            }
            """);
    }

    @Test
    void parse_unknownFields_areIgnored() {
        GraphDefinition definition = loader.parse("""
            name: g
            theme: dark
            nodes:
              - id: a
                comment: ignored
            """);

        assertThat(definition.name()).isEqualTo("g");
        assertThat(definition.nodes()).hasSize(1);
    }

    @Test
    void parse_invalidYaml_throwsDefinitionException() {
        assertThatThrownBy(() -> loader.parse("nodes: [unclosed"))
            .isInstanceOf(DefinitionException.class);
    }

    @Test
    void parse_emptyDocument_throwsDefinitionException() {
        assertThatThrownBy(() -> loader.parse(""))
            .isInstanceOf(DefinitionException.class);
    }

    @Test
    void load_missingFile_throwsDefinitionException() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.yaml")))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("missing.yaml");
    }

    @Test
    void load_fileOnDisk_isParsed() throws IOException {
        Path file = tempDir.resolve("g.yaml");
        Files.writeString(file, "name: g\ndirected: false\n");

        GraphDefinition definition = loader.load(file);

        assertThat(definition.directed()).isFalse();
        assertThat(definition.nodes()).isNull();
    }
}
