package com.dotprint.core.generator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dotprint.core.attributes.Attribute;
import com.dotprint.core.model.DotEdge;
import com.dotprint.core.model.DotGraph;
import com.dotprint.core.model.DotNode;
import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotRenderer;
import com.dotprint.core.printing.Printers;

/**
 * Generates DOT documents from {@link DotGraph} models.
 *
 * <p>The document follows a fixed statement order:
 * <pre>{@code
 * strict digraph G {
 *     graph [rankdir=LR];
 *     node [shape=box];
 *     edge [color=gray];
 *     a [label="Start"];
 *     a -> b;
 * }
 * }</pre>
 * Default statements are omitted when empty. Identifiers and values go through the
 * DOT printing engine, so they are escaped and quoted exactly where the grammar
 * requires it.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DotGenerator generator = new DotGenerator();
 * GeneratedDiagram diagram = generator.generate(graph, GeneratorConfig.defaults());
 * // diagram.content() contains the DOT text, diagram.fileName() e.g. "G.dot"
 * }</pre>
 *
 * @see <a href="https://graphviz.org/doc/info/lang.html">The DOT Language</a>
 */
public class DotGenerator {

    private static final Logger log = LoggerFactory.getLogger(DotGenerator.class);

    private static final String FILE_EXTENSION = "dot";
    private static final String DEFAULT_NAME = "graph";
    private static final String NAME_SANITIZATION_PATTERN = "[^a-zA-Z0-9_.-]";

    private static final String DIRECTED_EDGE = "->";
    private static final String UNDIRECTED_EDGE = "--";

    /**
     * Generates the DOT document for a graph.
     *
     * @param graph graph to print
     * @param config layout settings
     * @return generated document, named after the graph id
     */
    public GeneratedDiagram generate(DotGraph graph, GeneratorConfig config) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(config, "config must not be null");

        log.debug("Generating DOT for graph '{}' ({} nodes, {} edges)",
            graph.id(), graph.nodes().size(), graph.edges().size());

        DotCode code = toDot(graph, config.indent());
        String content = DotRenderer.renderDot(code, config.lineWidth(), config.ribbonFraction()) + "\n";

        String name = diagramName(graph);
        log.info("Generated DOT document: {}.{}", name, FILE_EXTENSION);

        return new GeneratedDiagram(name, content, FILE_EXTENSION);
    }

    /**
     * Builds the printing code for a whole graph.
     *
     * @param graph graph to print
     * @param indent indentation of the body statements
     * @return code printing the graph
     */
    public DotCode toDot(DotGraph graph, int indent) {
        List<DotCode> statements = new ArrayList<>();
        appendDefaults(statements, "graph", graph.graphAttributes());
        appendDefaults(statements, "node", graph.nodeDefaults());
        appendDefaults(statements, "edge", graph.edgeDefaults());
        for (DotNode node : graph.nodes()) {
            statements.add(statement(Printers.STRING.toDot(node.id()), node.attributes()));
        }
        String edgeOp = graph.directed() ? DIRECTED_EDGE : UNDIRECTED_EDGE;
        for (DotEdge edge : graph.edges()) {
            DotCode endpoints = Printers.STRING.toDot(edge.from())
                .appendSpaced(DotCode.text(edgeOp))
                .appendSpaced(Printers.STRING.toDot(edge.to()));
            statements.add(statement(endpoints, edge.attributes()));
        }

        List<DotCode> lines = new ArrayList<>(statements.size() * 2);
        for (DotCode statement : statements) {
            lines.add(DotCode.hardLine());
            lines.add(statement);
        }
        DotCode body = DotCode.hcat(lines);

        return header(graph)
            .append(body.nest(indent))
            .append(DotCode.hardLine())
            .append(DotCode.text("}"));
    }

    /**
     * Prints an attribute list, e.g. {@code [label=a, color=red]}, wrapping long lists
     * one attribute per line.
     *
     * @param attributes attributes in order
     * @return code printing the list
     */
    public DotCode attributeList(List<Attribute<?>> attributes) {
        List<DotCode> fields = attributes.stream().map(Attribute::unqtDot).toList();
        return DotCode.brackets(DotCode.sep(DotCode.punctuate(DotCode.COMMA, fields)).align());
    }

    private DotCode header(DotGraph graph) {
        List<DotCode> parts = new ArrayList<>();
        if (graph.strict()) {
            parts.add(DotCode.text("strict"));
        }
        parts.add(DotCode.text(graph.directed() ? "digraph" : "graph"));
        if (graph.id() != null) {
            parts.add(Printers.STRING.toDot(graph.id()));
        }
        parts.add(DotCode.text("{"));
        return DotCode.hsep(parts);
    }

    private void appendDefaults(List<DotCode> statements, String keyword, List<Attribute<?>> attributes) {
        if (!attributes.isEmpty()) {
            statements.add(statement(DotCode.text(keyword), attributes));
        }
    }

    private DotCode statement(DotCode subject, List<Attribute<?>> attributes) {
        DotCode code = attributes.isEmpty() ? subject : subject.appendSpaced(attributeList(attributes));
        return code.append(DotCode.SEMI);
    }

    private String diagramName(DotGraph graph) {
        if (graph.id() == null || graph.id().isBlank()) {
            return DEFAULT_NAME;
        }
        return graph.id().replaceAll(NAME_SANITIZATION_PATTERN, "_");
    }
}
