package com.dotprint.core.model;

import com.dotprint.core.attributes.Attribute;

import java.util.List;

/**
 * A graph to be written as a DOT document.
 *
 * <p>Statements are printed in list order, which also fixes the order color schemes
 * and scheme-relative colors are rendered in.
 *
 * @param strict whether multi-edges are merged
 * @param directed digraph or graph
 * @param id optional graph identifier (nullable)
 * @param graphAttributes attributes of the graph itself
 * @param nodeDefaults default attributes for all nodes
 * @param edgeDefaults default attributes for all edges
 * @param nodes node statements
 * @param edges edge statements
 */
public record DotGraph(
    boolean strict,
    boolean directed,
    String id,
    List<Attribute<?>> graphAttributes,
    List<Attribute<?>> nodeDefaults,
    List<Attribute<?>> edgeDefaults,
    List<DotNode> nodes,
    List<DotEdge> edges
) {
    /**
     * Compact constructor with validation.
     */
    public DotGraph {
        graphAttributes = graphAttributes == null ? List.of() : List.copyOf(graphAttributes);
        nodeDefaults = nodeDefaults == null ? List.of() : List.copyOf(nodeDefaults);
        edgeDefaults = edgeDefaults == null ? List.of() : List.copyOf(edgeDefaults);
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * An empty graph.
     *
     * @param id graph identifier (nullable)
     * @param directed digraph or graph
     * @return the graph
     */
    public static DotGraph empty(String id, boolean directed) {
        return new DotGraph(false, directed, id, List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
