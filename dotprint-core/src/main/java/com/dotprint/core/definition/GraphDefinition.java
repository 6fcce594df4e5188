package com.dotprint.core.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * A graph as written in a YAML definition file.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * name: pipeline
 * directed: true
 * graph:
 *   colorscheme: blues9
 * nodeDefaults:
 *   shape: box
 *   style: filled
 * nodes:
 *   - id: parse
 *     attributes:
 *       label: "Parse\nsource"
 *       fillcolor: /blues9/3
 *   - id: emit
 * edges:
 *   - from: parse
 *     to: emit
 *     attributes:
 *       arrowhead: vee
 * }</pre>
 *
 * <p>Attribute maps keep the order they are written in.
 *
 * @param name graph identifier (optional)
 * @param strict whether multi-edges are merged (default false)
 * @param directed digraph or graph (default true)
 * @param graph graph attributes
 * @param nodeDefaults default node attributes
 * @param edgeDefaults default edge attributes
 * @param nodes node definitions
 * @param edges edge definitions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GraphDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("strict") Boolean strict,
    @JsonProperty("directed") Boolean directed,
    @JsonProperty("graph") Map<String, Object> graph,
    @JsonProperty("nodeDefaults") Map<String, Object> nodeDefaults,
    @JsonProperty("edgeDefaults") Map<String, Object> edgeDefaults,
    @JsonProperty("nodes") List<NodeDefinition> nodes,
    @JsonProperty("edges") List<EdgeDefinition> edges
) {
    /**
     * A node entry.
     *
     * @param id node identifier
     * @param attributes node attributes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NodeDefinition(
        @JsonProperty("id") String id,
        @JsonProperty("attributes") Map<String, Object> attributes
    ) {}

    /**
     * An edge entry.
     *
     * @param from tail node identifier
     * @param to head node identifier
     * @param attributes edge attributes
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EdgeDefinition(
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("attributes") Map<String, Object> attributes
    ) {}
}
