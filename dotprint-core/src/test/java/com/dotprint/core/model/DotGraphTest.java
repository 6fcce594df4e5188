package com.dotprint.core.model;

import com.dotprint.core.attributes.Attribute;
import com.dotprint.core.attributes.Attributes;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the graph model records.
 */
class DotGraphTest {

    @Test
    void constructor_nullLists_becomeEmpty() {
        DotGraph graph = new DotGraph(false, true, null, null, null, null, null, null);

        assertThat(graph.graphAttributes()).isEmpty();
        assertThat(graph.nodeDefaults()).isEmpty();
        assertThat(graph.edgeDefaults()).isEmpty();
        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.edges()).isEmpty();
    }

    @Test
    void constructor_copiesLists() {
        List<DotNode> nodes = new ArrayList<>();
        nodes.add(new DotNode("a", null));
        DotGraph graph = new DotGraph(false, true, "G", null, null, null, nodes, null);

        nodes.add(new DotNode("b", null));

        assertThat(graph.nodes()).hasSize(1);
    }

    @Test
    void node_keepsAttributeOrder() {
        List<Attribute<?>> attributes = List.of(Attributes.textLabel("x"), Attributes.custom("tooltip", "t"));

        assertThat(new DotNode("a", attributes).attributes()).containsExactlyElementsOf(attributes);
    }

    @Test
    void nodeAndEdge_rejectMissingIds() {
        assertThatThrownBy(() -> new DotNode(null, List.of())).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new DotEdge("a", null, List.of())).isInstanceOf(NullPointerException.class);
    }
}
