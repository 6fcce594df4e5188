package com.dotprint.core.model;

import com.dotprint.core.attributes.Attribute;

import java.util.List;
import java.util.Objects;

/**
 * An edge statement between two nodes.
 *
 * @param from tail node identifier
 * @param to head node identifier
 * @param attributes edge attributes, printed in order
 */
public record DotEdge(
    String from,
    String to,
    List<Attribute<?>> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public DotEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}
