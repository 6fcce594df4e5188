package com.dotprint.core.model;

import com.dotprint.core.attributes.Attribute;

import java.util.List;
import java.util.Objects;

/**
 * A node statement.
 *
 * @param id node identifier
 * @param attributes node attributes, printed in order
 */
public record DotNode(
    String id,
    List<Attribute<?>> attributes
) {
    /**
     * Compact constructor with validation.
     */
    public DotNode {
        Objects.requireNonNull(id, "id must not be null");
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }
}
