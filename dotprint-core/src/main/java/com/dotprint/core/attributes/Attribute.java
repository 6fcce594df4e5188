package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;
import com.dotprint.core.printing.PrintDot;

import java.util.Objects;

/**
 * A named attribute value of a graph, node or edge.
 *
 * <p>Prints as {@code name=value} with the value in its final form. Use the factories
 * in {@link Attributes} rather than constructing attributes directly.
 *
 * @param name attribute name as written in DOT, e.g. {@code fillcolor}
 * @param value attribute value
 * @param printer printer for the value
 * @param <T> value type
 */
public record Attribute<T>(
    String name,
    T value,
    PrintDot<T> printer
) implements DotValue {
    /**
     * Compact constructor with validation.
     */
    public Attribute {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(printer, "printer must not be null");
    }

    @Override
    public DotCode unqtDot() {
        return PrintDot.printField(name, value, printer);
    }
}
