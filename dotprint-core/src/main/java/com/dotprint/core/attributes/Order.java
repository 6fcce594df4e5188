package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;

import java.util.Locale;

/**
 * Edge ordering.
 *
 * <p>Constrains either the outgoing or the incoming edges of a node to appear left to
 * right in the order they are defined.
 */
public enum Order implements DotValue {
    OUT_EDGES("out"),
    IN_EDGES("in");

    private final String dotName;

    Order(String dotName) {
        this.dotName = dotName;
    }

    /**
     * Returns the keyword Graphviz uses for this value.
     *
     * @return DOT keyword
     */
    public String dotName() {
        return dotName;
    }

    @Override
    public DotCode unqtDot() {
        return DotCode.text(dotName);
    }

    /**
     * Looks up a value by its DOT keyword, ignoring case.
     *
     * @param name DOT keyword
     * @return the matching value
     * @throws IllegalArgumentException if nothing matches
     */
    public static Order fromDotName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Order candidate : values()) {
            if (candidate.dotName.toLowerCase(Locale.ROOT).equals(lower)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown edge ordering: " + name);
    }
}
