package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;

import java.util.Locale;

/**
 * Style name.
 *
 * <p>Not every style applies to every kind of object: {@code diagonals} is for nodes
 * only and {@code tapered} for edges only.
 *
 * @see <a href="https://graphviz.org/docs/attr-types/style/">Graphviz documentation</a>
 */
public enum StyleName implements DotValue {
    DASHED("dashed"),
    DOTTED("dotted"),
    SOLID("solid"),
    BOLD("bold"),
    INVIS("invis"),
    FILLED("filled"),
    DIAGONALS("diagonals"),
    ROUNDED("rounded"),
    TAPERED("tapered"),
    STRIPED("striped"),
    WEDGED("wedged"),
    RADIAL("radial");

    private final String dotName;

    StyleName(String dotName) {
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
    public static StyleName fromDotName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (StyleName candidate : values()) {
            if (candidate.dotName.toLowerCase(Locale.ROOT).equals(lower)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown style name: " + name);
    }
}
