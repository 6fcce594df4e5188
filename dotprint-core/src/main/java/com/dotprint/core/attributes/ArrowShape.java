package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;

import java.util.Locale;

/**
 * Arrow shape.
 *
 * <p>The primitive shapes arrowheads are built from.
 *
 * @see <a href="https://graphviz.org/docs/attr-types/arrowType/">Graphviz documentation</a>
 */
public enum ArrowShape implements DotValue {
    BOX("box"),
    CROW("crow"),
    CURVE("curve"),
    ICURVE("icurve"),
    DIAMOND("diamond"),
    DOT("dot"),
    INV("inv"),
    NONE("none"),
    NORMAL("normal"),
    TEE("tee"),
    VEE("vee");

    private final String dotName;

    ArrowShape(String dotName) {
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
    public static ArrowShape fromDotName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (ArrowShape candidate : values()) {
            if (candidate.dotName.toLowerCase(Locale.ROOT).equals(lower)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown arrow shape: " + name);
    }
}
