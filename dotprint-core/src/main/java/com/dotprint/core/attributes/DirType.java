package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;

import java.util.Locale;

/**
 * Edge direction.
 *
 * <p>Controls at which ends of an edge arrowheads are drawn.
 */
public enum DirType implements DotValue {
    FORWARD("forward"),
    BACK("back"),
    BOTH("both"),
    NONE("none");

    private final String dotName;

    DirType(String dotName) {
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
    public static DirType fromDotName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (DirType candidate : values()) {
            if (candidate.dotName.toLowerCase(Locale.ROOT).equals(lower)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown edge direction: " + name);
    }
}
