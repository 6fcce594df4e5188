package com.dotprint.core.colorscheme;

/**
 * Color schemes built into Graphviz that are identified by name only.
 */
public enum StandardScheme implements ColorScheme {
    /** X11 color names; the scheme Graphviz assumes when none is set */
    X11("X11"),

    /** SVG color names */
    SVG("svg");

    private final String schemeName;

    StandardScheme(String schemeName) {
        this.schemeName = schemeName;
    }

    @Override
    public String schemeName() {
        return schemeName;
    }
}
