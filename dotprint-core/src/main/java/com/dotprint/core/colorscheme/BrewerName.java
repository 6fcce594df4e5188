package com.dotprint.core.colorscheme;

import java.util.Locale;

/**
 * ColorBrewer palette families known to Graphviz.
 *
 * @see <a href="https://graphviz.org/doc/info/colors.html#brewer">Brewer color schemes</a>
 */
public enum BrewerName {
    ACCENT("accent"),
    BLUES("blues"),
    BRBG("brbg"),
    BUGN("bugn"),
    BUPU("bupu"),
    DARK2("dark2"),
    GNBU("gnbu"),
    GREENS("greens"),
    GREYS("greys"),
    ORANGES("oranges"),
    ORRD("orrd"),
    PAIRED("paired"),
    PASTEL1("pastel1"),
    PASTEL2("pastel2"),
    PIYG("piyg"),
    PRGN("prgn"),
    PUBU("pubu"),
    PUBUGN("pubugn"),
    PUOR("puor"),
    PURD("purd"),
    PURPLES("purples"),
    RDBU("rdbu"),
    RDGY("rdgy"),
    RDPU("rdpu"),
    RDYLBU("rdylbu"),
    RDYLGN("rdylgn"),
    REDS("reds"),
    SET1("set1"),
    SET2("set2"),
    SET3("set3"),
    SPECTRAL("spectral"),
    YLGN("ylgn"),
    YLGNBU("ylgnbu"),
    YLORBR("ylorbr"),
    YLORRD("ylorrd");

    private final String dotName;

    BrewerName(String dotName) {
        this.dotName = dotName;
    }

    /**
     * Returns the palette name as written in DOT output.
     *
     * @return lower-case palette name
     */
    public String dotName() {
        return dotName;
    }

    /**
     * Looks up a palette by its DOT name, ignoring case.
     *
     * @param name palette name
     * @return the palette
     * @throws IllegalArgumentException if no palette has that name
     */
    public static BrewerName fromDotName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (BrewerName candidate : values()) {
            if (candidate.dotName.equals(lower)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown brewer palette: " + name);
    }
}
