package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;

import java.util.Locale;

/**
 * Node shape.
 *
 * @see <a href="https://graphviz.org/doc/info/shapes.html">Graphviz documentation</a>
 */
public enum Shape implements DotValue {
    BOX("box"),
    POLYGON("polygon"),
    ELLIPSE("ellipse"),
    OVAL("oval"),
    CIRCLE("circle"),
    POINT("point"),
    EGG("egg"),
    TRIANGLE("triangle"),
    PLAINTEXT("plaintext"),
    PLAIN("plain"),
    DIAMOND("diamond"),
    TRAPEZIUM("trapezium"),
    PARALLELOGRAM("parallelogram"),
    HOUSE("house"),
    PENTAGON("pentagon"),
    HEXAGON("hexagon"),
    SEPTAGON("septagon"),
    OCTAGON("octagon"),
    DOUBLECIRCLE("doublecircle"),
    DOUBLEOCTAGON("doubleoctagon"),
    TRIPLEOCTAGON("tripleoctagon"),
    INVTRIANGLE("invtriangle"),
    INVTRAPEZIUM("invtrapezium"),
    INVHOUSE("invhouse"),
    M_DIAMOND("Mdiamond"),
    M_SQUARE("Msquare"),
    M_CIRCLE("Mcircle"),
    RECT("rect"),
    RECTANGLE("rectangle"),
    SQUARE("square"),
    STAR("star"),
    NONE("none"),
    UNDERLINE("underline"),
    CYLINDER("cylinder"),
    NOTE("note"),
    TAB("tab"),
    FOLDER("folder"),
    BOX_3D("box3d"),
    COMPONENT("component"),
    PROMOTER("promoter"),
    CDS("cds"),
    TERMINATOR("terminator"),
    UTR("utr"),
    PRIMERSITE("primersite"),
    RESTRICTIONSITE("restrictionsite"),
    FIVEPOVERHANG("fivepoverhang"),
    THREEPOVERHANG("threepoverhang"),
    NOVERHANG("noverhang"),
    ASSEMBLY("assembly"),
    SIGNATURE("signature"),
    INSULATOR("insulator"),
    RIBOSITE("ribosite"),
    RNASTAB("rnastab"),
    PROTEASESITE("proteasesite"),
    PROTEINSTAB("proteinstab"),
    RPROMOTER("rpromoter"),
    RARROW("rarrow"),
    LARROW("larrow"),
    LPROMOTER("lpromoter"),
    RECORD("record"),
    M_RECORD("Mrecord");

    private final String dotName;

    Shape(String dotName) {
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
    public static Shape fromDotName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Shape candidate : values()) {
            if (candidate.dotName.toLowerCase(Locale.ROOT).equals(lower)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown node shape: " + name);
    }
}
