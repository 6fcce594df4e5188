package com.dotprint.core.colorscheme;

/**
 * A named color palette that color values may be expressed relative to.
 *
 * <p>Graphviz resolves a bare color name or index against the palette set by the
 * {@code colorscheme} attribute. Rendering a {@code ColorScheme} therefore also makes
 * it the active scheme for every color printed after it in the same render.
 *
 * <p>Implementations must have value semantics: two schemes denoting the same palette
 * are {@link Object#equals(Object) equal}.
 *
 * @see StandardScheme
 * @see BrewerScheme
 */
public interface ColorScheme {

    /**
     * Returns the name Graphviz uses for this palette.
     *
     * <p>Examples: {@code "X11"}, {@code "svg"}, {@code "blues9"}.
     *
     * @return scheme name as written in DOT output
     */
    String schemeName();

    /**
     * The X11 palette, Graphviz's default.
     *
     * @return the X11 scheme
     */
    static ColorScheme x11() {
        return StandardScheme.X11;
    }

    /**
     * The SVG palette.
     *
     * @return the SVG scheme
     */
    static ColorScheme svg() {
        return StandardScheme.SVG;
    }
}
