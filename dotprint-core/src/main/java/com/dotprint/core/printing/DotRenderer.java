package com.dotprint.core.printing;

import java.util.Objects;

/**
 * Turns {@link DotCode} into DOT text.
 *
 * <p>Each call runs the code against a fresh {@link RenderContext}, so renders never
 * see each other's color schemes and may run concurrently on separate threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DotCode field = PrintDot.printField("label", "he said \"hi\"", Printers.STRING);
 * String dot = DotRenderer.renderDot(field);
 * // label="he said \"hi\""
 * }</pre>
 */
public final class DotRenderer {

    /** Default preferred line width. */
    public static final int DEFAULT_WIDTH = 80;

    /** Default fraction of the line width available to non-indentation text. */
    public static final double DEFAULT_RIBBON_FRACTION = 0.4;

    private DotRenderer() {
        // Prevent instantiation
    }

    /**
     * Renders code with the default layout.
     *
     * @param code code to render
     * @return DOT text
     */
    public static String renderDot(DotCode code) {
        return renderDot(code, DEFAULT_WIDTH, DEFAULT_RIBBON_FRACTION);
    }

    /**
     * Renders code with the given layout.
     *
     * @param code code to render
     * @param width preferred line width
     * @param ribbonFraction fraction of the width available to non-indentation text
     * @return DOT text
     */
    public static String renderDot(DotCode code, int width, double ribbonFraction) {
        Objects.requireNonNull(code, "code must not be null");
        RenderContext context = new RenderContext();
        Doc doc = code.run(context);
        return DocLayout.layout(doc, width, ribbonFraction);
    }

    /**
     * Renders a single value in its final form.
     *
     * @param value value to print
     * @param printer printer for the value
     * @param <A> value type
     * @return DOT text
     */
    public static <A> String printIt(A value, PrintDot<A> printer) {
        return renderDot(printer.toDot(value));
    }
}
