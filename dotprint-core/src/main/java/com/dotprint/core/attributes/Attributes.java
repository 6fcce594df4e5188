package com.dotprint.core.attributes;

import com.dotprint.core.colorscheme.ColorScheme;
import com.dotprint.core.printing.DotNumbers;
import com.dotprint.core.printing.PrintDot;
import com.dotprint.core.printing.Printers;

import java.util.List;
import java.util.Objects;

/**
 * Friendly constructors for the most common attributes.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * List<Attribute<?>> node = List.of(
 *     Attributes.textLabel("Start"),
 *     Attributes.shape(Shape.BOX),
 *     Attributes.style(Attributes.FILLED),
 *     Attributes.fillColor(Color.x11("lightblue"))
 * );
 * }</pre>
 *
 * <p>Attributes not covered here can be written with {@link #custom(String, String)}.
 */
public final class Attributes {

    /** Also available for edges. */
    public static final StyleItem DASHED = StyleItem.of(StyleName.DASHED);

    /** Also available for edges. */
    public static final StyleItem DOTTED = StyleItem.of(StyleName.DOTTED);

    /** Also available for edges. */
    public static final StyleItem SOLID = StyleItem.of(StyleName.SOLID);

    /** Also available for edges. */
    public static final StyleItem INVIS = StyleItem.of(StyleName.INVIS);

    /** Also available for edges. */
    public static final StyleItem BOLD = StyleItem.of(StyleName.BOLD);

    /** Also available for clusters. */
    public static final StyleItem FILLED = StyleItem.of(StyleName.FILLED);

    /** Also available for clusters. */
    public static final StyleItem ROUNDED = StyleItem.of(StyleName.ROUNDED);

    /** Only available for nodes. */
    public static final StyleItem DIAGONALS = StyleItem.of(StyleName.DIAGONALS);

    /** Only available for edges. */
    public static final StyleItem TAPERED = StyleItem.of(StyleName.TAPERED);

    private static final PrintDot<List<Color>> COLOR_LIST = PrintDot.listOf(Color.PRINTER);
    private static final PrintDot<List<StyleItem>> STYLE_LIST = PrintDot.listOf(StyleItem.PRINTER);

    private Attributes() {
        // Prevent instantiation
    }

    // Labels

    public static Attribute<Label> toLabel(Label label) {
        return new Attribute<>("label", label, PrintDot.values());
    }

    public static Attribute<Label> toLabel(String text) {
        return toLabel(Label.text(text));
    }

    public static Attribute<Label> toLabel(int value) {
        return toLabel(DotNumbers.formatInt(value));
    }

    public static Attribute<Label> toLabel(double value) {
        return toLabel(DotNumbers.formatDouble(value));
    }

    public static Attribute<Label> toLabel(boolean value) {
        return toLabel(Boolean.toString(value));
    }

    /**
     * The most common label attribute: a text label.
     *
     * @param text label text
     * @return the {@code label} attribute
     */
    public static Attribute<Label> textLabel(String text) {
        return toLabel(text);
    }

    /**
     * A label placed outside of the node or edge.
     *
     * @param label the label
     * @return the {@code xlabel} attribute
     */
    public static Attribute<Label> xLabel(Label label) {
        return new Attribute<>("xlabel", label, PrintDot.values());
    }

    public static Attribute<Label> xTextLabel(String text) {
        return xLabel(Label.text(text));
    }

    /**
     * Forces placement of external labels even when they overlap.
     *
     * @return the {@code forcelabels} attribute
     */
    public static Attribute<Boolean> forceLabels() {
        return new Attribute<>("forcelabels", Boolean.TRUE, Printers.BOOLEAN);
    }

    // Colors

    /**
     * Background color of a graph or cluster; requires the {@link #FILLED} style.
     *
     * @param color the color
     * @return the {@code bgcolor} attribute
     */
    public static Attribute<Color> bgColor(Color color) {
        return new Attribute<>("bgcolor", color, Color.PRINTER);
    }

    /**
     * Fill color of a node; requires the {@link #FILLED} style.
     *
     * @param color the color
     * @return the {@code fillcolor} attribute
     */
    public static Attribute<Color> fillColor(Color color) {
        return new Attribute<>("fillcolor", color, Color.PRINTER);
    }

    public static Attribute<Color> fontColor(Color color) {
        return new Attribute<>("fontcolor", color, Color.PRINTER);
    }

    /**
     * Color of the bounding box of a cluster.
     *
     * @param color the color
     * @return the {@code pencolor} attribute
     */
    public static Attribute<Color> penColor(Color color) {
        return new Attribute<>("pencolor", color, Color.PRINTER);
    }

    /**
     * The {@code color} attribute, which serves several purposes: the color of edges,
     * the outline of nodes, the outline of clusters, and the fill of filled nodes and
     * clusters without an explicit fill color. Prefer the specific attributes where
     * they exist.
     *
     * @param color the color
     * @return the {@code color} attribute
     */
    public static Attribute<List<Color>> color(Color color) {
        return colors(List.of(color));
    }

    /**
     * A multi-color {@code color} attribute, e.g. parallel edge strokes.
     *
     * @param colors the colors in order
     * @return the {@code color} attribute
     */
    public static Attribute<List<Color>> colors(List<Color> colors) {
        return new Attribute<>("color", List.copyOf(colors), COLOR_LIST);
    }

    /**
     * Sets the scheme that later scheme-relative colors are resolved against.
     *
     * <p>Write this before the colors that rely on it; printing order decides which
     * scheme is in effect.
     *
     * @param scheme the scheme
     * @return the {@code colorscheme} attribute
     */
    public static Attribute<ColorScheme> colorScheme(ColorScheme scheme) {
        return new Attribute<>("colorscheme", scheme, Printers.COLOR_SCHEME);
    }

    // Styles

    public static Attribute<List<StyleItem>> style(StyleItem style) {
        return styles(List.of(style));
    }

    public static Attribute<List<StyleItem>> styles(List<StyleItem> styles) {
        return new Attribute<>("style", List.copyOf(styles), STYLE_LIST);
    }

    /**
     * Width of lines; valid for clusters, nodes and edges.
     *
     * @param width line width in points
     * @return the {@code penwidth} attribute
     */
    public static Attribute<Double> penWidth(double width) {
        return new Attribute<>("penwidth", width, Printers.DOUBLE);
    }

    // Shapes, arrows and layout

    public static Attribute<Shape> shape(Shape shape) {
        return new Attribute<>("shape", shape, PrintDot.values());
    }

    /**
     * How to draw the arrow at the head of an edge. Undirected graphs also need
     * {@code edgeEnds(DirType.FORWARD)} or {@code BOTH}.
     *
     * @param arrow the arrow
     * @return the {@code arrowhead} attribute
     */
    public static Attribute<ArrowType> arrowTo(ArrowType arrow) {
        return new Attribute<>("arrowhead", arrow, PrintDot.values());
    }

    /**
     * How to draw the arrow at the tail of an edge; needs {@code edgeEnds(DirType.BACK)}
     * or {@code BOTH}.
     *
     * @param arrow the arrow
     * @return the {@code arrowtail} attribute
     */
    public static Attribute<ArrowType> arrowFrom(ArrowType arrow) {
        return new Attribute<>("arrowtail", arrow, PrintDot.values());
    }

    public static Attribute<DirType> edgeEnds(DirType direction) {
        return new Attribute<>("dir", direction, PrintDot.values());
    }

    /**
     * Keeps the outgoing or incoming edges of a node in definition order. As a graph
     * attribute it takes precedence over the same attribute on individual nodes.
     *
     * @param order which edges to order
     * @return the {@code ordering} attribute
     */
    public static Attribute<Order> ordering(Order order) {
        return new Attribute<>("ordering", order, PrintDot.values());
    }

    /**
     * Any attribute, with its value written as escaped and, where needed, quoted text.
     *
     * @param name attribute name
     * @param text attribute value
     * @return the attribute
     */
    public static Attribute<String> custom(String name, String text) {
        Objects.requireNonNull(name, "name must not be null");
        return new Attribute<>(name, text, Printers.STRING);
    }
}
