package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * An arrowhead: one or more modified shapes drawn from the edge end outwards.
 *
 * <p>Prints the modifier and shape of every part back to back, e.g. {@code invodot}.
 *
 * @param parts arrow parts, at least one
 * @see <a href="https://graphviz.org/docs/attr-types/arrowType/">arrowType</a>
 */
public record ArrowType(
    List<Part> parts
) implements DotValue {

    public static final ArrowType NORMAL = of(ArrowModifier.NONE, ArrowShape.NORMAL);
    public static final ArrowType INV = of(ArrowModifier.NONE, ArrowShape.INV);
    public static final ArrowType DOT = of(ArrowModifier.NONE, ArrowShape.DOT);
    public static final ArrowType INV_DOT = new ArrowType(List.of(
        new Part(ArrowModifier.NONE, ArrowShape.INV), new Part(ArrowModifier.NONE, ArrowShape.DOT)));
    public static final ArrowType O_DOT = of(ArrowModifier.OPEN, ArrowShape.DOT);
    public static final ArrowType INV_O_DOT = new ArrowType(List.of(
        new Part(ArrowModifier.NONE, ArrowShape.INV), new Part(ArrowModifier.OPEN, ArrowShape.DOT)));
    public static final ArrowType NONE = of(ArrowModifier.NONE, ArrowShape.NONE);
    public static final ArrowType TEE = of(ArrowModifier.NONE, ArrowShape.TEE);
    public static final ArrowType DIAMOND = of(ArrowModifier.NONE, ArrowShape.DIAMOND);
    public static final ArrowType O_DIAMOND = of(ArrowModifier.OPEN, ArrowShape.DIAMOND);
    public static final ArrowType CROW = of(ArrowModifier.NONE, ArrowShape.CROW);
    public static final ArrowType BOX = of(ArrowModifier.NONE, ArrowShape.BOX);
    public static final ArrowType O_BOX = of(ArrowModifier.OPEN, ArrowShape.BOX);
    public static final ArrowType VEE = of(ArrowModifier.NONE, ArrowShape.VEE);

    private static final Map<String, ArrowType> NAMED = named();

    /**
     * Compact constructor with validation.
     */
    public ArrowType {
        Objects.requireNonNull(parts, "parts must not be null");
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("parts must not be empty");
        }
        parts = List.copyOf(parts);
    }

    /**
     * A single-part arrow.
     *
     * @param modifier modifier for the shape
     * @param shape the shape
     * @return the arrow
     */
    public static ArrowType of(ArrowModifier modifier, ArrowShape shape) {
        return new ArrowType(List.of(new Part(modifier, shape)));
    }

    /**
     * Looks up one of the predefined arrows by name, e.g. {@code "odiamond"}.
     *
     * @param name arrow name
     * @return the arrow
     * @throws IllegalArgumentException if the name is not a predefined arrow
     */
    public static ArrowType fromDotName(String name) {
        ArrowType arrow = NAMED.get(name.toLowerCase(Locale.ROOT));
        if (arrow == null) {
            throw new IllegalArgumentException("Unknown arrow type: " + name);
        }
        return arrow;
    }

    @Override
    public DotCode unqtDot() {
        return DotCode.hcat(parts.stream().map(Part::unqtDot).toList());
    }

    private static Map<String, ArrowType> named() {
        Map<String, ArrowType> arrows = new LinkedHashMap<>();
        for (ArrowType arrow : List.of(NORMAL, INV, DOT, INV_DOT, O_DOT, INV_O_DOT, NONE, TEE,
                                       DIAMOND, O_DIAMOND, CROW, BOX, O_BOX, VEE)) {
            StringBuilder name = new StringBuilder();
            for (Part part : arrow.parts()) {
                name.append(part.modifier().fill() == ArrowFill.OPEN ? "o" : "").append(part.shape().dotName());
            }
            arrows.put(name.toString(), arrow);
        }
        return Map.copyOf(arrows);
    }

    /**
     * One modified shape of an arrow.
     *
     * @param modifier fill and side
     * @param shape the shape
     */
    public record Part(
        ArrowModifier modifier,
        ArrowShape shape
    ) implements DotValue {
        /**
         * Compact constructor with validation.
         */
        public Part {
            Objects.requireNonNull(modifier, "modifier must not be null");
            Objects.requireNonNull(shape, "shape must not be null");
        }

        @Override
        public DotCode unqtDot() {
            return modifier.unqtDot().append(shape.unqtDot());
        }
    }
}
