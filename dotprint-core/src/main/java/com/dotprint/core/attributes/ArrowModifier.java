package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;

import java.util.Objects;

/**
 * Modifiers prefixed to an arrow shape, e.g. {@code ol} in {@code olbox}.
 *
 * @param fill filled or open
 * @param side which half to draw
 */
public record ArrowModifier(
    ArrowFill fill,
    ArrowSide side
) implements DotValue {

    /** Filled, both sides: prints as nothing. */
    public static final ArrowModifier NONE = new ArrowModifier(ArrowFill.FILLED, ArrowSide.BOTH);

    /** Open, both sides. */
    public static final ArrowModifier OPEN = new ArrowModifier(ArrowFill.OPEN, ArrowSide.BOTH);

    /**
     * Compact constructor with validation.
     */
    public ArrowModifier {
        Objects.requireNonNull(fill, "fill must not be null");
        Objects.requireNonNull(side, "side must not be null");
    }

    @Override
    public DotCode unqtDot() {
        String prefix = (fill == ArrowFill.OPEN ? "o" : "") + switch (side) {
            case LEFT -> "l";
            case RIGHT -> "r";
            case BOTH -> "";
        };
        return DotCode.text(prefix);
    }
}
