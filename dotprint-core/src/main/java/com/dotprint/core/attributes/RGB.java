package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;

/**
 * An opaque color given by its red, green and blue components.
 *
 * <p>Prints as {@code #rrggbb}; quoted as a complete value.
 *
 * @param red red component, 0 to 255
 * @param green green component, 0 to 255
 * @param blue blue component, 0 to 255
 */
public record RGB(
    int red,
    int green,
    int blue
) implements Color {
    /**
     * Compact constructor with validation.
     */
    public RGB {
        ColorPrinting.checkComponent("red", red);
        ColorPrinting.checkComponent("green", green);
        ColorPrinting.checkComponent("blue", blue);
    }

    @Override
    public DotCode unqtDot() {
        return ColorPrinting.hex(red, green, blue);
    }

    @Override
    public DotCode toDot() {
        return DotCode.dquotes(unqtDot());
    }
}
