package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;

/**
 * A color with transparency.
 *
 * <p>Prints as {@code #rrggbbaa}; quoted as a complete value.
 *
 * @param red red component, 0 to 255
 * @param green green component, 0 to 255
 * @param blue blue component, 0 to 255
 * @param alpha opacity, 0 (transparent) to 255 (opaque)
 */
public record RGBA(
    int red,
    int green,
    int blue,
    int alpha
) implements Color {
    /**
     * Compact constructor with validation.
     */
    public RGBA {
        ColorPrinting.checkComponent("red", red);
        ColorPrinting.checkComponent("green", green);
        ColorPrinting.checkComponent("blue", blue);
        ColorPrinting.checkComponent("alpha", alpha);
    }

    @Override
    public DotCode unqtDot() {
        return ColorPrinting.hex(red, green, blue, alpha);
    }

    @Override
    public DotCode toDot() {
        return DotCode.dquotes(unqtDot());
    }
}
