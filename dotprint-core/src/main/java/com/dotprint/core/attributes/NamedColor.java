package com.dotprint.core.attributes;

import com.dotprint.core.colorscheme.ColorScheme;
import com.dotprint.core.printing.DotCode;

import java.util.Objects;

/**
 * A color named within a scheme, such as X11 {@code red} or SVG {@code aliceblue}.
 *
 * @param scheme scheme the name belongs to
 * @param name color name
 */
public record NamedColor(
    ColorScheme scheme,
    String name
) implements Color {
    /**
     * Compact constructor with validation.
     */
    public NamedColor {
        Objects.requireNonNull(scheme, "scheme must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public DotCode unqtDot() {
        return ColorPrinting.relative(scheme, name, false);
    }

    @Override
    public DotCode toDot() {
        return ColorPrinting.relative(scheme, name, true);
    }
}
