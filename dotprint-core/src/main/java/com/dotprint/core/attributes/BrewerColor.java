package com.dotprint.core.attributes;

import com.dotprint.core.colorscheme.BrewerScheme;
import com.dotprint.core.printing.DotCode;

import java.util.Objects;

/**
 * A color picked by index from a brewer palette.
 *
 * <p>Prints as the bare index when the palette is the active color scheme, otherwise
 * as {@code /palette/index}.
 *
 * @param scheme the palette
 * @param index 1-based index into the palette
 */
public record BrewerColor(
    BrewerScheme scheme,
    int index
) implements Color {
    /**
     * Compact constructor with validation.
     */
    public BrewerColor {
        Objects.requireNonNull(scheme, "scheme must not be null");
        if (index < 1) {
            throw new IllegalArgumentException("index must be positive: " + index);
        }
    }

    @Override
    public DotCode unqtDot() {
        return ColorPrinting.relative(scheme, Integer.toString(index), false);
    }

    @Override
    public DotCode toDot() {
        return ColorPrinting.relative(scheme, Integer.toString(index), true);
    }
}
