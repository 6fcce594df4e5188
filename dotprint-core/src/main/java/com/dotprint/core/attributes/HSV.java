package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.Printers;

import java.util.List;

/**
 * A color given by hue, saturation and value, each between 0 and 1.
 *
 * <p>Prints as {@code h,s,v}; quoted as a complete value.
 *
 * @param hue hue
 * @param saturation saturation
 * @param value brightness
 */
public record HSV(
    double hue,
    double saturation,
    double value
) implements Color {
    /**
     * Compact constructor with validation.
     */
    public HSV {
        checkUnit("hue", hue);
        checkUnit("saturation", saturation);
        checkUnit("value", value);
    }

    @Override
    public DotCode unqtDot() {
        return DotCode.hcat(DotCode.punctuate(DotCode.COMMA, List.of(
            Printers.DOUBLE.unqtDot(hue),
            Printers.DOUBLE.unqtDot(saturation),
            Printers.DOUBLE.unqtDot(value)
        )));
    }

    @Override
    public DotCode toDot() {
        return DotCode.dquotes(unqtDot());
    }

    private static void checkUnit(String name, double component) {
        if (!(component >= 0.0 && component <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in 0..1: " + component);
        }
    }
}
