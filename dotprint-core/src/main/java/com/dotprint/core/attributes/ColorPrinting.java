package com.dotprint.core.attributes;

import com.dotprint.core.colorscheme.ColorScheme;
import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.Printers;

/**
 * Shared printing of hex and scheme-relative colors.
 */
final class ColorPrinting {

    private ColorPrinting() {
        // Prevent instantiation
    }

    /**
     * Prints a color name relative to its scheme.
     *
     * <p>The active scheme is read when the code runs, so the result depends on the
     * color schemes rendered before it.
     *
     * @param scheme scheme the name belongs to
     * @param name color name or palette index
     * @param quoted whether to produce the final (quoted where needed) form
     * @return code printing the color
     */
    static DotCode relative(ColorScheme scheme, String name, boolean quoted) {
        return context -> {
            DotCode code;
            if (context.isInEffect(scheme)) {
                code = quoted ? Printers.STRING.toDot(name) : Printers.STRING.unqtDot(name);
            } else {
                DotCode qualified = DotCode.FSLASH
                    .append(Printers.schemeName(scheme))
                    .append(DotCode.FSLASH)
                    .append(Printers.STRING.unqtDot(name));
                code = quoted ? DotCode.dquotes(qualified) : qualified;
            }
            return code.run(context);
        };
    }

    static DotCode hex(int... components) {
        StringBuilder sb = new StringBuilder("#");
        for (int component : components) {
            sb.append(String.format("%02x", component));
        }
        return DotCode.text(sb.toString());
    }

    static int checkComponent(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be in 0..255: " + value);
        }
        return value;
    }
}
