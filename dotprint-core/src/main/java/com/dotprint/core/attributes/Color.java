package com.dotprint.core.attributes;

import com.dotprint.core.colorscheme.BrewerScheme;
import com.dotprint.core.colorscheme.ColorScheme;
import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;
import com.dotprint.core.printing.PrintDot;

import java.util.List;

/**
 * A color value.
 *
 * <p>Explicit colors ({@link RGB}, {@link RGBA}, {@link HSV}) print the same wherever
 * they appear. Named colors ({@link NamedColor}, {@link BrewerColor}) are relative to a
 * {@link ColorScheme}: they print bare when their scheme is in effect at that point of
 * the render and fully qualified ({@code /blues9/3}) otherwise.
 *
 * <p>Lists of colors are joined with colons, as used for multi-colored edges; see
 * {@link #PRINTER}.
 */
public interface Color extends DotValue {

    /**
     * Printer for colors and color lists.
     */
    PrintDot<Color> PRINTER = new PrintDot<>() {
        @Override
        public DotCode unqtDot(Color value) {
            return value.unqtDot();
        }

        @Override
        public DotCode toDot(Color value) {
            return value.toDot();
        }

        @Override
        public DotCode unqtListToDot(List<Color> values) {
            return DotCode.hcat(DotCode.punctuate(DotCode.COLON, values.stream().map(Color::unqtDot).toList()));
        }

        @Override
        public DotCode listToDot(List<Color> values) {
            if (values.size() == 1) {
                return values.get(0).toDot();
            }
            return DotCode.dquotes(unqtListToDot(values));
        }
    };

    static Color rgb(int red, int green, int blue) {
        return new RGB(red, green, blue);
    }

    static Color rgba(int red, int green, int blue, int alpha) {
        return new RGBA(red, green, blue, alpha);
    }

    static Color hsv(double hue, double saturation, double value) {
        return new HSV(hue, saturation, value);
    }

    /**
     * An X11 color, e.g. {@code x11("lightblue")}.
     *
     * @param name X11 color name
     * @return the color
     */
    static Color x11(String name) {
        return new NamedColor(ColorScheme.x11(), name);
    }

    /**
     * An SVG color, e.g. {@code svg("aliceblue")}.
     *
     * @param name SVG color name
     * @return the color
     */
    static Color svg(String name) {
        return new NamedColor(ColorScheme.svg(), name);
    }

    /**
     * A color from a brewer palette.
     *
     * @param scheme the palette
     * @param index 1-based index into the palette
     * @return the color
     */
    static Color brewer(BrewerScheme scheme, int index) {
        return new BrewerColor(scheme, index);
    }
}
