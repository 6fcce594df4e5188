package com.dotprint.core.definition;

import com.dotprint.core.attributes.Color;
import com.dotprint.core.colorscheme.BrewerScheme;
import com.dotprint.core.colorscheme.ColorScheme;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses color values as they are written in definition files.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>{@code #rrggbb} and {@code #rrggbbaa}</li>
 *   <li>{@code h,s,v} with components in {@code [0, 1]}</li>
 *   <li>{@code /x11/name}, {@code /svg/name} and {@code /blues9/3}</li>
 *   <li>a bare X11 color name</li>
 * </ul>
 * Color lists are separated by {@code :}.
 */
final class ColorParser {

    private ColorParser() {
    }

    static List<Color> parseList(String text) {
        List<Color> colors = new ArrayList<>();
        for (String part : text.split(":", -1)) {
            colors.add(parse(part));
        }
        return colors;
    }

    static Color parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("empty color");
        }
        if (trimmed.startsWith("#")) {
            return parseHex(trimmed);
        }
        if (trimmed.startsWith("/")) {
            return parseSchemeRelative(trimmed);
        }
        if (trimmed.indexOf(',') >= 0) {
            return parseHsv(trimmed);
        }
        return Color.x11(trimmed);
    }

    /**
     * Parses a scheme name as used by the {@code colorscheme} attribute.
     *
     * @param text scheme name, e.g. {@code x11}, {@code svg} or {@code blues9}
     * @return the scheme
     */
    static ColorScheme parseScheme(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        if (lower.equals("x11")) {
            return ColorScheme.x11();
        }
        if (lower.equals("svg")) {
            return ColorScheme.svg();
        }
        return BrewerScheme.parse(lower);
    }

    private static Color parseHex(String text) {
        String digits = text.substring(1);
        if (digits.length() != 6 && digits.length() != 8) {
            throw new IllegalArgumentException("expected #rrggbb or #rrggbbaa: " + text);
        }
        int[] components = new int[digits.length() / 2];
        for (int i = 0; i < components.length; i++) {
            components[i] = Integer.parseInt(digits.substring(i * 2, i * 2 + 2), 16);
        }
        if (components.length == 3) {
            return Color.rgb(components[0], components[1], components[2]);
        }
        return Color.rgba(components[0], components[1], components[2], components[3]);
    }

    private static Color parseHsv(String text) {
        String[] parts = text.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("expected h,s,v: " + text);
        }
        return Color.hsv(Double.parseDouble(parts[0].trim()),
                         Double.parseDouble(parts[1].trim()),
                         Double.parseDouble(parts[2].trim()));
    }

    private static Color parseSchemeRelative(String text) {
        int separator = text.indexOf('/', 1);
        if (separator < 0 || separator == text.length() - 1) {
            throw new IllegalArgumentException("expected /scheme/name: " + text);
        }
        ColorScheme scheme = parseScheme(text.substring(1, separator));
        String name = text.substring(separator + 1);
        if (scheme instanceof BrewerScheme brewer) {
            return Color.brewer(brewer, Integer.parseInt(name));
        }
        return scheme == ColorScheme.svg() ? Color.svg(name) : Color.x11(name);
    }
}
