package com.dotprint.core.colorscheme;

import java.util.Locale;
import java.util.Objects;

/**
 * A ColorBrewer palette: a palette family together with the number of colors it
 * holds.
 *
 * <p>Colors of a brewer scheme are addressed by 1-based index, e.g. color {@code 3}
 * of {@code blues9}.
 *
 * @param name palette family
 * @param level number of colors in the palette
 */
public record BrewerScheme(
    BrewerName name,
    int level
) implements ColorScheme {
    /**
     * Compact constructor with validation.
     */
    public BrewerScheme {
        Objects.requireNonNull(name, "name must not be null");
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative: " + level);
        }
    }

    @Override
    public String schemeName() {
        return name.dotName() + level;
    }

    /**
     * Parses a scheme name such as {@code "blues9"} or {@code "set13"}.
     *
     * <p>Palette names may themselves end in a digit ({@code set1}, {@code dark2}), so
     * the longest palette name that prefixes the text wins and the remainder is the
     * level.
     *
     * @param text scheme name
     * @return the brewer scheme
     * @throws IllegalArgumentException if the text is not a known brewer palette
     */
    public static BrewerScheme parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String lower = text.toLowerCase(Locale.ROOT);
        BrewerName best = null;
        for (BrewerName candidate : BrewerName.values()) {
            String prefix = candidate.dotName();
            if (lower.startsWith(prefix) && isDigits(lower.substring(prefix.length()))
                && (best == null || prefix.length() > best.dotName().length())) {
                best = candidate;
            }
        }
        if (best == null) {
            throw new IllegalArgumentException("Not a brewer color scheme: " + text);
        }
        return new BrewerScheme(best, Integer.parseInt(lower.substring(best.dotName().length())));
    }

    private static boolean isDigits(String text) {
        if (text.isEmpty() || text.length() > 3) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) < '0' || text.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }
}
