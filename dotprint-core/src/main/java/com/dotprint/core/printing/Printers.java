package com.dotprint.core.printing;

import com.dotprint.core.colorscheme.BrewerScheme;
import com.dotprint.core.colorscheme.ColorScheme;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link PrintDot} instances for built-in types and color schemes.
 *
 * <p>Color schemes are printed here, next to the render context they update, rather
 * than alongside the attribute types.
 */
public final class Printers {

    /** Plain decimal digits. */
    public static final PrintDot<Integer> INT = value -> DotCode.text(DotNumbers.formatInt(value));

    /** Plain decimal digits. */
    public static final PrintDot<Long> LONG = value -> DotCode.text(DotNumbers.formatLong(value));

    /** {@code true} or {@code false}. */
    public static final PrintDot<Boolean> BOOLEAN = value -> DotCode.text(value ? "true" : "false");

    /**
     * Doubles: integral values without a decimal point, exponent forms quoted, lists
     * joined with colons.
     */
    public static final PrintDot<Double> DOUBLE = new PrintDot<>() {
        @Override
        public DotCode unqtDot(Double value) {
            return DotCode.text(DotNumbers.formatDouble(value));
        }

        @Override
        public DotCode toDot(Double value) {
            String formatted = DotNumbers.formatDouble(value);
            DotCode code = DotCode.text(formatted);
            return DotNumbers.hasExponent(formatted) ? DotCode.dquotes(code) : code;
        }

        @Override
        public DotCode unqtListToDot(List<Double> values) {
            return DotCode.hcat(DotCode.punctuate(DotCode.COLON, values.stream().map(this::unqtDot).toList()));
        }

        @Override
        public DotCode listToDot(List<Double> values) {
            if (values.size() == 1) {
                return toDot(values.get(0));
            }
            return DotCode.dquotes(unqtListToDot(values));
        }
    };

    /**
     * Text: escaped, and quoted in its final form when it is not a valid bare ID.
     */
    public static final PrintDot<String> STRING = new PrintDot<>() {
        @Override
        public DotCode unqtDot(String value) {
            return Quoting.unqtString(value);
        }

        @Override
        public DotCode toDot(String value) {
            return Quoting.qtString(value);
        }
    };

    /**
     * Characters print as one-character strings; lists of characters as strings.
     */
    public static final PrintDot<Character> CHAR = new PrintDot<>() {
        @Override
        public DotCode unqtDot(Character value) {
            return Quoting.unqtString(String.valueOf(value));
        }

        @Override
        public DotCode toDot(Character value) {
            return Quoting.qtString(String.valueOf(value));
        }

        @Override
        public DotCode unqtListToDot(List<Character> values) {
            return Quoting.unqtString(join(values));
        }

        @Override
        public DotCode listToDot(List<Character> values) {
            return Quoting.qtString(join(values));
        }

        private String join(List<Character> values) {
            return values.stream().map(String::valueOf).collect(Collectors.joining());
        }
    };

    /**
     * Color schemes: printing one makes it the active scheme of the render.
     */
    public static final PrintDot<ColorScheme> COLOR_SCHEME = scheme -> context -> {
        context.setColorScheme(scheme);
        return schemeName(scheme).run(context);
    };

    private Printers() {
        // Prevent instantiation
    }

    /**
     * Prints a scheme's name without making it active.
     *
     * <p>Used when a color is qualified by a scheme other than the active one.
     *
     * @param scheme the scheme
     * @return code printing the name
     */
    public static DotCode schemeName(ColorScheme scheme) {
        if (scheme instanceof BrewerScheme brewer) {
            return STRING.unqtDot(brewer.name().dotName()).append(INT.unqtDot(brewer.level()));
        }
        return STRING.unqtDot(scheme.schemeName());
    }
}
