package com.dotprint.core.printing;

/**
 * Number formatting for DOT output.
 *
 * <p>Integers print as plain digits. A double whose value is integral prints as an
 * integer ({@code 4.0} becomes {@code 4}), which Graphviz treats identically and which
 * is shorter. Other doubles use Java's decimal form; when that form needs an exponent
 * ({@code 1.0e-10}) it is not a legal bare DOT numeral and must be quoted as a whole.
 */
public final class DotNumbers {

    // Doubles below this magnitude convert to long exactly.
    private static final double LONG_RANGE = 0x1p63;

    private DotNumbers() {
        // Prevent instantiation
    }

    public static String formatInt(int value) {
        return Integer.toString(value);
    }

    public static String formatLong(long value) {
        return Long.toString(value);
    }

    /**
     * Formats a double without quoting.
     *
     * @param value the number
     * @return integral digits for integral values, otherwise the decimal form with a
     *         lower-case exponent marker if one is needed
     */
    public static String formatDouble(double value) {
        if (Math.rint(value) == value && Math.abs(value) < LONG_RANGE) {
            return Long.toString((long) value);
        }
        return Double.toString(value).replace('E', 'e');
    }

    /**
     * Checks whether formatted number text uses exponent notation.
     *
     * @param formatted output of {@link #formatDouble(double)}
     * @return true if the text must be quoted to be a valid DOT ID
     */
    public static boolean hasExponent(String formatted) {
        return formatted.indexOf('e') >= 0 || formatted.indexOf('E') >= 0;
    }
}
