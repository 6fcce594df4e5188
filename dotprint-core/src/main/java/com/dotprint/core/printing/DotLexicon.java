package com.dotprint.core.printing;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Lexical predicates for the DOT language.
 *
 * <p>The DOT grammar accepts an ID in one of four forms:
 * <ul>
 *   <li>a string of letters ({@code [a-zA-Z\200-\377]}), underscores or digits, not
 *       starting with a digit;</li>
 *   <li>a numeral {@code [-]?(.[0-9]+ | [0-9]+(.[0-9]*)?)};</li>
 *   <li>a double-quoted string, possibly containing escaped quotes;</li>
 *   <li>an HTML string {@code <...>}.</li>
 * </ul>
 * The first restriction is a byte-wise comparison, which for UTF-8 text admits every
 * character with a code point of 128 or more.
 *
 * <p>All methods are pure and total.
 *
 * @see <a href="https://graphviz.org/doc/info/lang.html">The DOT Language</a>
 */
public final class DotLexicon {

    /** Words reserved by the grammar; matched case-insensitively. */
    public static final Set<String> KEYWORDS = Set.of(
        "node", "edge", "graph", "digraph", "subgraph", "strict"
    );

    private DotLexicon() {
        // Prevent instantiation
    }

    /**
     * Classifies text into exactly one {@link TokenClass}.
     *
     * @param text text to classify
     * @return the lexical category, checked in declaration order of {@link TokenClass}
     */
    public static TokenClass classify(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isEmpty()) {
            return TokenClass.EMPTY;
        }
        if (isKeyword(text)) {
            return TokenClass.KEYWORD;
        }
        if (isIdString(text)) {
            return TokenClass.IDENTIFIER;
        }
        if (isNumString(text)) {
            return TokenClass.NUMBER;
        }
        return TokenClass.OTHER;
    }

    /**
     * Checks whether the text is a reserved word, ignoring case.
     *
     * @param text text to check
     * @return true for {@code node}, {@code EDGE}, {@code Graph}, ...
     */
    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text.toLowerCase(Locale.ROOT));
    }

    /**
     * Checks whether the text can be written as a bare identifier.
     *
     * @param text text to check
     * @return true if non-empty and every character is an identifier character
     */
    public static boolean isIdString(String text) {
        if (text.isEmpty() || !isIdStart(text.charAt(0))) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            if (!isIdPart(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether the text is a DOT numeral.
     *
     * <p>Accepts an optional leading {@code -}, then digits with at most one decimal
     * point, where the digits before and after the point are not both absent.
     * Exponents are not part of the grammar.
     *
     * @param text text to check
     * @return true for {@code 42}, {@code -1.5}, {@code .5}, {@code 3.}
     */
    public static boolean isNumString(String text) {
        int i = text.startsWith("-") ? 1 : 0;
        int integerDigits = 0;
        while (i < text.length() && isDigit(text.charAt(i))) {
            integerDigits++;
            i++;
        }
        int fractionDigits = 0;
        if (i < text.length() && text.charAt(i) == '.') {
            i++;
            while (i < text.length() && isDigit(text.charAt(i))) {
                fractionDigits++;
                i++;
            }
        }
        return i == text.length() && integerDigits + fractionDigits > 0;
    }

    /**
     * Checks whether a character may start an identifier.
     *
     * @param c character to check
     * @return true for ASCII letters, {@code _} and characters from 128 up
     */
    public static boolean isIdStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_' || c >= 128;
    }

    /**
     * Checks whether a character may appear after the first one in an identifier.
     *
     * @param c character to check
     * @return true for identifier start characters and ASCII digits
     */
    public static boolean isIdPart(char c) {
        return isIdStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
