package com.dotprint.core.printing;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Decides when text must be written as a quoted DOT string, and writes it.
 *
 * <p>Quoting decisions are always made on the original text, while the emitted content
 * is the escaped text. Text that is empty, a keyword, or neither an identifier nor a
 * numeral is quoted; everything else is written bare.
 */
public final class Quoting {

    private Quoting() {
        // Prevent instantiation
    }

    /**
     * Checks whether text must be quoted to be read back as a single DOT ID.
     *
     * @param text original, unescaped text
     * @return true if quotes are required
     */
    public static boolean needsQuotes(String text) {
        return switch (DotLexicon.classify(text)) {
            case EMPTY, KEYWORD, OTHER -> true;
            case IDENTIFIER, NUMBER -> false;
        };
    }

    /**
     * Wraps a fragment in double quotes if the original text requires it.
     *
     * @param original original, unescaped text the fragment was produced from
     * @param fragment code printing the escaped text
     * @return the fragment, quoted when needed
     */
    public static DotCode addQuotes(String original, DotCode fragment) {
        return needsQuotes(original) ? DotCode.dquotes(fragment) : fragment;
    }

    /**
     * Escapes text for composition into a larger value; never quotes it.
     *
     * @param text raw text
     * @return escaped code, empty for empty text
     */
    public static DotCode unqtString(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isEmpty()) {
            return DotCode.empty();
        }
        return unqtEscaped(List.of(), text);
    }

    /**
     * Escapes text and quotes it when required, keywords included.
     *
     * @param text raw text
     * @return final code for the text
     */
    public static DotCode qtString(String text) {
        return printEscaped(List.of(), text);
    }

    /**
     * Escapes quotes, backslashes, newlines and the given characters, without quoting.
     *
     * @param extraChars additional characters to escape
     * @param text raw text
     * @return escaped code
     */
    public static DotCode unqtEscaped(Collection<Character> extraChars, String text) {
        return DotCode.text(Escaper.escape(text, extraChars));
    }

    /**
     * Escapes quotes, backslashes, newlines and the given characters, then quotes the
     * result if the original text requires it.
     *
     * @param extraChars additional characters to escape
     * @param text raw text
     * @return final code for the text
     */
    public static DotCode printEscaped(Collection<Character> extraChars, String text) {
        return addQuotes(text, unqtEscaped(extraChars, text));
    }
}
