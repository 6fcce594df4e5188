package com.dotprint.core.printing;

import java.util.Collection;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Backslash-escapes text for use inside a DOT string.
 *
 * <p>Double quotes and backslashes are always escaped, literal newlines become
 * {@code \n}, and callers may name further characters to escape (record labels need
 * {@code {}|<>} escaped, for example).
 *
 * <p>A backslash directly followed by one of {@link #ESCAPE_LETTERS} is left alone:
 * {@code \N}, {@code \G}, {@code \E}, {@code \T}, {@code \H} are name placeholders and
 * {@code \n}, {@code \l}, {@code \r} are justified line breaks, all interpreted by
 * Graphviz itself.
 *
 * <p>Escaping is not idempotent: escaping already-escaped text escapes its backslashes
 * again.
 */
public final class Escaper {

    /** Letters that form a meaningful escape sequence after a backslash. */
    public static final Set<Character> ESCAPE_LETTERS = Set.of(
        'N', 'G', 'E', 'T', 'H', 'L', 'n', 'l', 'r'
    );

    private static final char QUOTE = '"';
    private static final char SLASH = '\\';

    // Successor of the final character, so it is still examined on its own.
    private static final char END_SENTINEL = ' ';

    private Escaper() {
        // Prevent instantiation
    }

    /**
     * Escapes quotes, backslashes and newlines.
     *
     * @param text raw text
     * @return escaped text
     */
    public static String escape(String text) {
        return escape(text, Set.of());
    }

    /**
     * Escapes quotes, backslashes, newlines and the given extra characters.
     *
     * @param text raw text
     * @param extraChars additional characters to prefix with a backslash
     * @return escaped text
     */
    public static String escape(String text, Collection<Character> extraChars) {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(extraChars, "extraChars must not be null");

        Set<Character> escaped = new HashSet<>(extraChars);
        escaped.add(QUOTE);
        escaped.add(SLASH);

        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : END_SENTINEL;

            if (c == SLASH && ESCAPE_LETTERS.contains(next)) {
                sb.append(c);
            } else if (escaped.contains(c)) {
                sb.append(SLASH).append(c);
            } else if (c == '\n') {
                sb.append(SLASH).append('n');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
