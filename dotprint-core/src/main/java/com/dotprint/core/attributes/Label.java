package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotValue;

/**
 * The value of a {@code label} or {@code xlabel} attribute.
 *
 * <p>Text labels may use the Graphviz escape sequences, which are written through
 * unchanged:
 * <ul>
 *   <li>{@code \N}, {@code \G}, {@code \E}: name of the node, graph or edge;</li>
 *   <li>{@code \T}, {@code \H}: name of the tail or head node of an edge;</li>
 *   <li>{@code \n}, {@code \l}, {@code \r}: centered, left- or right-justified line
 *       break.</li>
 * </ul>
 *
 * @see StrLabel
 * @see HtmlLabel
 */
public interface Label extends DotValue {

    static Label text(String text) {
        return new StrLabel(text);
    }

    static Label html(String html) {
        return new HtmlLabel(html);
    }
}
