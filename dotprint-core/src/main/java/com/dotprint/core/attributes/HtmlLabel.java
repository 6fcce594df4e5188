package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;

import java.util.Objects;

/**
 * An HTML-like label.
 *
 * <p>The markup is opaque here and written unchanged between angle brackets; it must
 * be well formed for Graphviz to accept it.
 *
 * @param html label markup, without the enclosing angle brackets
 */
public record HtmlLabel(
    String html
) implements Label {
    /**
     * Compact constructor with validation.
     */
    public HtmlLabel {
        Objects.requireNonNull(html, "html must not be null");
    }

    @Override
    public DotCode unqtDot() {
        return DotCode.text(html);
    }

    @Override
    public DotCode toDot() {
        return DotCode.angled(unqtDot());
    }
}
