package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.Quoting;

import java.util.Objects;

/**
 * A plain text label.
 *
 * @param text label text, may contain Graphviz escape sequences
 */
public record StrLabel(
    String text
) implements Label {
    /**
     * Compact constructor with validation.
     */
    public StrLabel {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public DotCode unqtDot() {
        return Quoting.unqtString(text);
    }

    @Override
    public DotCode toDot() {
        return Quoting.qtString(text);
    }
}
