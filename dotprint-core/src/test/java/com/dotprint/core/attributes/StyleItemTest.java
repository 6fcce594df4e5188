package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link StyleItem} and style attributes.
 */
class StyleItemTest {

    private static String render(Attribute<?> attribute) {
        return DotRenderer.renderDot(attribute.unqtDot());
    }

    @Test
    void singleStyle_printsBare() {
        assertThat(render(Attributes.style(Attributes.FILLED))).isEqualTo("style=filled");
    }

    @Test
    void styleList_isCommaJoinedAndQuoted() {
        assertThat(render(Attributes.styles(List.of(Attributes.FILLED, Attributes.ROUNDED))))
            .isEqualTo("style=\"filled,rounded\"");
    }

    @Test
    void styleWithArguments_isQuoted() {
        StyleItem item = new StyleItem(StyleName.DASHED, List.of("2", "4"));

        assertThat(render(Attributes.style(item))).isEqualTo("style=\"dashed(2,4)\"");
    }

    @Test
    void fromDotName_ignoresCase() {
        assertThat(StyleName.fromDotName("Bold")).isEqualTo(StyleName.BOLD);
        assertThatThrownBy(() -> StyleName.fromDotName("sparkly")).isInstanceOf(IllegalArgumentException.class);
    }
}
