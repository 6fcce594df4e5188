package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotRenderer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Attributes} factories and label printing.
 */
class AttributesTest {

    private static String render(Attribute<?> attribute) {
        return DotRenderer.renderDot(attribute.unqtDot());
    }

    @Test
    void textLabel_plainWord_isBare() {
        assertThat(render(Attributes.textLabel("Start"))).isEqualTo("label=Start");
    }

    @Test
    void textLabel_withQuotesAndNewline_isEscaped() {
        assertThat(render(Attributes.textLabel("say \"hi\"\nnow"))).isEqualTo("label=\"say \\\"hi\\\"\\nnow\"");
    }

    @Test
    void textLabel_placeholder_isNotEscaped() {
        assertThat(render(Attributes.textLabel("\\N"))).isEqualTo("label=\"\\N\"");
    }

    @Test
    void textLabel_keyword_isQuoted() {
        assertThat(render(Attributes.textLabel("node"))).isEqualTo("label=\"node\"");
    }

    @Test
    void htmlLabel_isWrappedInAngleBrackets() {
        assertThat(render(Attributes.toLabel(Label.html("<b>bold</b>")))).isEqualTo("label=<<b>bold</b>>");
    }

    @Test
    void numericLabels_printAsNumbers() {
        assertThat(render(Attributes.toLabel(4.0))).isEqualTo("label=4");
        assertThat(render(Attributes.toLabel(-2))).isEqualTo("label=-2");
        assertThat(render(Attributes.toLabel(true))).isEqualTo("label=true");
    }

    @Test
    void xLabelAndForceLabels_useGraphvizNames() {
        assertThat(render(Attributes.xTextLabel("side note"))).isEqualTo("xlabel=\"side note\"");
        assertThat(render(Attributes.forceLabels())).isEqualTo("forcelabels=true");
    }

    @Test
    void penWidth_integral_dropsDecimalPoint() {
        assertThat(render(Attributes.penWidth(2.0))).isEqualTo("penwidth=2");
        assertThat(render(Attributes.penWidth(0.5))).isEqualTo("penwidth=0.5");
    }

    @Test
    void shape_printsGraphvizName() {
        assertThat(render(Attributes.shape(Shape.M_RECORD))).isEqualTo("shape=Mrecord");
        assertThat(Shape.fromDotName("mrecord")).isEqualTo(Shape.M_RECORD);
    }

    @Test
    void ordering_printsShortName() {
        assertThat(render(Attributes.ordering(Order.OUT_EDGES))).isEqualTo("ordering=out");
        assertThat(Order.fromDotName("in")).isEqualTo(Order.IN_EDGES);
    }

    @Test
    void custom_printsAsDotString() {
        assertThat(render(Attributes.custom("tooltip", "a tip"))).isEqualTo("tooltip=\"a tip\"");
        assertThat(render(Attributes.custom("rankdir", "LR"))).isEqualTo("rankdir=LR");
    }

    @Test
    void attribute_nullValue_throws() {
        assertThatThrownBy(() -> Attributes.custom("tooltip", null)).isInstanceOf(NullPointerException.class);
    }
}
