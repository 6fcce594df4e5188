package com.dotprint.core.printing;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DotCode} combinators and {@link PrintDot} defaults.
 */
class DotCodeTest {

    private static String render(DotCode code) {
        return DotRenderer.renderDot(code);
    }

    @Test
    void append_runsLeftBeforeRight() {
        List<String> order = new ArrayList<>();
        DotCode left = context -> {
            order.add("left");
            return Doc.text("L");
        };
        DotCode right = context -> {
            order.add("right");
            return Doc.text("R");
        };

        assertThat(render(left.append(right))).isEqualTo("LR");
        assertThat(order).containsExactly("left", "right");
    }

    @Test
    void code_isNotRunUntilRendered() {
        List<String> runs = new ArrayList<>();
        DotCode code = context -> {
            runs.add("run");
            return Doc.empty();
        };

        DotCode composed = code.append(DotCode.COMMA);

        assertThat(runs).isEmpty();
        render(composed);
        assertThat(runs).hasSize(1);
    }

    @Test
    void separators_joinAsDocumented() {
        List<DotCode> codes = List.of(DotCode.text("a"), DotCode.text("b"));

        assertThat(render(DotCode.hcat(codes))).isEqualTo("ab");
        assertThat(render(DotCode.hsep(codes))).isEqualTo("a b");
        assertThat(render(DotCode.hcat(DotCode.punctuate(DotCode.SEMI, codes)))).isEqualTo("a;b");
        assertThat(render(DotCode.hsep(List.of()))).isEmpty();
    }

    @Test
    void wrappers_encloseCode() {
        DotCode x = DotCode.text("x");

        assertThat(render(DotCode.dquotes(x))).isEqualTo("\"x\"");
        assertThat(render(DotCode.brackets(x))).isEqualTo("[x]");
        assertThat(render(DotCode.braces(x))).isEqualTo("{x}");
        assertThat(render(DotCode.parens(x))).isEqualTo("(x)");
        assertThat(render(DotCode.angled(x))).isEqualTo("<x>");
        assertThat(render(DotCode.character('q'))).isEqualTo("q");
    }

    @Test
    void list_emptyAndSingleton() {
        assertThat(render(DotCode.list(List.of()))).isEqualTo("[]");
        assertThat(render(DotCode.list(List.of(DotCode.text("a"))))).isEqualTo("[a]");
    }

    @Test
    void printDot_defaults_quoteListForm() {
        PrintDot<String> upper = value -> DotCode.text(value.toUpperCase());

        assertThat(render(upper.toDot("a"))).isEqualTo("A");
        assertThat(render(upper.unqtListToDot(List.of("a", "b")))).isEqualTo("[A,B]");
        assertThat(render(upper.listToDot(List.of("a", "b")))).isEqualTo("\"[A,B]\"");
    }

    @Test
    void values_delegatesToDotValue() {
        DotValue value = () -> DotCode.text("v");
        PrintDot<DotValue> printer = PrintDot.values();

        assertThat(render(printer.unqtDot(value))).isEqualTo("v");
        assertThat(render(printer.toDot(value))).isEqualTo("v");
    }

    @Test
    void hsep_hundredThousandCodes_runsWithoutDeepRecursion() {
        List<DotCode> codes = IntStream.range(0, 100_000)
            .mapToObj(i -> Printers.STRING.toDot("n" + i))
            .toList();

        String dot = render(DotCode.hsep(codes));

        assertThat(dot).startsWith("n0 n1 n2 ").endsWith(" n99998 n99999");
    }

    @Test
    void hcat_runsCodesInOrderSharingTheContext() {
        List<String> order = new ArrayList<>();
        List<DotCode> codes = IntStream.range(0, 3)
            .mapToObj(i -> (DotCode) context -> {
                order.add("c" + i);
                return Doc.text(String.valueOf(i));
            })
            .toList();

        assertThat(render(DotCode.hcat(codes))).isEqualTo("012");
        assertThat(order).containsExactly("c0", "c1", "c2");
    }

    @Test
    void listOf_wideList_staysOnOneLineInsideQuotes() {
        List<Integer> values = IntStream.rangeClosed(100, 130).boxed().toList();
        String expected = values.stream().map(String::valueOf).collect(Collectors.joining(",", "\"[", "]\""));

        String dot = DotRenderer.printIt(values, PrintDot.listOf(Printers.INT));

        assertThat(dot).doesNotContain("\n").isEqualTo(expected);
    }

    @Test
    void unqtListToDot_wideList_stillWrapsOutsideQuotes() {
        List<Integer> values = IntStream.rangeClosed(100, 130).boxed().toList();

        String dot = render(Printers.INT.unqtListToDot(values));

        assertThat(dot).startsWith("[100\n,101\n,102").endsWith(",130]");
    }

    @Test
    void dquotes_groupedContent_isNeverBroken() {
        DotCode longGroup = DotCode.sep(List.of(DotCode.text("a".repeat(50)), DotCode.text("b".repeat(50))));

        assertThat(render(DotCode.dquotes(longGroup)))
            .isEqualTo("\"" + "a".repeat(50) + " " + "b".repeat(50) + "\"");
    }
}
