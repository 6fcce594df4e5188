package com.dotprint.core.attributes;

import com.dotprint.core.printing.DotCode;
import com.dotprint.core.printing.DotValue;
import com.dotprint.core.printing.PrintDot;
import com.dotprint.core.printing.Printers;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a {@code style} attribute: a style name with optional arguments, as in
 * {@code setlinewidth(2)}.
 *
 * <p>Style lists are comma-separated and quoted as a whole, except that a single
 * argument-less style prints as its bare name.
 *
 * @param name style name
 * @param arguments style arguments, usually empty
 */
public record StyleItem(
    StyleName name,
    List<String> arguments
) implements DotValue {

    /**
     * Printer for styles and style lists.
     */
    public static final PrintDot<StyleItem> PRINTER = new PrintDot<>() {
        @Override
        public DotCode unqtDot(StyleItem value) {
            return value.unqtDot();
        }

        @Override
        public DotCode unqtListToDot(List<StyleItem> values) {
            return DotCode.hcat(DotCode.punctuate(DotCode.COMMA, values.stream().map(StyleItem::unqtDot).toList()));
        }

        @Override
        public DotCode listToDot(List<StyleItem> values) {
            if (values.size() == 1 && values.get(0).arguments().isEmpty()) {
                return values.get(0).toDot();
            }
            return DotCode.dquotes(unqtListToDot(values));
        }
    };

    /**
     * Compact constructor with validation.
     */
    public StyleItem {
        Objects.requireNonNull(name, "name must not be null");
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * A style without arguments.
     *
     * @param name style name
     * @return the style item
     */
    public static StyleItem of(StyleName name) {
        return new StyleItem(name, List.of());
    }

    @Override
    public DotCode unqtDot() {
        if (arguments.isEmpty()) {
            return name.unqtDot();
        }
        List<DotCode> args = arguments.stream().map(Printers.STRING::unqtDot).toList();
        return name.unqtDot().append(DotCode.parens(DotCode.hcat(DotCode.punctuate(DotCode.COMMA, args))));
    }

    @Override
    public DotCode toDot() {
        return arguments.isEmpty() ? unqtDot() : DotCode.dquotes(unqtDot());
    }
}
