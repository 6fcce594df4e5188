package com.dotprint.core.printing;

import java.util.List;
import java.util.Objects;

/**
 * How values of a type are written in the DOT language.
 *
 * <p>Only {@link #unqtDot(Object)} must be implemented. The remaining methods have
 * defaults that types override where the grammar demands:
 * <ul>
 *   <li>{@link #toDot(Object)}, the form used as a complete attribute value, defaults
 *       to the unquoted form;</li>
 *   <li>{@link #unqtListToDot(List)} defaults to {@code [a,b,c]};</li>
 *   <li>{@link #listToDot(List)} defaults to the quoted {@code unqtListToDot}, since
 *       brackets and commas are not ID characters.</li>
 * </ul>
 *
 * <p>Built-in printers for numbers, booleans, characters and strings live in
 * {@link Printers}. Value types that know how to print themselves implement
 * {@link DotValue} and are printed through {@link #values()}.
 *
 * @param <A> printed type
 */
@FunctionalInterface
public interface PrintDot<A> {

    /**
     * The unquoted representation, for composing into larger values.
     *
     * @param value value to print
     * @return code printing the value
     */
    DotCode unqtDot(A value);

    /**
     * The representation used as a complete value; quoted if it would not otherwise
     * be a single valid ID.
     *
     * @param value value to print
     * @return code printing the value
     */
    default DotCode toDot(A value) {
        return unqtDot(value);
    }

    /**
     * The unquoted representation of a list of values.
     *
     * @param values values to print
     * @return code printing the list
     */
    default DotCode unqtListToDot(List<A> values) {
        return DotCode.list(values.stream().map(this::unqtDot).toList());
    }

    /**
     * The representation of a list used as a complete value.
     *
     * @param values values to print
     * @return code printing the list
     */
    default DotCode listToDot(List<A> values) {
        return DotCode.dquotes(unqtListToDot(values));
    }

    /**
     * A printer for lists that delegates to the element printer's list forms.
     *
     * @param element printer of the elements
     * @param <A> element type
     * @return list printer
     */
    static <A> PrintDot<List<A>> listOf(PrintDot<A> element) {
        Objects.requireNonNull(element, "element must not be null");
        return new PrintDot<>() {
            @Override
            public DotCode unqtDot(List<A> values) {
                return element.unqtListToDot(values);
            }

            @Override
            public DotCode toDot(List<A> values) {
                return element.listToDot(values);
            }
        };
    }

    /**
     * The printer for types implementing {@link DotValue}.
     *
     * @param <A> printed type
     * @return printer delegating to the values themselves
     */
    @SuppressWarnings("unchecked")
    static <A extends DotValue> PrintDot<A> values() {
        return (PrintDot<A>) (PrintDot<?>) DotValuePrinter.INSTANCE;
    }

    /**
     * Prints {@code name=value} with the value in its final form.
     *
     * @param name attribute name, written as-is
     * @param value attribute value
     * @param printer printer for the value
     * @param <A> value type
     * @return field code
     */
    static <A> DotCode printField(String name, A value, PrintDot<A> printer) {
        return DotCode.text(name).append(DotCode.EQUALS).append(printer.toDot(value));
    }

    /**
     * Prints two unquoted values separated by a comma.
     *
     * @param first first value
     * @param firstPrinter printer for the first value
     * @param second second value
     * @param secondPrinter printer for the second value
     * @param <A> first value type
     * @param <B> second value type
     * @return combined code
     */
    static <A, B> DotCode commaDel(A first, PrintDot<A> firstPrinter, B second, PrintDot<B> secondPrinter) {
        return firstPrinter.unqtDot(first).append(DotCode.COMMA).append(secondPrinter.unqtDot(second));
    }
}
