package com.dotprint.core.printing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A deferred piece of DOT output.
 *
 * <p>Running a {@code DotCode} against a {@link RenderContext} produces a {@link Doc}.
 * Composition is sequential: in {@code a.append(b)}, {@code a} runs before {@code b},
 * so context updates made by {@code a} (an active color scheme) are visible to
 * {@code b}. Nothing runs until {@link DotRenderer#renderDot(DotCode)} is called.
 *
 * <p>The static factories mirror the usual pretty-printing combinators; only
 * {@link PrintDot} implementations should need {@link #text(String)} directly, and then
 * only for text known to need no quoting.
 */
@FunctionalInterface
public interface DotCode {

    /** {@code ,} */
    DotCode COMMA = text(",");

    /** {@code :} */
    DotCode COLON = text(":");

    /** {@code ;} */
    DotCode SEMI = text(";");

    /** {@code =} */
    DotCode EQUALS = text("=");

    /** A single space. */
    DotCode SPACE = text(" ");

    /** {@code /} */
    DotCode FSLASH = text("/");

    /**
     * Produces the document for this code.
     *
     * @param context state of the current render
     * @return the document
     */
    Doc run(RenderContext context);

    /**
     * Sequences this code with another.
     *
     * @param next code to run and print after this one
     * @return combined code
     */
    default DotCode append(DotCode next) {
        Objects.requireNonNull(next, "next must not be null");
        return context -> {
            Doc first = run(context);
            return first.append(next.run(context));
        };
    }

    /**
     * Sequences this code with another, separated by a space.
     *
     * @param next code to follow
     * @return combined code
     */
    default DotCode appendSpaced(DotCode next) {
        return append(SPACE).append(next);
    }

    /**
     * Groups this code; see {@link Doc#group()}.
     *
     * @return grouped code
     */
    default DotCode group() {
        return context -> run(context).group();
    }

    /**
     * Nests this code; see {@link Doc#nest(int)}.
     *
     * @param indent additional indentation
     * @return nested code
     */
    default DotCode nest(int indent) {
        return context -> run(context).nest(indent);
    }

    /**
     * Keeps this code on one line; see {@link Doc#flatten()}.
     *
     * @return flattened code
     */
    default DotCode flatten() {
        return context -> run(context).flatten();
    }

    /**
     * Aligns this code; see {@link Doc#align()}.
     *
     * @return aligned code
     */
    default DotCode align() {
        return context -> run(context).align();
    }

    static DotCode empty() {
        return context -> Doc.empty();
    }

    /**
     * Literal text, emitted as-is without escaping or quoting.
     *
     * @param text the text
     * @return code printing the text
     */
    static DotCode text(String text) {
        Doc doc = Doc.text(text);
        return context -> doc;
    }

    static DotCode character(char c) {
        return text(String.valueOf(c));
    }

    static DotCode line() {
        return context -> Doc.line();
    }

    static DotCode lineBreak() {
        return context -> Doc.lineBreak();
    }

    static DotCode hardLine() {
        return context -> Doc.hardLine();
    }

    /**
     * Concatenates codes without separators.
     *
     * <p>Codes run one after another in a loop, so the list may be arbitrarily long.
     *
     * @param codes codes in output order
     * @return combined code
     */
    static DotCode hcat(List<DotCode> codes) {
        return fold(codes, empty());
    }

    /**
     * Concatenates codes separated by spaces.
     *
     * @param codes codes in output order
     * @return combined code
     */
    static DotCode hsep(List<DotCode> codes) {
        return fold(codes, SPACE);
    }

    /**
     * Concatenates codes separated by {@link #line()}.
     *
     * @param codes codes in output order
     * @return combined code
     */
    static DotCode vsep(List<DotCode> codes) {
        return fold(codes, line());
    }

    /**
     * Concatenates codes separated by {@link #lineBreak()}.
     *
     * @param codes codes in output order
     * @return combined code
     */
    static DotCode vcat(List<DotCode> codes) {
        return fold(codes, lineBreak());
    }

    /**
     * {@link #vsep(List)} printed on one line, with spaces, when it fits.
     *
     * @param codes codes in output order
     * @return grouped code
     */
    static DotCode sep(List<DotCode> codes) {
        return vsep(codes).group();
    }

    /**
     * {@link #vcat(List)} printed on one line when it fits.
     *
     * @param codes codes in output order
     * @return grouped code
     */
    static DotCode cat(List<DotCode> codes) {
        return vcat(codes).group();
    }

    /**
     * Appends a separator to every code but the last.
     *
     * @param separator separator to append
     * @param codes codes to punctuate
     * @return punctuated codes
     */
    static List<DotCode> punctuate(DotCode separator, List<DotCode> codes) {
        List<DotCode> result = new ArrayList<>(codes.size());
        for (int i = 0; i < codes.size(); i++) {
            result.add(i < codes.size() - 1 ? codes.get(i).append(separator) : codes.get(i));
        }
        return result;
    }

    /**
     * Encloses codes in delimiters, separated by {@code separator}.
     *
     * <p>Prints {@code [a,b,c]} when it fits; otherwise each element goes on its own
     * line, aligned under the opening delimiter with the separator leading.
     *
     * @param open opening delimiter
     * @param close closing delimiter
     * @param separator separator between elements
     * @param codes elements
     * @return enclosed code
     */
    static DotCode encloseSep(DotCode open, DotCode close, DotCode separator, List<DotCode> codes) {
        if (codes.isEmpty()) {
            return open.append(close);
        }
        if (codes.size() == 1) {
            return open.append(codes.get(0)).append(close);
        }
        List<DotCode> prefixed = new ArrayList<>(codes.size());
        for (int i = 0; i < codes.size(); i++) {
            prefixed.add((i == 0 ? open : separator).append(codes.get(i)));
        }
        return cat(prefixed).append(close).align();
    }

    /**
     * A bracketed, comma-separated list.
     *
     * @param codes elements
     * @return list code
     */
    static DotCode list(List<DotCode> codes) {
        return encloseSep(text("["), text("]"), COMMA, codes);
    }

    static DotCode wrap(DotCode before, DotCode after, DotCode code) {
        return before.append(code).append(after);
    }

    /**
     * Encloses code in double quotes. The content is flattened, since a line break inside
     * a quoted string would become part of its value.
     *
     * @param code quoted content
     * @return quoted code
     */
    static DotCode dquotes(DotCode code) {
        return wrap(text("\""), text("\""), code.flatten());
    }

    static DotCode brackets(DotCode code) {
        return wrap(text("["), text("]"), code);
    }

    static DotCode braces(DotCode code) {
        return wrap(text("{"), text("}"), code);
    }

    static DotCode parens(DotCode code) {
        return wrap(text("("), text(")"), code);
    }

    static DotCode angled(DotCode code) {
        return wrap(text("<"), text(">"), code);
    }

    private static DotCode fold(List<DotCode> codes, DotCode separator) {
        List<DotCode> parts = List.copyOf(codes);
        return context -> {
            Doc doc = Doc.empty();
            for (int i = 0; i < parts.size(); i++) {
                if (i > 0) {
                    doc = doc.append(separator.run(context));
                }
                doc = doc.append(parts.get(i).run(context));
            }
            return doc;
        };
    }
}
