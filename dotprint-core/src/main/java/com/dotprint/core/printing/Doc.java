package com.dotprint.core.printing;

import java.util.Objects;

/**
 * An immutable document tree awaiting layout.
 *
 * <p>Documents are built from text, line breaks, concatenation, nesting and groups.
 * A group is printed on one line when it fits the page and broken at its line breaks
 * otherwise; see {@link DocLayout}. Line breaks only fall between tokens: content that
 * must stay on one line, such as the inside of a quoted string, is wrapped in
 * {@link #flatten()}.
 *
 * <p>Instances are obtained through the static factories and combinators; the node
 * classes are internal to the layout engine.
 */
public abstract class Doc {

    private static final Doc EMPTY = new Empty();
    private static final Doc LINE = new Line(" ", false);
    private static final Doc LINE_BREAK = new Line("", false);
    private static final Doc HARD_LINE = new Line("", true);

    Doc() {
    }

    /**
     * The empty document.
     *
     * @return empty document
     */
    public static Doc empty() {
        return EMPTY;
    }

    /**
     * A literal piece of text.
     *
     * @param text the text
     * @return the text document, or {@link #empty()} for empty text
     */
    public static Doc text(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return text.isEmpty() ? EMPTY : new Text(text);
    }

    /**
     * A line break that flattens to a single space.
     *
     * @return line document
     */
    public static Doc line() {
        return LINE;
    }

    /**
     * A line break that flattens to nothing.
     *
     * @return line-break document
     */
    public static Doc lineBreak() {
        return LINE_BREAK;
    }

    /**
     * A line break that is never flattened; any group containing it is broken.
     *
     * @return hard line document
     */
    public static Doc hardLine() {
        return HARD_LINE;
    }

    /**
     * Concatenates this document with another.
     *
     * @param next document to follow this one
     * @return the concatenation
     */
    public Doc append(Doc next) {
        Objects.requireNonNull(next, "next must not be null");
        if (this == EMPTY) {
            return next;
        }
        if (next == EMPTY) {
            return this;
        }
        return new Concat(this, next);
    }

    /**
     * Increases the indentation of line breaks inside this document.
     *
     * @param indent additional indentation
     * @return the nested document
     */
    public Doc nest(int indent) {
        return new Nest(indent, this);
    }

    /**
     * Indents line breaks inside this document to the column where it starts.
     *
     * @return the aligned document
     */
    public Doc align() {
        return new Align(this);
    }

    /**
     * Marks this document as a unit to print flat when it fits.
     *
     * @return the grouped document
     */
    public Doc group() {
        return new Group(this);
    }

    /**
     * Prints this document on one line regardless of width. Soft line breaks inside it
     * become their flat form.
     *
     * @return the flattened document
     */
    public Doc flatten() {
        return this == EMPTY ? EMPTY : new Flat(this);
    }

    /**
     * Checks whether this is the empty document.
     *
     * @return true if empty
     */
    public boolean isEmpty() {
        return this == EMPTY;
    }

    static final class Empty extends Doc {
    }

    static final class Text extends Doc {
        final String text;

        Text(String text) {
            this.text = text;
        }
    }

    static final class Line extends Doc {
        final String flat;
        final boolean hard;

        Line(String flat, boolean hard) {
            this.flat = flat;
            this.hard = hard;
        }
    }

    static final class Concat extends Doc {
        final Doc left;
        final Doc right;

        Concat(Doc left, Doc right) {
            this.left = left;
            this.right = right;
        }
    }

    static final class Nest extends Doc {
        final int indent;
        final Doc body;

        Nest(int indent, Doc body) {
            this.indent = indent;
            this.body = body;
        }
    }

    static final class Align extends Doc {
        final Doc body;

        Align(Doc body) {
            this.body = body;
        }
    }

    static final class Flat extends Doc {
        final Doc body;

        Flat(Doc body) {
            this.body = body;
        }
    }

    static final class Group extends Doc {
        final Doc body;

        Group(Doc body) {
            this.body = body;
        }
    }
}
