package com.dotprint.core.printing;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Greedy width-aware layout of a {@link Doc}.
 *
 * <p>Follows Wadler's "prettier printer" with Leijen's ribbon extension: a group is
 * printed flat iff its flat form, plus whatever follows it up to the next line break,
 * fits in {@code min(width - column, ribbon - column + indent)} characters, where the
 * ribbon is {@code width * ribbonFraction} and bounds the non-indentation text on a
 * line. Decisions are made once, left to right, without backtracking.
 */
final class DocLayout {

    private DocLayout() {
        // Prevent instantiation
    }

    /**
     * Lays out a document.
     *
     * @param doc document to print
     * @param width preferred maximum line width
     * @param ribbonFraction fraction of the width available to non-indentation text
     * @return the laid-out text
     */
    static String layout(Doc doc, int width, double ribbonFraction) {
        int ribbon = (int) Math.max(0, Math.min(width, Math.round(width * ribbonFraction)));

        StringBuilder out = new StringBuilder();
        int column = 0;

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(0, false, doc));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Doc d = frame.doc;

            if (d instanceof Doc.Text text) {
                out.append(text.text);
                int newline = text.text.lastIndexOf('\n');
                column = newline < 0 ? column + text.text.length() : text.text.length() - newline - 1;
            } else if (d instanceof Doc.Line line) {
                if (frame.flat && !line.hard) {
                    out.append(line.flat);
                    column += line.flat.length();
                } else {
                    out.append('\n').append(" ".repeat(frame.indent));
                    column = frame.indent;
                }
            } else if (d instanceof Doc.Concat concat) {
                stack.push(new Frame(frame.indent, frame.flat, concat.right));
                stack.push(new Frame(frame.indent, frame.flat, concat.left));
            } else if (d instanceof Doc.Nest nest) {
                stack.push(new Frame(frame.indent + nest.indent, frame.flat, nest.body));
            } else if (d instanceof Doc.Align align) {
                stack.push(new Frame(column, frame.flat, align.body));
            } else if (d instanceof Doc.Flat flatDoc) {
                stack.push(new Frame(frame.indent, true, flatDoc.body));
            } else if (d instanceof Doc.Group group) {
                Frame flat = new Frame(frame.indent, true, group.body);
                int remaining = Math.min(width - column, ribbon - column + frame.indent);
                if (frame.flat || fits(flat, stack.iterator(), remaining)) {
                    stack.push(flat);
                } else {
                    stack.push(new Frame(frame.indent, false, group.body));
                }
            }
        }
        return out.toString();
    }

    private static boolean fits(Frame first, Iterator<Frame> rest, int remaining) {
        Deque<Frame> work = new ArrayDeque<>();
        work.push(first);

        while (remaining >= 0) {
            if (work.isEmpty()) {
                if (!rest.hasNext()) {
                    return true;
                }
                work.push(rest.next());
            }
            Frame frame = work.pop();
            Doc d = frame.doc;

            if (d instanceof Doc.Text text) {
                int newline = text.text.indexOf('\n');
                if (newline >= 0) {
                    return newline <= remaining;
                }
                remaining -= text.text.length();
            } else if (d instanceof Doc.Line line) {
                if (!frame.flat) {
                    return true;
                }
                if (line.hard) {
                    return false;
                }
                remaining -= line.flat.length();
            } else if (d instanceof Doc.Concat concat) {
                work.push(new Frame(frame.indent, frame.flat, concat.right));
                work.push(new Frame(frame.indent, frame.flat, concat.left));
            } else if (d instanceof Doc.Nest nest) {
                work.push(new Frame(frame.indent + nest.indent, frame.flat, nest.body));
            } else if (d instanceof Doc.Align align) {
                work.push(new Frame(frame.indent, frame.flat, align.body));
            } else if (d instanceof Doc.Flat flatDoc) {
                work.push(new Frame(frame.indent, true, flatDoc.body));
            } else if (d instanceof Doc.Group group) {
                work.push(new Frame(frame.indent, frame.flat, group.body));
            }
        }
        return false;
    }

    private record Frame(int indent, boolean flat, Doc doc) {
    }
}
