package org.pragmatica.reflow;

import org.pragmatica.reflow.layout.LayoutBuilder;
import org.pragmatica.reflow.tree.Atom;
import org.pragmatica.reflow.tree.Element;
import org.pragmatica.reflow.tree.Group;

import java.util.List;
import java.util.Set;

/**
 * Walks a token tree depth-first, left to right, feeding every token to a
 * {@link LayoutBuilder}.
 *
 * <p>The continued indent is the indentation of lines produced by wrapping.
 * It grows by one column per nested group.
 */
public final class Reflower {
    /**
     * A nested group is moved to a new line, even when it will not fit there,
     * if the space left after the continued indent is more than this many
     * times the width of the current line. Output is sensitive to this value.
     */
    public static final int NESTED_BREAK_RATIO = 4;

    private static final Set<String> NO_TRAILING_SPACE = Set.of(",", ":", "(", "[", "{", "}", "]", ")");

    private Reflower() {}

    /**
     * Lay out one element.
     *
     * @param element               atom or group to lay out
     * @param builder               layout receiving the tokens
     * @param continuedIndent       indentation for wrapped lines
     * @param breakAfterOpenBracket start the contents of a group on a new line
     */
    public static void reflow(Element element, LayoutBuilder builder, String continuedIndent,
                              boolean breakAfterOpenBracket) {
        if (element instanceof Atom atom) {
            reflowAtom(atom, builder, continuedIndent);
        } else if (element instanceof Group group) {
            reflowGroup(group, builder, continuedIndent, breakAfterOpenBracket);
        }
    }

    public static void reflow(Element element, LayoutBuilder builder, String continuedIndent) {
        reflow(element, builder, continuedIndent, false);
    }

    /**
     * Whether the element following {@code previous} must start on a new line:
     * adjacent string literals are never joined and nothing, atom or group,
     * may follow a comment on its line.
     */
    static boolean requiresLineBreak(Element previous, Element current) {
        return previous != null
               && (previous.isComment() || (previous.isString() && current.isString()));
    }

    private static void reflowAtom(Atom atom, LayoutBuilder builder, String continuedIndent) {
        var token = atom.token();

        if (token.isComment()) {
            builder.addComment(token);
            return;
        }

        int extent = token.size() + (NO_TRAILING_SPACE.contains(token.text()) ? 0 : 1);

        if (!builder.fitsOnCurrentLine(extent) && !builder.lineEmpty()) {
            builder.addLineBreak(continuedIndent);
        } else {
            builder.addSpaceIfNeeded(token.text(), false);
        }

        builder.addItem(token, continuedIndent.length());
    }

    private static void reflowGroup(Group group, LayoutBuilder builder, String continuedIndent,
                                    boolean breakAfterOpenBracket) {
        var children = group.children();
        boolean breakPending = breakAfterOpenBracket;

        for (int index = 0; index < children.size(); index++) {
            var previous = elementAt(children, index - 1);
            var child = children.get(index);
            var next = elementAt(children, index + 1);

            if (requiresLineBreak(previous, child)) {
                builder.addLineBreak(continuedIndent);
            }

            if (child instanceof Group nested) {
                if (shouldBreakBefore(nested, previous, builder, continuedIndent)) {
                    builder.addLineBreak(continuedIndent);
                }
                reflowGroup(nested, builder, continuedIndent + " ", false);
            } else {
                reflow(child, builder, continuedIndent);
            }

            if (breakPending
                && index == 0
                && group.openBracket().equals(child.text())
                && (next == null || !group.closeBracket().equals(next.text()))) {
                builder.addLineBreak(continuedIndent);
                breakPending = false;
            }
        }
    }

    /**
     * Move a nested group to a fresh line when it does not fit on the current
     * one, unless it is the value of a default initializer or the move would
     * push its siblings far to the right.
     */
    private static boolean shouldBreakBefore(Group nested, Element previous, LayoutBuilder builder,
                                             String continuedIndent) {
        if ((previous != null && "=".equals(previous.text()))
            || builder.lineEmpty()
            || builder.fitsOnCurrentLine(nested.size())) {
            return false;
        }

        int spaceAvailable = builder.maxLineLength() - continuedIndent.length();
        int currentSize = builder.currentSize();

        return builder.fitsOnEmptyLine(nested.size())
               || (currentSize > 0 && spaceAvailable / currentSize > NESTED_BREAK_RATIO);
    }

    private static Element elementAt(List<Element> elements, int index) {
        return index >= 0 && index < elements.size() ? elements.get(index) : null;
    }
}
