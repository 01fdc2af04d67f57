package org.pragmatica.reflow.layout;

import org.pragmatica.reflow.layout.LayoutUnit.Indent;
import org.pragmatica.reflow.layout.LayoutUnit.LineBreak;
import org.pragmatica.reflow.layout.LayoutUnit.Space;
import org.pragmatica.reflow.layout.LayoutUnit.TokenUnit;
import org.pragmatica.reflow.token.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulates the layout of one logical line as a stream of units.
 *
 * <p>Every inserted token runs through an ordered set of guards that decide
 * spacing and line breaks:
 * <ul>
 *   <li>inside brackets, the default-initializer guard keeps {@code key=value} together;</li>
 *   <li>then, for a comma or closing bracket, the line is split at the last space if the delimiter overflows;</li>
 *   <li>outside brackets, the token either fits (with forced spacing) or starts a new line.</li>
 * </ul>
 * The builder tracks the current bracket depth and the width of the current line.
 */
public final class LayoutBuilder {
    private static final Set<String> OPENING_BRACKETS = Set.of("(", "[", "{");
    private static final Set<String> CLOSING_BRACKETS = Set.of(")", "]", "}");
    private static final Set<String> SPLIT_DELIMITERS = Set.of(",", ")", "]", "}");
    private static final int COMMENT_SPACES = 2;

    private final int maxLineLength;
    private final List<LayoutUnit> units = new ArrayList<>();
    private int bracketDepth;

    private LayoutBuilder(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }

    /**
     * Factory method for an empty layout.
     */
    public static LayoutBuilder layoutBuilder(int maxLineLength) {
        return new LayoutBuilder(maxLineLength);
    }

    public int maxLineLength() {
        return maxLineLength;
    }

    public int bracketDepth() {
        return bracketDepth;
    }

    /**
     * Snapshot of the units laid out so far.
     */
    public List<LayoutUnit> units() {
        return List.copyOf(units);
    }

    /**
     * Append a token, reflowing the current line around it.
     *
     * @param token        token to append
     * @param indentAmount indentation of any line started on behalf of this token
     */
    public void addItem(Token token, int indentAmount) {
        var text = token.text();

        if (!units.isEmpty() && bracketDepth > 0) {
            preventDefaultInitializerSplitting(token, indentAmount);

            if (SPLIT_DELIMITERS.contains(text)) {
                splitAfterDelimiter(token, indentAmount);
            }
        } else if (!units.isEmpty() && !lineEmpty()) {
            if (fitsOnCurrentLine(text.length())) {
                enforceSpace(text);
            } else {
                units.add(LayoutUnit.LINE_BREAK);
                units.add(new Indent(indentAmount));
            }
        }

        units.add(new TokenUnit(token));
        updateBracketDepth(text);
    }

    /**
     * Append a trailing comment, preceded by exactly two spaces.
     */
    public void addComment(Token comment) {
        int spaces = 0;

        for (int i = units.size() - 1; i >= 0 && spaces < COMMENT_SPACES && units.get(i) instanceof Space; i--) {
            spaces++;
        }
        for (; spaces < COMMENT_SPACES; spaces++) {
            units.add(LayoutUnit.SPACE);
        }
        units.add(new TokenUnit(comment));
    }

    public void addIndent(int indentAmount) {
        units.add(new Indent(indentAmount));
    }

    /**
     * Start a new line indented by the width of {@code indent}.
     */
    public void addLineBreak(String indent) {
        units.add(LayoutUnit.LINE_BREAK);
        addIndent(indent.length());
    }

    /**
     * Append a space if the spacing rules require one between the last token
     * and {@code currentText}. Nothing is added after whitespace or at the start.
     */
    public void addSpaceIfNeeded(String currentText, boolean equal) {
        if (units.isEmpty() || !(units.get(units.size() - 1) instanceof TokenUnit previous)) {
            return;
        }

        var beforePrevious = realTokenBefore(units.size() - 1);

        if (SpacingRules.needsSpace(previous.token(), beforePrevious, currentText, equal)) {
            units.add(LayoutUnit.SPACE);
        }
    }

    public boolean fitsOnCurrentLine(int itemExtent) {
        return currentSize() + itemExtent <= maxLineLength;
    }

    public boolean fitsOnEmptyLine(int itemExtent) {
        return itemExtent <= maxLineLength;
    }

    /**
     * Width of the current line, indentation included.
     */
    public int currentSize() {
        int size = 0;

        for (int i = units.size() - 1; i >= 0; i--) {
            var unit = units.get(i);
            size += unit.size();

            if (unit instanceof LineBreak) {
                break;
            }
        }

        return size;
    }

    /**
     * Whether nothing but indentation has been placed on the current line.
     */
    public boolean lineEmpty() {
        return units.isEmpty() || units.get(units.size() - 1).isLineStart();
    }

    /**
     * Render the layout: trailing whitespace is stripped from every line and
     * the text ends with exactly one newline.
     */
    public String emit() {
        var output = new StringBuilder();

        for (var unit : units) {
            if (unit instanceof LineBreak) {
                stripTrailingWhitespace(output);
            }
            output.append(unit.text());
        }

        stripTrailingWhitespace(output);
        return output.append('\n').toString();
    }

    @Override
    public String toString() {
        return emit();
    }

    /**
     * Keep a default initializer on one line, even past the maximum length.
     */
    private void preventDefaultInitializerSplitting(Token token, int indentAmount) {
        if ("=".equals(token.text())) {
            deleteWhitespace();
            return;
        }

        int previousIndex = -1;
        int keyIndex = -1;

        for (int i = units.size() - 1; i >= 0; i--) {
            if (units.get(i).isWhitespace()) {
                continue;
            }
            if (previousIndex < 0) {
                previousIndex = i;
            } else {
                keyIndex = i;
                break;
            }
        }

        if (previousIndex < 0 || keyIndex < 0 || !"=".equals(units.get(previousIndex).text())) {
            return;
        }

        // Only whitespace after '=' is removed, so keyIndex stays valid.
        deleteWhitespace();

        if ((keyIndex > 0 && units.get(keyIndex - 1) instanceof Indent) || fitsOnCurrentLine(token.size() + 1)) {
            return;
        }

        if (keyIndex > 0 && units.get(keyIndex - 1) instanceof Space) {
            units.remove(keyIndex - 1);
            keyIndex--;
        }
        insertLineBreak(keyIndex, indentAmount);
    }

    /**
     * Break the line at its last space when a delimiter would overflow it.
     */
    private void splitAfterDelimiter(Token token, int indentAmount) {
        deleteWhitespace();

        if (fitsOnCurrentLine(token.size())) {
            return;
        }

        for (int i = units.size() - 1; i >= 0; i--) {
            var unit = units.get(i);

            if (unit instanceof Space) {
                units.remove(i);
                insertLineBreak(i, indentAmount);
                return;
            }
            if (unit.isLineStart()) {
                return;
            }
        }
    }

    private void enforceSpace(String text) {
        if (!(units.get(units.size() - 1) instanceof TokenUnit previous)) {
            return;
        }
        if (SpacingRules.forcesSpace(previous.text(), text)) {
            units.add(LayoutUnit.SPACE);
        }
    }

    private void insertLineBreak(int index, int indentAmount) {
        units.add(index, LayoutUnit.LINE_BREAK);
        units.add(index + 1, new Indent(indentAmount));
    }

    private void deleteWhitespace() {
        while (!units.isEmpty()
               && units.get(units.size() - 1).isWhitespace()
               && !startsLineAfterComment(units.size() - 1)) {
            units.remove(units.size() - 1);
        }
    }

    /**
     * Whether the unit at {@code index} is the line break ending a comment,
     * or the indent directly after that break. Removing either would pull
     * the next token into the comment.
     */
    private boolean startsLineAfterComment(int index) {
        int breakIndex = units.get(index) instanceof Indent && index > 0 && units.get(index - 1) instanceof LineBreak
                         ? index - 1
                         : index;

        return units.get(breakIndex) instanceof LineBreak
               && breakIndex > 0
               && units.get(breakIndex - 1) instanceof TokenUnit previous
               && previous.token().isComment();
    }

    private Optional<Token> realTokenBefore(int index) {
        for (int i = index - 1; i >= 0; i--) {
            if (units.get(i) instanceof TokenUnit unit) {
                return Optional.of(unit.token());
            }
        }
        return Optional.empty();
    }

    private void updateBracketDepth(String text) {
        if (OPENING_BRACKETS.contains(text)) {
            bracketDepth++;
        } else if (CLOSING_BRACKETS.contains(text)) {
            bracketDepth--;

            if (bracketDepth < 0) {
                throw new IllegalStateException("Bracket depth went negative at '" + text + "'");
            }
        }
    }

    private static void stripTrailingWhitespace(StringBuilder output) {
        int end = output.length();

        while (end > 0 && Character.isWhitespace(output.charAt(end - 1))) {
            end--;
        }
        output.setLength(end);
    }
}
