package org.pragmatica.reflow.tree;

import java.util.List;
import java.util.Objects;

/**
 * One bracketed construct: the opening bracket atom, the contents and the
 * closing bracket atom, in source order.
 *
 * <p>Groups are immutable, so the canonical single-line text is computed once.
 */
public final class Group implements Element {
    private static final String NO_SPACE_AFTER = "([{,.:}]) ";
    private static final String NO_SPACE_BEFORE = "([{,.:}])";

    private final GroupKind kind;
    private final List<Element> children;
    private final String text;

    private Group(GroupKind kind, List<Element> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.children = List.copyOf(children);
        this.text = canonicalText(this.children);
    }

    public static Group group(GroupKind kind, List<Element> children) {
        return new Group(kind, children);
    }

    public GroupKind kind() {
        return kind;
    }

    public List<Element> children() {
        return children;
    }

    public String openBracket() {
        return kind.openBracket();
    }

    public String closeBracket() {
        return kind.closeBracket();
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public boolean isKeyword() {
        return false;
    }

    @Override
    public boolean isString() {
        return false;
    }

    @Override
    public boolean isComment() {
        return false;
    }

    @Override
    public boolean isComma() {
        return false;
    }

    @Override
    public boolean isColon() {
        return false;
    }

    @Override
    public String toString() {
        return text;
    }

    /**
     * Render children on a single line: ", " after commas, ": " after colons,
     * and a single space between other neighbours unless punctuation already
     * separates them. A keyword is always followed by a space.
     */
    private static String canonicalText(List<Element> children) {
        var builder = new StringBuilder();
        boolean lastWasKeyword = false;

        for (var child : children) {
            if (child.isComma()) {
                builder.append(", ");
            } else if (child.isColon()) {
                builder.append(": ");
            } else {
                var childText = child.text();

                if (!builder.isEmpty() && (lastWasKeyword || (!endsWithAny(builder, NO_SPACE_AFTER)
                                                               && !startsWithAny(childText, NO_SPACE_BEFORE)))) {
                    builder.append(' ');
                }
                builder.append(childText);
            }
            lastWasKeyword = child.isKeyword();
        }

        return builder.toString();
    }

    private static boolean endsWithAny(StringBuilder builder, String characters) {
        return characters.indexOf(builder.charAt(builder.length() - 1)) >= 0;
    }

    private static boolean startsWithAny(String text, String characters) {
        return !text.isEmpty() && characters.indexOf(text.charAt(0)) >= 0;
    }
}
