package org.pragmatica.reflow.tree;

import java.util.Optional;

/**
 * Bracket pair enclosing a {@link Group}.
 */
public enum GroupKind {
    /** Tuple-like, call arguments, parenthesized expressions. */
    PAREN("(", ")"),
    /** List-like and subscripts. */
    BRACKET("[", "]"),
    /** Dict or set displays. */
    BRACE("{", "}");

    private final String openBracket;
    private final String closeBracket;

    GroupKind(String openBracket, String closeBracket) {
        this.openBracket = openBracket;
        this.closeBracket = closeBracket;
    }

    public String openBracket() {
        return openBracket;
    }

    public String closeBracket() {
        return closeBracket;
    }

    public static Optional<GroupKind> openedBy(String text) {
        for (var kind : values()) {
            if (kind.openBracket.equals(text)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static boolean isCloseBracket(String text) {
        for (var kind : values()) {
            if (kind.closeBracket.equals(text)) {
                return true;
            }
        }
        return false;
    }
}
