package org.pragmatica.reflow.tree;

/**
 * Node of a token tree: either a single {@link Atom} or a bracketed {@link Group}.
 */
public sealed interface Element permits Atom, Group {

    /**
     * Canonical single-line text of the element.
     */
    String text();

    /**
     * Width of the canonical single-line text.
     */
    default int size() {
        return text().length();
    }

    boolean isKeyword();

    boolean isString();

    boolean isComment();

    boolean isComma();

    boolean isColon();
}
