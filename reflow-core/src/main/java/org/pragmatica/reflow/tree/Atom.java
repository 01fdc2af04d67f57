package org.pragmatica.reflow.tree;

import org.pragmatica.reflow.token.Token;

import java.util.Objects;

/**
 * Leaf of the token tree wrapping one token.
 */
public record Atom(Token token) implements Element {

    public Atom {
        Objects.requireNonNull(token, "token");
    }

    public static Atom atom(Token token) {
        return new Atom(token);
    }

    @Override
    public String text() {
        return token.text();
    }

    @Override
    public int size() {
        return token.size();
    }

    @Override
    public boolean isKeyword() {
        return token.isKeyword();
    }

    @Override
    public boolean isString() {
        return token.isString();
    }

    @Override
    public boolean isComment() {
        return token.isComment();
    }

    @Override
    public boolean isComma() {
        return token.isComma();
    }

    @Override
    public boolean isColon() {
        return token.isColon();
    }

    @Override
    public String toString() {
        return token.text();
    }
}
