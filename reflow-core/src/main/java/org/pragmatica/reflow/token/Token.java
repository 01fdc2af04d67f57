package org.pragmatica.reflow.token;

import java.util.Objects;

/**
 * An indivisible lexical unit: raw text plus its classification.
 *
 * <p>Reserved words are classified as {@link TokenKind#KEYWORD} and are not
 * names, so {@code return -1} never reads as a binary operation.
 */
public record Token(String text, TokenKind kind) {

    public Token {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(kind, "kind");
    }

    public static Token token(String text, TokenKind kind) {
        return new Token(text, kind);
    }

    /**
     * Create a name token, classified as keyword when the word is reserved.
     */
    public static Token name(String text) {
        return new Token(text, PythonKeywords.isKeyword(text) ? TokenKind.KEYWORD : TokenKind.NAME);
    }

    public static Token number(String text) {
        return new Token(text, TokenKind.NUMBER);
    }

    public static Token string(String text) {
        return new Token(text, TokenKind.STRING);
    }

    public static Token comment(String text) {
        return new Token(text, TokenKind.COMMENT);
    }

    public static Token punctuation(String text) {
        return new Token(text, TokenKind.PUNCTUATION);
    }

    public int size() {
        return text.length();
    }

    public boolean isKeyword() {
        return kind == TokenKind.KEYWORD;
    }

    public boolean isName() {
        return kind == TokenKind.NAME;
    }

    public boolean isNumber() {
        return kind == TokenKind.NUMBER;
    }

    public boolean isString() {
        return kind == TokenKind.STRING;
    }

    public boolean isComment() {
        return kind == TokenKind.COMMENT;
    }

    public boolean isComma() {
        return ",".equals(text);
    }

    public boolean isColon() {
        return ":".equals(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
