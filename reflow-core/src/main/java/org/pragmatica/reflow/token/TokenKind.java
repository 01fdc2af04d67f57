package org.pragmatica.reflow.token;

/**
 * Lexical classification of a token.
 */
public enum TokenKind {
    KEYWORD,
    NAME,
    NUMBER,
    STRING,
    COMMENT,
    PUNCTUATION
}
