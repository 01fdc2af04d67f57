package org.pragmatica.reflow.layout;

import org.pragmatica.reflow.token.Token;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SpacingRulesTest {

    @Test
    void needsSpace_betweenWords() {
        assertThat(SpacingRules.needsSpace(Token.name("not"), Optional.empty(), "x", false))
                  .isTrue();
        assertThat(SpacingRules.needsSpace(Token.string("'a'"), Optional.empty(), "if", false))
                  .isTrue();
    }

    @Test
    void needsSpace_isFalse_beforeBracketsAndPunctuation() {
        assertThat(SpacingRules.needsSpace(Token.name("foo"), Optional.empty(), "(", false))
                  .isFalse();
        assertThat(SpacingRules.needsSpace(Token.name("a"), Optional.empty(), ",", false))
                  .isFalse();
        assertThat(SpacingRules.needsSpace(Token.name("a"), Optional.empty(), ":", false))
                  .isFalse();
        assertThat(SpacingRules.needsSpace(Token.punctuation(")"), Optional.empty(), ".", false))
                  .isFalse();
    }

    @Test
    void needsSpace_afterSeparators() {
        assertThat(SpacingRules.needsSpace(Token.punctuation(","), Optional.empty(), "b", false))
                  .isTrue();
        assertThat(SpacingRules.needsSpace(Token.punctuation(":"), Optional.empty(), "b", false))
                  .isTrue();
        assertThat(SpacingRules.needsSpace(Token.punctuation(")"), Optional.empty(), "if", false))
                  .isTrue();
    }

    @Test
    void needsSpace_isFalse_afterDot() {
        assertThat(SpacingRules.needsSpace(Token.punctuation("."), Optional.of(Token.name("a")), "b", false))
                  .isFalse();
    }

    @Test
    void needsSpace_afterEquals_onlyWhenRequested() {
        var equals = Token.punctuation("=");
        var key = Optional.of(Token.name("x"));

        assertThat(SpacingRules.needsSpace(equals, key, "1", true))
                  .isTrue();
        assertThat(SpacingRules.needsSpace(equals, key, "1", false))
                  .isFalse();
    }

    @Test
    void needsSpace_afterBinaryOperator_onlyWithOperandBefore() {
        var minus = Token.punctuation("-");

        assertThat(SpacingRules.needsSpace(minus, Optional.of(Token.name("a")), "b", false))
                  .isTrue();
        assertThat(SpacingRules.needsSpace(minus, Optional.of(Token.punctuation("(")), "b", false))
                  .isFalse();
        assertThat(SpacingRules.needsSpace(minus, Optional.of(Token.name("return")), "1", false))
                  .isFalse();
    }

    @Test
    void needsSpace_isFalse_forEmptyText() {
        assertThat(SpacingRules.needsSpace(Token.name("a"), Optional.empty(), "", false))
                  .isFalse();
    }

    @Test
    void forcesSpace_insideRelativeImport() {
        assertThat(SpacingRules.forcesSpace("from", "."))
                  .isTrue();
        assertThat(SpacingRules.forcesSpace(".", "import"))
                  .isTrue();
        assertThat(SpacingRules.forcesSpace("import", "("))
                  .isTrue();
        assertThat(SpacingRules.forcesSpace("a", "("))
                  .isFalse();
    }
}
