package org.pragmatica.reflow;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pragmatica.reflow.LineReflower.lineReflower;

class LineReflowerTest {
    private final LineReflower reflower = lineReflower();

    @Test
    void reflow_alignsWrappedArguments_withOpeningBracket() {
        var narrow = lineReflower(ReflowConfig.defaultConfig().withMaxLineLength(30));
        var aligned = " ".repeat(23);

        assertThat(narrow.reflow("result = some_function(alpha, beta, gamma, delta)", ""))
                  .isEqualTo("result = some_function(alpha,\n"
                             + aligned + "beta,\n"
                             + aligned + "gamma,\n"
                             + aligned + "delta)\n");
    }

    @Test
    void reflow_keepsCommentAfterTwoSpaces() {
        assertThat(reflower.reflow("x = 1  # comment", ""))
                  .isEqualTo("x = 1  # comment\n");
        assertThat(reflower.reflow("x = 1 # comment", "    "))
                  .isEqualTo("    x = 1  # comment\n");
    }

    @Test
    void reflow_putsAdjacentStrings_atEqualIndent() {
        var noStep = lineReflower(ReflowConfig.defaultConfig().withIndentSize(0));

        assertThat(noStep.reflow("\"a\" \"b\"", "    "))
                  .isEqualTo("    \"a\"\n    \"b\"\n");
    }

    @Test
    void reflow_normalizesSpacing() {
        assertThat(reflower.reflow("foo( a,b )", ""))
                  .isEqualTo("foo(a, b)\n");
        assertThat(reflower.reflow("foo(a,\n    b)", ""))
                  .isEqualTo("foo(a, b)\n");
    }

    @Test
    void reflow_prefixesIndentation() {
        assertThat(reflower.reflow("foo(a, b)", "    "))
                  .isEqualTo("    foo(a, b)\n");
    }

    @Test
    void reflow_letsSingleAtomExceedLimit() {
        var tiny = lineReflower(ReflowConfig.defaultConfig().withMaxLineLength(10));

        assertThat(tiny.reflow("f('a_very_long_string_literal')", ""))
                  .isEqualTo("f(\n  'a_very_long_string_literal')\n");
    }

    @Test
    void reflow_alignsDefParameters_withOpeningBracket() {
        var narrow = lineReflower(ReflowConfig.defaultConfig().withMaxLineLength(30));

        assertThat(narrow.reflow("def f(alpha_argument, beta_argument, gamma_argument):", ""))
                  .isEqualTo("def f(alpha_argument,\n"
                             + "      beta_argument,\n"
                             + "      gamma_argument):\n");
    }

    @Test
    void reflow_keepsClosingBracket_offCommentLine() {
        var result = reflower.reflow("foo(\n    a,  # comment\n)", "");

        assertThat(result)
                  .isEqualTo("foo(a,  # comment\n    )\n");
        assertThat(reflower.reflow(result, ""))
                  .isEqualTo(result);
    }

    @Test
    void reflow_keepsComma_offCommentLine() {
        assertThat(reflower.reflow("foo(a  # comment\n, b)", ""))
                  .isEqualTo("foo(a  # comment\n    , b)\n");
    }

    @Test
    void reflow_startsNestedGroup_onLineAfterComment() {
        assertThat(reflower.reflow("foo(a,  # comment\n (b, c))", ""))
                  .isEqualTo("foo(a,  # comment\n    (b, c))\n");
    }

    @Test
    void candidate_breaksAfterOpenBracket_withoutPrefixLine() {
        assertThat(reflower.candidate("print(alpha, beta)", "", false))
                  .contains("print(\n    alpha, beta)\n");
    }

    @Test
    void candidate_doubleIndentsDef_withoutPrefixLine() {
        var narrow = lineReflower(ReflowConfig.defaultConfig().withMaxLineLength(30));

        assertThat(reflower.candidate("def function(alpha, beta):", "", false))
                  .contains("def function(\n        alpha, beta):\n");
        assertThat(narrow.candidate("def f(alpha_argument, beta_argument, gamma_argument):", "", false))
                  .contains("def f(\n"
                            + "        alpha_argument,\n"
                            + "        beta_argument,\n"
                            + "        gamma_argument):\n");
    }

    @Test
    void candidate_isRejected_whenContentsAlignWithContinuedIndent() {
        assertThat(reflower.candidate("foo(alpha, beta)", "", false))
                  .isEmpty();
        assertThat(reflower.candidate("foo(alpha, beta)", "", true))
                  .contains("foo(alpha, beta)\n");
    }

    @Test
    void isReflowed_comparesWithReflowedText() {
        assertThat(reflower.isReflowed("foo(a, b)\n", ""))
                  .isTrue();
        assertThat(reflower.isReflowed("foo( a,b )\n", ""))
                  .isFalse();
        assertThat(reflower.isReflowed("foo(a, b)", ""))
                  .as("missing final newline")
                  .isFalse();
    }

    @ParameterizedTest
    @ValueSource(ints = {10, 20, 30, 40, 79})
    void reflow_isIdempotent(int maxLineLength) {
        var sized = lineReflower(ReflowConfig.defaultConfig().withMaxLineLength(maxLineLength));
        var once = sized.reflow("result = compute(first_argument, [1, 2, 3], key=value, *args, **kwargs)", "  ");

        assertThat(sized.reflow(once, "  "))
                  .isEqualTo(once);
        assertThat(once)
                  .doesNotContain(" \n")
                  .endsWith(")\n");
    }

    @Test
    void reflow_fails_forUnbalancedBrackets() {
        assertThatThrownBy(() -> reflower.reflow("foo(a, b", ""))
                  .isInstanceOf(ReflowException.UnbalancedBrackets.class);
    }

    @Test
    void reflow_fails_forUntokenizableText() {
        assertThatThrownBy(() -> reflower.reflow("'abc", ""))
                  .isInstanceOf(ReflowException.TokenizeFailed.class)
                  .hasMessageStartingWith("Tokenize error at column 1");
    }

    @Test
    void config_defaultsTo79Columns() {
        assertThat(reflower.config())
                  .isEqualTo(ReflowConfig.defaultConfig());
    }
}
