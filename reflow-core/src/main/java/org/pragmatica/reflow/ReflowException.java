package org.pragmatica.reflow;

/**
 * Failures raised for malformed input handed to the reflow pipeline.
 *
 * <p>The layout itself never fails on a well-formed token tree; these errors
 * come from the tokenizer and the bracket grouping pass.
 */
public abstract sealed class ReflowException extends RuntimeException
        permits ReflowException.TokenizeFailed, ReflowException.UnbalancedBrackets {

    protected ReflowException(String message) {
        super(message);
    }

    public static TokenizeFailed tokenizeFailed(int column, String reason) {
        return new TokenizeFailed(column, reason);
    }

    public static UnbalancedBrackets unbalancedBrackets(int tokenIndex, String reason) {
        return new UnbalancedBrackets(tokenIndex, reason);
    }

    /**
     * Source text could not be split into tokens.
     */
    public static final class TokenizeFailed extends ReflowException {
        private final int column;
        private final String reason;

        private TokenizeFailed(int column, String reason) {
            super("Tokenize error at column " + column + ": " + reason);
            this.column = column;
            this.reason = reason;
        }

        public int column() {
            return column;
        }

        public String reason() {
            return reason;
        }
    }

    /**
     * Brackets in the token stream do not pair up.
     */
    public static final class UnbalancedBrackets extends ReflowException {
        private final int tokenIndex;
        private final String reason;

        private UnbalancedBrackets(int tokenIndex, String reason) {
            super("Unbalanced brackets at token " + tokenIndex + ": " + reason);
            this.tokenIndex = tokenIndex;
            this.reason = reason;
        }

        public int tokenIndex() {
            return tokenIndex;
        }

        public String reason() {
            return reason;
        }
    }
}
