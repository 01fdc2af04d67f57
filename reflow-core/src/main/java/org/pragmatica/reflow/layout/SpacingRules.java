package org.pragmatica.reflow.layout;

import org.pragmatica.reflow.token.Token;

import java.util.Optional;
import java.util.Set;

/**
 * Canonical spacing between two adjacent tokens on a line.
 */
public final class SpacingRules {
    private static final String NO_SPACE_BEFORE = "([{.,:}])";
    private static final String CLOSING_BRACKETS = "}])";
    private static final String NO_SPACE_AFTER_CLOSING = ".,}])";
    private static final Set<String> BINARY_OPERATORS = Set.of("+", "-", "%", "*", "/", "//", "**");

    private SpacingRules() {}

    /**
     * Decide whether a space separates {@code current} from the preceding token.
     *
     * @param previous       nearest real token before {@code current}
     * @param beforePrevious real token before {@code previous}, if any
     * @param current        text of the token being placed
     * @param equal          whether {@code =} gets spaces around it (top level assignments)
     */
    public static boolean needsSpace(Token previous, Optional<Token> beforePrevious, String current, boolean equal) {
        var previousText = previous.text();

        if (current.isEmpty() || previousText.isEmpty()) {
            return false;
        }

        char first = current.charAt(0);
        char previousLast = previousText.charAt(previousText.length() - 1);

        if (isWord(previous) && NO_SPACE_BEFORE.indexOf(first) < 0) {
            return true;
        }

        var beforePreviousText = beforePrevious.map(Token::text).orElse("");

        // Relative imports and attribute access stay tight; colons never get a leading space.
        if ("from".equals(beforePreviousText) || previousLast == '.' || "import".equals(current) || first == ':') {
            return false;
        }

        return (CLOSING_BRACKETS.indexOf(previousLast) >= 0 && NO_SPACE_AFTER_CLOSING.indexOf(first) < 0)
               || previousLast == ':'
               || previousLast == ','
               || (equal && "=".equals(previousText))
               || (BINARY_OPERATORS.contains(previousText) && beforePrevious.filter(SpacingRules::isOperand)
                                                                            .isPresent());
    }

    /**
     * Spaces required regardless of {@link #needsSpace}: inside {@code from . import (}.
     */
    public static boolean forcesSpace(String previousText, String current) {
        return ("from".equals(previousText) && ".".equals(current))
               || (".".equals(previousText) && "import".equals(current))
               || ("import".equals(previousText) && "(".equals(current));
    }

    private static boolean isWord(Token token) {
        return token.isKeyword() || token.isString() || token.isName() || token.isNumber();
    }

    // An operator following anything else is unary and binds tight.
    private static boolean isOperand(Token token) {
        return token.isName() || token.isNumber() || token.isString();
    }
}
