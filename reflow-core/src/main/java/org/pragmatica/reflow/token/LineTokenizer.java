package org.pragmatica.reflow.token;

import org.pragmatica.reflow.ReflowException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the text of one logical line into classified tokens.
 *
 * <p>The logical line may span several physical lines (inside brackets or
 * after a backslash continuation); line ends are treated as whitespace.
 * Columns reported in errors are 1-based offsets into the whole text.
 */
public final class LineTokenizer {
    // Longest operators first so that a prefix never shadows a longer match.
    private static final List<String> OPERATORS = List.of("**=", "//=", ">>=", "<<=", "...",
                                                          "**", "//", ">>", "<<", "<=", ">=", "==", "!=",
                                                          "->", ":=", "+=", "-=", "*=", "/=", "%=", "&=",
                                                          "|=", "^=", "@=");
    private static final String SINGLE_OPERATORS = "+-*/%@&|^~<>()[]{},:.;=";
    private static final String STRING_PREFIXES = "rRbBuUfF";

    private final String source;
    private int position;

    private LineTokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenize a logical line.
     *
     * @throws ReflowException.TokenizeFailed on unterminated strings or unknown characters
     */
    public static List<Token> tokenize(String source) {
        return new LineTokenizer(source).run();
    }

    private List<Token> run() {
        var tokens = new ArrayList<Token>();

        while (position < source.length()) {
            char c = source.charAt(position);

            if (c == '\\') {
                skipContinuation();
            } else if (Character.isWhitespace(c)) {
                position++;
            } else if (c == '#') {
                tokens.add(readComment());
            } else if (isStringStart()) {
                tokens.add(readString());
            } else if (Character.isDigit(c) || (c == '.' && nextIsDigit())) {
                tokens.add(readNumber());
            } else if (isNameStart(c)) {
                tokens.add(readName());
            } else {
                tokens.add(readOperator());
            }
        }

        return tokens;
    }

    private void skipContinuation() {
        int next = position + 1;

        if (next < source.length() && source.charAt(next) == '\r') {
            next++;
        }
        if (next >= source.length() || source.charAt(next) != '\n') {
            throw ReflowException.tokenizeFailed(position + 1, "backslash is not followed by a line end");
        }
        position = next + 1;
    }

    private Token readComment() {
        int start = position;

        while (position < source.length() && source.charAt(position) != '\n' && source.charAt(position) != '\r') {
            position++;
        }

        return Token.comment(source.substring(start, position).stripTrailing());
    }

    private boolean isStringStart() {
        int i = position;

        while (i < source.length() && i - position < 2 && STRING_PREFIXES.indexOf(source.charAt(i)) >= 0) {
            i++;
        }

        return i < source.length() && isQuote(source.charAt(i));
    }

    private Token readString() {
        int start = position;

        while (!isQuote(source.charAt(position))) {
            position++;
        }

        char quote = source.charAt(position);
        var tripleQuote = String.valueOf(quote).repeat(3);
        boolean triple = source.startsWith(tripleQuote, position);
        position += triple ? 3 : 1;

        while (position < source.length()) {
            char c = source.charAt(position);

            if (c == '\\') {
                position += 2;
                continue;
            }
            if (triple && source.startsWith(tripleQuote, position)) {
                position += 3;
                return Token.string(source.substring(start, position));
            }
            if (!triple && c == quote) {
                position++;
                return Token.string(source.substring(start, position));
            }
            if (!triple && c == '\n') {
                break;
            }
            position++;
        }

        throw ReflowException.tokenizeFailed(start + 1, "unterminated string literal");
    }

    private Token readNumber() {
        int start = position;
        boolean hex = source.startsWith("0x", position) || source.startsWith("0X", position);

        while (position < source.length()) {
            char c = source.charAt(position);
            boolean exponentSign = (c == '+' || c == '-')
                                   && !hex
                                   && position > start
                                   && (source.charAt(position - 1) == 'e' || source.charAt(position - 1) == 'E');

            if (!Character.isLetterOrDigit(c) && c != '_' && c != '.' && !exponentSign) {
                break;
            }
            position++;
        }

        return Token.number(source.substring(start, position));
    }

    private Token readName() {
        int start = position;

        while (position < source.length() && isNamePart(source.charAt(position))) {
            position++;
        }

        return Token.name(source.substring(start, position));
    }

    private Token readOperator() {
        for (var operator : OPERATORS) {
            if (source.startsWith(operator, position)) {
                position += operator.length();
                return Token.punctuation(operator);
            }
        }

        char c = source.charAt(position);

        if (SINGLE_OPERATORS.indexOf(c) < 0) {
            throw ReflowException.tokenizeFailed(position + 1, "unexpected character '" + c + "'");
        }
        position++;
        return Token.punctuation(String.valueOf(c));
    }

    private boolean nextIsDigit() {
        return position + 1 < source.length() && Character.isDigit(source.charAt(position + 1));
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
