package org.pragmatica.reflow.layout;

import org.pragmatica.reflow.token.Token;

/**
 * Unit of the layout stream: a real token or one of the output-shaping
 * pseudo units (space, indent, line break).
 */
public sealed interface LayoutUnit {
    LayoutUnit SPACE = new Space();
    LayoutUnit LINE_BREAK = new LineBreak();

    /**
     * Text this unit contributes to the emitted output.
     */
    String text();

    /**
     * Width this unit occupies on the current line.
     */
    int size();

    default boolean isWhitespace() {
        return !(this instanceof TokenUnit);
    }

    default boolean isLineStart() {
        return this instanceof LineBreak || this instanceof Indent;
    }

    record TokenUnit(Token token) implements LayoutUnit {
        @Override
        public String text() {
            return token.text();
        }

        @Override
        public int size() {
            return token.size();
        }
    }

    record Space() implements LayoutUnit {
        @Override
        public String text() {
            return " ";
        }

        @Override
        public int size() {
            return 1;
        }
    }

    record Indent(int width) implements LayoutUnit {
        @Override
        public String text() {
            return " ".repeat(width);
        }

        @Override
        public int size() {
            return width;
        }
    }

    record LineBreak() implements LayoutUnit {
        @Override
        public String text() {
            return "\n";
        }

        @Override
        public int size() {
            return 0;
        }
    }
}
