package org.pragmatica.reflow.tree;

import org.pragmatica.reflow.ReflowException;
import org.pragmatica.reflow.token.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups a flat token list into a token tree by matching brackets.
 */
public final class TokenTreeParser {
    private final List<Token> tokens;
    private int index;

    private TokenTreeParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Build the top-level element sequence for the given tokens.
     *
     * @throws ReflowException.UnbalancedBrackets when a bracket is stray, mismatched or never closed
     */
    public static List<Element> parse(List<Token> tokens) {
        return new TokenTreeParser(tokens).run();
    }

    private List<Element> run() {
        var elements = new ArrayList<Element>();

        while (index < tokens.size()) {
            var text = tokens.get(index).text();
            var kind = GroupKind.openedBy(text);

            if (kind.isPresent()) {
                elements.add(parseGroup(kind.get()));
            } else if (GroupKind.isCloseBracket(text)) {
                throw ReflowException.unbalancedBrackets(index, "unexpected '" + text + "'");
            } else {
                elements.add(Atom.atom(tokens.get(index++)));
            }
        }

        return elements;
    }

    private Group parseGroup(GroupKind kind) {
        int openIndex = index;
        var children = new ArrayList<Element>();
        children.add(Atom.atom(tokens.get(index++)));

        while (index < tokens.size()) {
            var token = tokens.get(index);
            var nested = GroupKind.openedBy(token.text());

            if (nested.isPresent()) {
                children.add(parseGroup(nested.get()));
                continue;
            }

            children.add(Atom.atom(token));
            index++;

            if (kind.closeBracket().equals(token.text())) {
                return Group.group(kind, children);
            }
            if (GroupKind.isCloseBracket(token.text())) {
                throw ReflowException.unbalancedBrackets(index - 1,
                                                         "expected '" + kind.closeBracket() + "' but found '"
                                                         + token.text() + "'");
            }
        }

        throw ReflowException.unbalancedBrackets(openIndex, "'" + kind.openBracket() + "' is never closed");
    }
}
