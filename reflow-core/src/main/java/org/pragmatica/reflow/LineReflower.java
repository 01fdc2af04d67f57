package org.pragmatica.reflow;

import org.pragmatica.reflow.layout.LayoutBuilder;
import org.pragmatica.reflow.token.LineTokenizer;
import org.pragmatica.reflow.tree.Element;
import org.pragmatica.reflow.tree.Group;
import org.pragmatica.reflow.tree.TokenTreeParser;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reflows one logical line of Python code to fit the configured line length.
 *
 * Two layouts are available:
 * - prefix line: the first group starts on the first line and wrapped
 *   contents align one column past its opening bracket
 * - break after open bracket: group contents start on a new line indented
 *   by the continued indent
 *
 * Continuation lines are indented by one indent step, two for a {@code def}.
 */
public final class LineReflower {
    private static final Logger log = LoggerFactory.getLogger(LineReflower.class);

    private final ReflowConfig config;

    private LineReflower(ReflowConfig config) {
        this.config = config;
    }

    /**
     * Factory method for creating a reflower with default config.
     */
    public static LineReflower lineReflower() {
        return new LineReflower(ReflowConfig.defaultConfig());
    }

    /**
     * Factory method for creating a reflower with custom config.
     */
    public static LineReflower lineReflower(ReflowConfig config) {
        return new LineReflower(config);
    }

    public ReflowConfig config() {
        return config;
    }

    /**
     * Reflow a logical line given as source text, starting on the prefix line.
     *
     * @param logicalLine source text of the logical line, without indentation
     * @param indentation indentation of the first output line
     * @return reflowed text ending with a single newline
     * @throws ReflowException when the text cannot be tokenized or its brackets do not pair up
     */
    public String reflow(String logicalLine, String indentation) {
        return layout(parse(logicalLine), indentation, true);
    }

    /**
     * Reflow an already grouped token tree, starting on the prefix line.
     */
    public String reflow(List<Element> elements, String indentation) {
        return layout(elements, indentation, true);
    }

    /**
     * Produce the layout of the given kind, or nothing when breaking after the
     * opening bracket would align the contents exactly under the continuation
     * indent (e.g. {@code foo(} with a four space indent).
     */
    public Optional<String> candidate(List<Element> elements, String indentation, boolean startOnPrefixLine) {
        if (!startOnPrefixLine && alignsWithContinuedIndent(elements, indentation)) {
            log.debug("Rejected break-after-bracket layout for '{}'", elements.get(0).text());
            return Optional.empty();
        }
        return Optional.of(layout(elements, indentation, startOnPrefixLine));
    }

    public Optional<String> candidate(String logicalLine, String indentation, boolean startOnPrefixLine) {
        return candidate(parse(logicalLine), indentation, startOnPrefixLine);
    }

    /**
     * Check whether text is already in reflowed form: indented, laid out and
     * terminated exactly as {@link #reflow(String, String)} would produce it.
     */
    public boolean isReflowed(String text, String indentation) {
        return reflow(text, indentation).equals(text);
    }

    private static List<Element> parse(String logicalLine) {
        return TokenTreeParser.parse(LineTokenizer.tokenize(logicalLine));
    }

    private String layout(List<Element> elements, String indentation, boolean startOnPrefixLine) {
        var continuedIndent = continuedIndent(elements, indentation);
        var builder = LayoutBuilder.layoutBuilder(config.maxLineLength());
        builder.addIndent(stripLeadingLineEnds(indentation).length());

        boolean alignFirstGroup = startOnPrefixLine;
        Element previous = null;

        for (var element : elements) {
            if (Reflower.requiresLineBreak(previous, element)) {
                builder.addLineBreak(continuedIndent);
            }
            builder.addSpaceIfNeeded(element.text(), true);

            var indent = continuedIndent;

            if (alignFirstGroup && element instanceof Group) {
                alignFirstGroup = false;
                indent = " ".repeat(builder.currentSize() + 1);
            }

            Reflower.reflow(element, builder, indent, !startOnPrefixLine);
            previous = element;
        }

        var text = builder.emit();
        log.debug("Reflowed {} elements into {} lines at width {}",
                  elements.size(),
                  text.lines().count(),
                  config.maxLineLength());
        return text;
    }

    private String continuedIndent(List<Element> elements, String indentation) {
        int steps = !elements.isEmpty() && "def".equals(elements.get(0).text()) ? 2 : 1;
        return indentation + " ".repeat(steps * config.indentSize());
    }

    private boolean alignsWithContinuedIndent(List<Element> elements, String indentation) {
        if (elements.size() < 2) {
            return false;
        }

        var first = elements.get(0);
        var secondText = elements.get(1).text();

        return secondText.startsWith("(")
               && indentation.length() + first.size() + 1 == continuedIndent(elements, indentation).length();
    }

    private static String stripLeadingLineEnds(String indentation) {
        int start = 0;

        while (start < indentation.length() && (indentation.charAt(start) == '\r' || indentation.charAt(start) == '\n')) {
            start++;
        }

        return indentation.substring(start);
    }
}
