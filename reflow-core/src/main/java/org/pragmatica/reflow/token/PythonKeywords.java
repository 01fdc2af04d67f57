package org.pragmatica.reflow.token;

import java.util.Set;

/**
 * Reserved words of the Python language.
 */
public final class PythonKeywords {
    private static final Set<String> KEYWORDS = Set.of("False", "None", "True", "and", "as", "assert", "async",
                                                       "await", "break", "class", "continue", "def", "del",
                                                       "elif", "else", "except", "finally", "for", "from",
                                                       "global", "if", "import", "in", "is", "lambda",
                                                       "nonlocal", "not", "or", "pass", "raise", "return",
                                                       "try", "while", "with", "yield");

    private PythonKeywords() {}

    public static boolean isKeyword(String word) {
        return KEYWORDS.contains(word);
    }
}
