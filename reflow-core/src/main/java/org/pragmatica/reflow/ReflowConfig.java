package org.pragmatica.reflow;

import java.util.Properties;

/**
 * Configuration for the line reflow.
 *
 * @param maxLineLength maximum width of an output line
 * @param indentSize    columns added to the indentation of continuation lines
 */
public record ReflowConfig(int maxLineLength, int indentSize) {

    public static final String MAX_LINE_LENGTH_KEY = "max-line-length";
    public static final String INDENT_SIZE_KEY = "indent-size";

    /**
     * Default configuration: 79 columns, 4 space indentation.
     */
    public static final ReflowConfig DEFAULT = new ReflowConfig(79, 4);

    public ReflowConfig {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("max line length must be positive, got " + maxLineLength);
        }
        if (indentSize < 0) {
            throw new IllegalArgumentException("indent size must not be negative, got " + indentSize);
        }
    }

    /**
     * Factory method for default config.
     */
    public static ReflowConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Read the configuration from properties, falling back to defaults for missing keys.
     *
     * @throws IllegalArgumentException when a value is not a valid number
     */
    public static ReflowConfig fromProperties(Properties properties) {
        return new ReflowConfig(intProperty(properties, MAX_LINE_LENGTH_KEY, DEFAULT.maxLineLength()),
                                intProperty(properties, INDENT_SIZE_KEY, DEFAULT.indentSize()));
    }

    public ReflowConfig withMaxLineLength(int maxLineLength) {
        return new ReflowConfig(maxLineLength, indentSize);
    }

    public ReflowConfig withIndentSize(int indentSize) {
        return new ReflowConfig(maxLineLength, indentSize);
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
        var value = properties.getProperty(key);

        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + value, e);
        }
    }
}
