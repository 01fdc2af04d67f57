package org.pragmatica.reflow.cli;

import org.pragmatica.reflow.ReflowConfig;

import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options shared by the reflow commands.
 */
public class ReflowOptions {
    private static final Logger log = LoggerFactory.getLogger(ReflowOptions.class);

    @Parameters(
            paramLabel = "<text>",
            description = "Logical line to reflow (read from stdin when omitted)",
            arity = "0..1"
    )
    String text;

    @Option(
            names = {"--max-line-length", "-l"},
            description = "Maximum line length (default: 79)"
    )
    Integer maxLineLength;

    @Option(
            names = {"--indent-size"},
            description = "Indent step for continuation lines (default: 4)"
    )
    Integer indentSize;

    @Option(
            names = {"--indent", "-i"},
            description = "Number of spaces the line is indented by",
            defaultValue = "0"
    )
    int indent;

    @Option(
            names = {"--config", "-c"},
            description = "Properties file with max-line-length and indent-size"
    )
    Path configFile;

    /**
     * Resolve the configuration: defaults, then the config file, then explicit options.
     */
    ReflowConfig config() throws IOException {
        var config = configFile == null ? ReflowConfig.defaultConfig() : loadConfig(configFile);

        if (maxLineLength != null) {
            config = config.withMaxLineLength(maxLineLength);
        }
        if (indentSize != null) {
            config = config.withIndentSize(indentSize);
        }
        return config;
    }

    /**
     * Indentation of the first output line.
     *
     * @throws IllegalArgumentException when {@code --indent} is negative
     */
    String indentation() {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative, got " + indent);
        }
        return " ".repeat(indent);
    }

    String text(InputStream stdin) throws IOException {
        return text != null ? text : new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static ReflowConfig loadConfig(Path file) throws IOException {
        var properties = new Properties();

        try (var reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        log.debug("Loaded reflow config from {}", file);
        return ReflowConfig.fromProperties(properties);
    }
}
