package org.pragmatica.reflow.cli;

import org.pragmatica.reflow.LineReflower;
import org.pragmatica.reflow.ReflowException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Line command - reflow one logical line and print the result.
 */
@Command(
        name = "line",
        description = "Reflow a logical line to fit the maximum line length",
        mixinStandardHelpOptions = true
)
public class LineCommand implements Callable<Integer> {
    static final int EXIT_REJECTED = 2;

    @Mixin
    ReflowOptions options;

    @Option(
            names = {"--no-prefix-line"},
            description = "Start group contents on a new line after the opening bracket"
    )
    boolean breakAfterOpenBracket;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        try {
            var reflower = LineReflower.lineReflower(options.config());
            var text = options.text(System.in);
            var result = reflower.candidate(text, options.indentation(), !breakAfterOpenBracket);

            if (result.isEmpty()) {
                spec.commandLine().getErr().println("Layout rejected: contents would align with the continuation indent");
                return EXIT_REJECTED;
            }

            spec.commandLine().getOut().print(result.get());
            return 0;
        } catch (ReflowException | IllegalArgumentException | IOException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
