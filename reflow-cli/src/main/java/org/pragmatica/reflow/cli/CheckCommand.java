package org.pragmatica.reflow.cli;

import org.pragmatica.reflow.LineReflower;
import org.pragmatica.reflow.ReflowException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Check command - verify that a line is already in reflowed form (for CI).
 */
@Command(
        name = "check",
        description = "Check that a logical line is already reflowed",
        mixinStandardHelpOptions = true
)
public class CheckCommand implements Callable<Integer> {

    @Mixin
    ReflowOptions options;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        try {
            var reflower = LineReflower.lineReflower(options.config());
            var text = options.indentation() + options.text(System.in).stripTrailing() + "\n";

            if (reflower.isReflowed(text, options.indentation())) {
                spec.commandLine().getOut().println("Line is reflowed");
                return 0;
            }

            spec.commandLine().getOut().print("Line needs reflow, expected:\n" + reflower.reflow(text, options.indentation()));
            return 1;
        } catch (ReflowException | IllegalArgumentException | IOException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
