package org.pragmatica.reflow.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Entry point of the reflow command line tool.
 */
@Command(
        name = "reflow",
        description = "Reflow logical lines of Python code to a maximum line length",
        mixinStandardHelpOptions = true,
        version = "reflow 0.1.0",
        subcommands = {LineCommand.class, CheckCommand.class}
)
public class ReflowCli implements Runnable {

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new ReflowCli());
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
