package io.github.manjago.arbor.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Arbor CLI - symbolic regression by genetic programming.
 *
 * Usage:
 *   arbor run [options]   - Evolve an expression for a fitness case file
 *   arbor info            - Show version, default config and symbols
 */
@Command(
    name = "arbor",
    description = "Symbolic regression by tree-based genetic programming",
    mixinStandardHelpOptions = true,
    version = "Arbor 1.0.0",
    subcommands = {
        RunCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class ArborCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ArborCli()).execute(args);
        System.exit(exitCode);
    }
}
