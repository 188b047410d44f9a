package io.github.manjago.evoformula.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * EvoFormula CLI - evolutionary search for closed-form expressions.
 *
 * Usage:
 *   evoformula search -t "sin(x) * x"   - Search for an approximation of a target
 *   evoformula eval "x ^ 2" -x x=3      - Evaluate an expression
 *   evoformula info                     - Show version and default config
 */
@Command(
    name = "evoformula",
    description = "Genetic-programming search for closed-form expressions",
    mixinStandardHelpOptions = true,
    version = "EvoFormula 1.0.0",
    subcommands = {
        SearchCommand.class,
        EvalCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class EvoFormulaCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    /**
     * Command line with the shared settings, for {@link #main} and tests.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new EvoFormulaCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
