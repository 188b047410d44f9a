package io.github.manjago.evoformula.cli;

import io.github.manjago.evoformula.config.SearchConfig;
import io.github.manjago.evoformula.expr.BinaryKind;
import io.github.manjago.evoformula.expr.NamedConstant;
import io.github.manjago.evoformula.expr.UnaryKind;
import picocli.CommandLine.Command;

import java.util.Arrays;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Show information about EvoFormula.
 */
@Command(
    name = "info",
    description = "Show version, operators and default configuration",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║             EVOFORMULA                ║");
        System.out.println("║   Closed-form Expression Search       ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Default Configuration:");
        System.out.println(SearchConfig.defaults());

        System.out.println("Operators:");
        System.out.println("  Unary:     " + Arrays.stream(UnaryKind.values())
                .map(UnaryKind::getSymbol).collect(Collectors.joining(", ")));
        System.out.println("  Binary:    " + Arrays.stream(BinaryKind.values())
                .map(BinaryKind::getSymbol).collect(Collectors.joining(" ")));
        System.out.println("  Constants: " + Arrays.stream(NamedConstant.values())
                .map(NamedConstant::getSymbol).collect(Collectors.joining(", ")));
        System.out.println();

        return 0;
    }
}
