package io.github.manjago.evoformula.cli;

import com.typesafe.config.ConfigException;
import io.github.manjago.evoformula.config.SearchConfig;
import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.engine.EpochStats;
import io.github.manjago.evoformula.engine.Evolution;
import io.github.manjago.evoformula.engine.EvolutionListener;
import io.github.manjago.evoformula.engine.PopulationCollapseException;
import io.github.manjago.evoformula.engine.Scored;
import io.github.manjago.evoformula.engine.ScoringException;
import io.github.manjago.evoformula.expr.Expression;
import io.github.manjago.evoformula.expr.ExpressionParser;
import io.github.manjago.evoformula.expr.Expressions;
import io.github.manjago.evoformula.fitness.FitnessFunction;
import io.github.manjago.evoformula.fitness.FitnessFunctions;
import io.github.manjago.evoformula.genetic.ExpressionBreeder;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Search for an expression approximating a target.
 *
 * Examples:
 *   evoformula search -t "x ^ 2"                        # Run with defaults
 *   evoformula search -t "sin(x) * x" -e 500 -p 200     # Longer, larger search
 *   evoformula search -t "erf(x)" --fitness correlation # Shape match only
 *   evoformula search -t "x ^ 2" --config my.conf       # Use custom config
 */
@Command(
    name = "search",
    description = "Search for a closed-form approximation of a target expression",
    mixinStandardHelpOptions = true
)
public class SearchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SearchCommand.class);

    @Option(names = {"-t", "--target"}, required = true, description = "Target expression, e.g. \"sin(x) * x\"")
    private String target;

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-e", "--epochs"}, description = "Number of epochs")
    private Integer epochs;

    @Option(names = {"-p", "--population"}, description = "Population size")
    private Integer population;

    @Option(names = {"--seed-expr"}, description = "Candidate injected into the initial population")
    private String seedExpression;

    @Option(names = {"--fitness"}, description = "Fitness function: ${COMPLETION-CANDIDATES}")
    private FitnessFunctions fitness;

    @Option(names = {"--threads"}, description = "Scoring threads")
    private Integer threads;

    @Option(names = {"--seed"}, description = "Random seed (0 = from clock)")
    private Long seed;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (print only the best expression)")
    private boolean quiet;

    @Override
    public Integer call() {
        SearchConfig config;
        Expression targetExpression;
        Expression seedCandidate;
        try {
            config = buildConfig();
            ExpressionParser parser = new ExpressionParser();
            targetExpression = parser.parse(target);
            seedCandidate = seedExpression != null ? parser.parse(seedExpression) : null;
            checkVariables(config, targetExpression, "target");
            if (seedCandidate != null) {
                checkVariables(config, seedCandidate, "seed expression");
            }
        } catch (ExpressionParser.ParseException e) {
            System.err.println("❌ Parse error: " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException | ConfigException e) {
            System.err.println("❌ Configuration error: " + e.getMessage());
            return 2;
        }

        if (config.objective() != config.fitness().objective()) {
            log.warn("Objective {} is the reverse of the natural direction of {} ({})",
                    config.objective(), config.fitness(), config.fitness().objective());
        }

        if (!quiet) {
            printBanner();
            printConfig(config, targetExpression);
        }

        FitnessFunction function = config.fitness().against(
                targetExpression, config.domain(), config.primaryVariable());
        ExpressionBreeder breeder = new ExpressionBreeder(config.treeSettings(), function);
        SearchRng rng = SearchRng.fromConfigSeed(config.seed());

        long startTime = System.currentTimeMillis();
        try (Evolution<Expression> evolution = new Evolution<>(breeder, config.evolutionSettings(), rng)) {
            // Setup graceful shutdown
            Thread hook = new Thread(() -> {
                if (evolution.isRunning()) {
                    System.out.println("\n⏸️  Stopping after the current epoch...");
                    evolution.stop();
                }
            });
            Runtime.getRuntime().addShutdownHook(hook);

            if (!quiet) {
                evolution.setListener(new ConsoleProgressListener(config.reportInterval()));
                System.out.println("▶️  Searching...\n");
            }

            try {
                evolution.initialize(seedCandidate);
                evolution.train(config.epochs());
            } finally {
                removeHook(hook);
            }

            Scored<Expression> best = evolution.best();
            if (quiet) {
                System.out.println(best.candidate());
            } else {
                printFinalReport(best, evolution.getEpoch(), rng.getInitialSeed(),
                        System.currentTimeMillis() - startTime);
            }
            return 0;

        } catch (PopulationCollapseException | ScoringException e) {
            log.error("Search aborted", e);
            System.err.println("❌ Search aborted: " + e.getMessage());
            return 1;
        }
    }

    private SearchConfig buildConfig() {
        SearchConfig base = configFile != null ? SearchConfig.fromFile(configFile) : SearchConfig.defaults();
        SearchConfig.Builder builder = base.toBuilder();

        // Override from CLI options
        if (epochs != null) builder.epochs(epochs);
        if (population != null) builder.populationSize(population);
        if (fitness != null) builder.fitness(fitness).objective(fitness.objective());
        if (threads != null) builder.threads(threads);
        if (seed != null) builder.seed(seed);

        return builder.build();
    }

    /**
     * Fitness sweeps bind only the primary variable, so nothing else may appear.
     */
    private static void checkVariables(SearchConfig config, Expression expression, String what) {
        Set<String> names = Expressions.variables(expression);
        names.remove(config.primaryVariable());
        if (!names.isEmpty()) {
            throw new IllegalArgumentException("The " + what + " uses variables " + names
                    + " but the search sweeps only '" + config.primaryVariable() + "'");
        }
        if (config.variables().size() > 1) {
            throw new IllegalArgumentException("tree.variables must hold a single variable for search: "
                    + config.variables());
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM is shutting down, hook stays registered");
        }
    }

    private void printBanner() {
        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║             EVOFORMULA                ║");
        System.out.println("║   Closed-form Expression Search       ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();
    }

    private void printConfig(SearchConfig config, Expression targetExpression) {
        System.out.println("Configuration:");
        System.out.printf("  Target:          %s%n", targetExpression);
        System.out.printf("  Fitness:         %s (%s)%n", config.fitness(), config.objective());
        System.out.printf("  Domain:          %s%n", config.domain());
        System.out.printf("  Population:      %,d%n", config.populationSize());
        System.out.printf("  Epochs:          %,d%n", config.epochs());
        System.out.printf("  Max depth:       %d%n", config.maxDepth());
        System.out.printf("  Threads:         %d%n", config.threads());
        System.out.println();
    }

    private void printFinalReport(Scored<Expression> best, int epochCount, long usedSeed, long elapsedMs) {
        System.out.println();
        System.out.println("═══════════════════════════════════════");
        System.out.println("           SEARCH COMPLETE             ");
        System.out.println("═══════════════════════════════════════");
        System.out.println();
        System.out.printf("🏆 Best:   %s%n", best.candidate());
        System.out.printf("   Score:  %.6g%n", best.score());
        System.out.printf("   Depth:  %d  |  Size: %d%n",
                Expressions.depth(best.candidate()), Expressions.size(best.candidate()));
        System.out.println();
        System.out.printf("⏱️  Time: %s  |  Epochs: %,d  |  Seed: %d%n",
                formatDuration(elapsedMs), epochCount, usedSeed);
        System.out.println();
        System.out.println("═══════════════════════════════════════");
    }

    private String formatDuration(long ms) {
        if (ms < 1000) {
            return ms + " ms";
        } else if (ms < 60_000) {
            return String.format("%.1f sec", ms / 1000.0);
        } else {
            long minutes = ms / 60_000;
            long seconds = (ms % 60_000) / 1000;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    /**
     * Prints one line every {@code interval} epochs.
     */
    private static class ConsoleProgressListener implements EvolutionListener<Expression> {
        private final int interval;
        private @Nullable String lastBest;

        ConsoleProgressListener(int interval) {
            this.interval = interval;
        }

        @Override
        public void onEpoch(EpochStats stats, Scored<Expression> best) {
            String text = best.candidate().toString();
            boolean improved = !text.equals(lastBest);
            lastBest = text;
            if (stats.epoch() % interval != 0 && !improved) {
                return;
            }
            System.out.printf("%s Epoch %,6d  |  best %.6g  |  mean %.4g  |  dup %4.1f%%  |  %s%n",
                    improved ? "⭐" : "  ",
                    stats.epoch(),
                    stats.bestScore(),
                    stats.meanScore(),
                    stats.duplicateRate() * 100,
                    text);
        }
    }
}
