package io.github.manjago.evoformula.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.evoformula.engine.EvolutionSettings;
import io.github.manjago.evoformula.engine.Objective;
import io.github.manjago.evoformula.expr.BinaryKind;
import io.github.manjago.evoformula.expr.NamedConstant;
import io.github.manjago.evoformula.expr.UnaryKind;
import io.github.manjago.evoformula.fitness.Domain;
import io.github.manjago.evoformula.fitness.FitnessFunctions;
import io.github.manjago.evoformula.genetic.TreeSettings;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Configuration for a formula search.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 */
public record SearchConfig(
    // Population
    int populationSize,
    int elites,
    int fresh,
    int crossovers,
    int backfillAttempts,

    // Search
    int epochs,
    Objective objective,
    FitnessFunctions fitness,
    int threads,
    long seed,                // 0 = derive from clock

    // Trees
    int initialDepth,
    int maxDepth,
    double mutationChance,
    double constantRange,
    double jitter,
    List<String> variables,
    List<UnaryKind> unaryKinds,
    List<BinaryKind> binaryKinds,
    List<NamedConstant> namedConstants,

    // Sampled domain
    double domainLeft,
    double domainRight,
    double domainStep,

    // Reporting
    int reportInterval        // epochs between progress lines
) {

    public SearchConfig {
        variables = List.copyOf(variables);
        unaryKinds = List.copyOf(unaryKinds);
        binaryKinds = List.copyOf(binaryKinds);
        namedConstants = List.copyOf(namedConstants);

        if (epochs < 0) {
            throw new IllegalArgumentException("search.epochs must not be negative: " + epochs);
        }
        if (variables.isEmpty()) {
            throw new IllegalArgumentException("tree.variables must name at least one variable");
        }
        // Delegate the remaining checks to the component settings.
        evolutionSettings(populationSize, elites, fresh, crossovers, backfillAttempts,
                threads, objective, reportInterval);
        new TreeSettings(variables, unaryKinds, binaryKinds, namedConstants,
                constantRange, jitter, initialDepth, maxDepth, mutationChance);
        new Domain(domainLeft, domainRight, domainStep);
    }

    /**
     * Load default configuration.
     */
    public static SearchConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static SearchConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static SearchConfig fromConfig(Config config) {
        Config c = config.getConfig("evoformula");

        return new SearchConfig(
            c.getInt("population.size"),
            c.getInt("population.elites"),
            c.getInt("population.fresh"),
            c.getInt("population.crossovers"),
            c.getInt("population.backfill-attempts"),
            c.getInt("search.epochs"),
            Objective.fromString(c.getString("search.objective")),
            FitnessFunctions.fromString(c.getString("search.fitness")),
            c.getInt("search.threads"),
            c.getLong("search.seed"),
            c.getInt("tree.initial-depth"),
            c.getInt("tree.max-depth"),
            c.getDouble("tree.mutation-chance"),
            c.getDouble("tree.constant-range"),
            c.getDouble("tree.jitter"),
            c.getStringList("tree.variables"),
            lookup(c.getStringList("tree.unary"), UnaryKind::fromSymbol, "tree.unary"),
            lookup(c.getStringList("tree.binary"), BinaryKind::fromSymbol, "tree.binary"),
            lookup(c.getStringList("tree.named-constants"), NamedConstant::fromSymbol, "tree.named-constants"),
            c.getDouble("domain.left"),
            c.getDouble("domain.right"),
            c.getDouble("domain.step"),
            c.getInt("reporting.interval")
        );
    }

    private static <K> List<K> lookup(List<String> symbols, Function<String, K> resolver, String key) {
        List<K> kinds = new ArrayList<>(symbols.size());
        for (String symbol : symbols) {
            K kind = resolver.apply(symbol);
            if (kind == null) {
                throw new IllegalArgumentException("Unknown symbol '" + symbol + "' in " + key);
            }
            kinds.add(kind);
        }
        return kinds;
    }

    // ========== Component settings ==========

    public EvolutionSettings evolutionSettings() {
        return evolutionSettings(populationSize, elites, fresh, crossovers, backfillAttempts,
                threads, objective, reportInterval);
    }

    private static EvolutionSettings evolutionSettings(int populationSize, int elites, int fresh, int crossovers,
                                                       int backfillAttempts, int threads, Objective objective,
                                                       int reportInterval) {
        return new EvolutionSettings(populationSize, elites, fresh, crossovers, backfillAttempts,
                threads, objective, reportInterval);
    }

    public TreeSettings treeSettings() {
        return new TreeSettings(variables, unaryKinds, binaryKinds, namedConstants,
                constantRange, jitter, initialDepth, maxDepth, mutationChance);
    }

    public Domain domain() {
        return new Domain(domainLeft, domainRight, domainStep);
    }

    /**
     * The variable fitness sweeps run over.
     */
    public String primaryVariable() {
        return variables.get(0);
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder initialised with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .populationSize(populationSize)
                .elites(elites)
                .fresh(fresh)
                .crossovers(crossovers)
                .backfillAttempts(backfillAttempts)
                .epochs(epochs)
                .objective(objective)
                .fitness(fitness)
                .threads(threads)
                .seed(seed)
                .initialDepth(initialDepth)
                .maxDepth(maxDepth)
                .mutationChance(mutationChance)
                .constantRange(constantRange)
                .jitter(jitter)
                .variables(variables)
                .unaryKinds(unaryKinds)
                .binaryKinds(binaryKinds)
                .namedConstants(namedConstants)
                .domain(domainLeft, domainRight, domainStep)
                .reportInterval(reportInterval);
    }

    public static class Builder {
        private int populationSize = 50;
        private int elites = 5;
        private int fresh = 5;
        private int crossovers = 50;
        private int backfillAttempts = 1000;
        private int epochs = 100;
        private Objective objective = Objective.MINIMIZE;
        private FitnessFunctions fitness = FitnessFunctions.MSE;
        private int threads = 4;
        private long seed = 0;
        private int initialDepth = 2;
        private int maxDepth = 6;
        private double mutationChance = 0.05;
        private double constantRange = 10.0;
        private double jitter = 0.2;
        private List<String> variables = List.of("x");
        private List<UnaryKind> unaryKinds = List.of(UnaryKind.SIN, UnaryKind.EXP, UnaryKind.SQRT, UnaryKind.LN);
        private List<BinaryKind> binaryKinds = List.of(BinaryKind.values());
        private List<NamedConstant> namedConstants = List.of(NamedConstant.values());
        private double domainLeft = 0;
        private double domainRight = 10;
        private double domainStep = 0.01;
        private int reportInterval = 10;

        public Builder populationSize(int size) { this.populationSize = size; return this; }
        public Builder elites(int count) { this.elites = count; return this; }
        public Builder fresh(int count) { this.fresh = count; return this; }
        public Builder crossovers(int count) { this.crossovers = count; return this; }
        public Builder backfillAttempts(int attempts) { this.backfillAttempts = attempts; return this; }
        public Builder epochs(int count) { this.epochs = count; return this; }
        public Builder objective(Objective objective) { this.objective = objective; return this; }
        public Builder fitness(FitnessFunctions fitness) { this.fitness = fitness; return this; }
        public Builder threads(int count) { this.threads = count; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder initialDepth(int depth) { this.initialDepth = depth; return this; }
        public Builder maxDepth(int depth) { this.maxDepth = depth; return this; }
        public Builder mutationChance(double chance) { this.mutationChance = chance; return this; }
        public Builder constantRange(double range) { this.constantRange = range; return this; }
        public Builder jitter(double width) { this.jitter = width; return this; }
        public Builder variables(List<String> names) { this.variables = names; return this; }
        public Builder unaryKinds(List<UnaryKind> kinds) { this.unaryKinds = kinds; return this; }
        public Builder binaryKinds(List<BinaryKind> kinds) { this.binaryKinds = kinds; return this; }
        public Builder namedConstants(List<NamedConstant> constants) { this.namedConstants = constants; return this; }
        public Builder reportInterval(int interval) { this.reportInterval = interval; return this; }

        public Builder domain(double left, double right, double step) {
            this.domainLeft = left;
            this.domainRight = right;
            this.domainStep = step;
            return this;
        }

        public SearchConfig build() {
            return new SearchConfig(
                populationSize, elites, fresh, crossovers, backfillAttempts,
                epochs, objective, fitness, threads, seed,
                initialDepth, maxDepth, mutationChance, constantRange, jitter,
                variables, unaryKinds, binaryKinds, namedConstants,
                domainLeft, domainRight, domainStep, reportInterval
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            SearchConfig:
              population.size:        %,d
              population.elites:      %d
              population.fresh:       %d
              population.crossovers:  %d
              search.epochs:          %,d
              search.objective:       %s
              search.fitness:         %s
              search.threads:         %d
              search.seed:            %s
              tree.initial-depth:     %d
              tree.max-depth:         %d
              tree.mutation-chance:   %.4f (%.2f%%)
              tree.constant-range:    %s
              tree.variables:         %s
              tree.unary:             %s
              tree.binary:            %s
              tree.named-constants:   %s
              domain:                 [%s, %s) step %s
              reporting.interval:     %,d epochs
            """,
            populationSize,
            elites,
            fresh,
            crossovers,
            epochs,
            objective,
            fitness,
            threads,
            seed == 0 ? "random" : String.valueOf(seed),
            initialDepth,
            maxDepth,
            mutationChance, mutationChance * 100,
            constantRange,
            variables,
            symbols(unaryKinds, UnaryKind::getSymbol),
            symbols(binaryKinds, BinaryKind::getSymbol),
            symbols(namedConstants, NamedConstant::getSymbol),
            domainLeft, domainRight, domainStep,
            reportInterval
        );
    }

    private static <K> List<String> symbols(List<K> kinds, Function<K, String> symbol) {
        List<String> result = new ArrayList<>(kinds.size());
        for (K kind : kinds) {
            result.add(symbol.apply(kind));
        }
        return result;
    }
}
