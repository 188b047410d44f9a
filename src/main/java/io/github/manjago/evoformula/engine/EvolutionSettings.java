package io.github.manjago.evoformula.engine;

/**
 * Engine parameters.
 *
 * @param populationSize   exact size of the population after every epoch
 * @param elites           K: elites kept unchanged, and size of each elite-vs-random crossover batch
 * @param fresh            brand-new random candidates per epoch
 * @param crossovers       random-vs-random crossovers per epoch
 * @param backfillAttempts rejected backfill candidates tolerated before the run is aborted
 * @param threads          scoring worker pool size
 * @param objective        comparison direction
 * @param reportInterval   epochs between INFO progress lines
 */
public record EvolutionSettings(
    int populationSize,
    int elites,
    int fresh,
    int crossovers,
    int backfillAttempts,
    int threads,
    Objective objective,
    int reportInterval
) {

    public EvolutionSettings {
        if (populationSize < 1) {
            throw new IllegalArgumentException("populationSize must be at least 1: " + populationSize);
        }
        if (elites < 0 || elites > populationSize) {
            throw new IllegalArgumentException("elites must be in [0, populationSize]: " + elites);
        }
        if (fresh < 0 || crossovers < 0) {
            throw new IllegalArgumentException("fresh and crossovers must not be negative");
        }
        if (backfillAttempts < 0) {
            throw new IllegalArgumentException("backfillAttempts must not be negative: " + backfillAttempts);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1: " + threads);
        }
        if (objective == null) {
            throw new IllegalArgumentException("objective is required");
        }
        if (reportInterval < 1) {
            throw new IllegalArgumentException("reportInterval must be at least 1: " + reportInterval);
        }
    }

    /**
     * Defaults scaled to the population: K = 10%, fresh = 10%, crossovers = size.
     */
    public static EvolutionSettings of(int populationSize, Objective objective) {
        int tenth = Math.max(1, populationSize / 10);
        return new EvolutionSettings(populationSize, Math.min(tenth, populationSize), tenth, populationSize,
                1000, Runtime.getRuntime().availableProcessors(), objective, 10);
    }

    public EvolutionSettings withThreads(int count) {
        return new EvolutionSettings(populationSize, elites, fresh, crossovers, backfillAttempts,
                count, objective, reportInterval);
    }
}
