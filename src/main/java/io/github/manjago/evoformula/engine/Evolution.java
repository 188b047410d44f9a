package io.github.manjago.evoformula.engine;

import io.github.manjago.evoformula.core.SearchRng;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Generational evolutionary search over any {@link Breeder} type.
 * <p>
 * The population is a list of exactly {@code populationSize} scored candidates,
 * best first. Each epoch:
 * <ol>
 *   <li>builds a candidate pool: the K elites unchanged, K elite-vs-random
 *       crossovers, a mutated copy of every member, fresh random candidates,
 *       another K elite-vs-random crossovers and a batch of random-vs-random
 *       crossovers;</li>
 *   <li>scores the new pool members on the worker pool and waits for all of them;</li>
 *   <li>drops structural duplicates, keeping the first occurrence;</li>
 *   <li>sorts and truncates to the population size, or backfills with mutants
 *       of the previous population (best first) when too few survived;</li>
 *   <li>notifies the listener with the new best candidate.</li>
 * </ol>
 * Candidates are generated on the calling thread only; just scoring runs in
 * parallel. The population list is replaced wholesale between epochs.
 */
public class Evolution<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Evolution.class);

    private final Breeder<T> breeder;
    private final EvolutionSettings settings;
    private final SearchRng rng;
    private final ParallelScorer<T> scorer;
    private final Comparator<Scored<T>> order;

    private volatile List<Scored<T>> population = List.of();
    private int epoch = 0;

    // Control
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private EvolutionListener<T> listener = EvolutionListener.noop();

    public Evolution(Breeder<T> breeder, EvolutionSettings settings, SearchRng rng) {
        this.breeder = breeder;
        this.settings = settings;
        this.rng = rng;
        this.scorer = new ParallelScorer<>(breeder::score, settings.threads());
        this.order = settings.objective().comparator();

        log.info("Evolution created (seed: {}, population: {}, threads: {}, objective: {})",
                rng.getInitialSeed(), settings.populationSize(), settings.threads(), settings.objective());
    }

    /**
     * Set event listener for search events.
     */
    public void setListener(EvolutionListener<T> listener) {
        this.listener = listener != null ? listener : EvolutionListener.noop();
    }

    /**
     * Create and score the initial population: the seed candidate (if any)
     * plus fresh random candidates up to the population size.
     *
     * @param seed candidate to inject, or null
     */
    public void initialize(@Nullable T seed) {
        int size = settings.populationSize();
        List<T> initial = new ArrayList<>(size);
        if (seed != null) {
            initial.add(seed);
        }
        while (initial.size() < size) {
            initial.add(breeder.newInstance(rng));
        }

        List<Scored<T>> scored = new ArrayList<>(scorer.score(initial));
        scored.sort(order);
        population = List.copyOf(scored);
        epoch = 0;

        log.info("Initial population of {} scored, best {}", size, population.get(0));
    }

    /**
     * Run epochs. Initialises a random population first if needed.
     * Returns when all epochs are done or stop is requested.
     *
     * @param epochs number of epochs to run
     */
    public void train(int epochs) {
        if (running.getAndSet(true)) {
            log.warn("Evolution already running");
            return;
        }
        stopRequested.set(false);

        long startTime = System.currentTimeMillis();
        int done = 0;
        try {
            if (population.isEmpty()) {
                initialize(null);
            }
            log.info("Starting search for {} epochs", epochs);

            while (done < epochs && !stopRequested.get()) {
                runEpoch();
                done++;
            }
        } finally {
            running.set(false);
            long elapsed = System.currentTimeMillis() - startTime;
            log.info("Search stopped after {} epochs ({} ms)", done, elapsed);
        }
        listener.onFinish(best(), epoch);
    }

    /**
     * Request graceful stop after the current epoch.
     */
    public void stop() {
        log.info("Stop requested");
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Run one epoch.
     */
    EpochStats runEpoch() {
        long start = System.currentTimeMillis();
        List<Scored<T>> previous = population;
        if (previous.isEmpty()) {
            throw new IllegalStateException("Population not initialized");
        }
        int size = settings.populationSize();

        List<Scored<T>> pool = new ArrayList<>();
        List<T> pending = breed(previous, pool);
        pool.addAll(scorer.score(pending));
        int poolSize = pool.size();

        List<Scored<T>> unique = deduplicate(pool);
        int uniqueCount = unique.size();

        int backfilled = 0;
        if (unique.size() < size) {
            backfilled = backfill(unique, previous);
        }

        unique.sort(order);
        List<Scored<T>> next = List.copyOf(unique.subList(0, Math.min(size, unique.size())));
        if (next.size() != size) {
            throw new PopulationCollapseException(size, next.size(), 0);
        }

        population = next;
        epoch++;

        EpochStats stats = new EpochStats(epoch, next.get(0).score(), meanScore(next),
                poolSize, uniqueCount, backfilled, System.currentTimeMillis() - start);
        report(stats);
        listener.onEpoch(stats, next.get(0));
        return stats;
    }

    /**
     * Build the candidate pool. Elites go straight into {@code scored} with
     * their known score; everything else is returned for scoring.
     */
    private List<T> breed(List<Scored<T>> previous, List<Scored<T>> scored) {
        int elites = settings.elites();
        List<T> pending = new ArrayList<>();

        for (int i = 0; i < elites; i++) {
            scored.add(previous.get(i));
        }
        for (int i = 0; i < elites; i++) {
            pending.add(breeder.cross(previous.get(i).candidate(), randomMember(previous), rng));
        }
        for (Scored<T> member : previous) {
            pending.add(breeder.mutate(member.candidate(), rng));
        }
        for (int i = 0; i < settings.fresh(); i++) {
            pending.add(breeder.newInstance(rng));
        }
        for (int i = 0; i < elites; i++) {
            pending.add(breeder.cross(previous.get(i).candidate(), randomMember(previous), rng));
        }
        for (int i = 0; i < settings.crossovers(); i++) {
            pending.add(breeder.cross(randomMember(previous), randomMember(previous), rng));
        }
        return pending;
    }

    /**
     * Drop structural duplicates, keeping the first occurrence.
     */
    static <T> List<Scored<T>> deduplicate(List<Scored<T>> pool) {
        Map<T, Scored<T>> seen = new LinkedHashMap<>();
        for (Scored<T> entry : pool) {
            seen.putIfAbsent(entry.candidate(), entry);
        }
        return new ArrayList<>(seen.values());
    }

    /**
     * Top up {@code unique} to the population size with distinct candidates:
     * mutants of the previous population walked from its best end, mixed with
     * fresh random candidates once the whole population has been walked.
     *
     * @return number of candidates added
     * @throws PopulationCollapseException after too many duplicates
     */
    private int backfill(List<Scored<T>> unique, List<Scored<T>> previous) {
        int size = settings.populationSize();
        Set<T> seen = new HashSet<>();
        for (Scored<T> entry : unique) {
            seen.add(entry.candidate());
        }

        int added = 0;
        int rejected = 0;
        int cursor = 0;

        while (unique.size() < size) {
            int missing = size - unique.size();
            List<T> batch = new ArrayList<>(missing);
            for (int i = 0; i < missing; i++) {
                boolean afterFullPass = cursor >= previous.size();
                if (afterFullPass && rng.nextBoolean()) {
                    batch.add(breeder.newInstance(rng));
                } else {
                    T parent = previous.get(cursor % previous.size()).candidate();
                    batch.add(breeder.mutate(parent, rng));
                }
                cursor++;
            }

            for (Scored<T> entry : scorer.score(batch)) {
                if (unique.size() < size && seen.add(entry.candidate())) {
                    unique.add(entry);
                    added++;
                } else {
                    rejected++;
                }
            }

            if (unique.size() < size && rejected > settings.backfillAttempts()) {
                log.error("Backfill gave up: {} of {} candidates after {} duplicates",
                        unique.size(), size, rejected);
                throw new PopulationCollapseException(size, unique.size(), rejected);
            }
        }

        log.debug("Backfilled {} candidates ({} duplicates rejected)", added, rejected);
        return added;
    }

    private T randomMember(List<Scored<T>> members) {
        return rng.pick(members).candidate();
    }

    private void report(EpochStats stats) {
        log.debug("{}", stats);
        if (stats.epoch() % settings.reportInterval() == 0) {
            Scored<T> best = population.get(0);
            log.info("Epoch {}: best {} {} (pool {}, unique {}, backfilled {}, {} ms)",
                    stats.epoch(), best, formatMetrics(best.candidate()),
                    stats.poolSize(), stats.uniqueCount(), stats.backfilled(), stats.elapsedMs());
        }
    }

    private String formatMetrics(T candidate) {
        return breeder.metrics().stream()
                .map(m -> String.format("%s=%.4g", m.name(), m.measure(candidate)))
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static double meanScore(List<? extends Scored<?>> entries) {
        return entries.stream()
                .mapToDouble(Scored::score)
                .filter(Double::isFinite)
                .average()
                .orElse(Double.NaN);
    }

    // ========== Getters ==========

    /**
     * Current best candidate.
     *
     * @throws IllegalStateException before initialisation
     */
    public Scored<T> best() {
        List<Scored<T>> snapshot = population;
        if (snapshot.isEmpty()) {
            throw new IllegalStateException("Population not initialized");
        }
        return snapshot.get(0);
    }

    /**
     * Immutable snapshot of the population, best first.
     */
    public List<Scored<T>> population() {
        return population;
    }

    /**
     * Number of completed epochs.
     */
    public int getEpoch() {
        return epoch;
    }

    public EvolutionSettings getSettings() {
        return settings;
    }

    public long getSeed() {
        return rng.getInitialSeed();
    }

    /**
     * Shut down the scoring workers.
     */
    @Override
    public void close() {
        scorer.close();
    }
}
