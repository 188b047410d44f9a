package io.github.manjago.evoformula.core;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Randomness capability injected into every genetic operator and the engine.
 * <p>
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP with one generator per thread:
 * <ul>
 *   <li>the thread that creates the instance draws from the configured seed,
 *       so a search that generates candidates on its own thread is
 *       reproducible;</li>
 *   <li>any other thread lazily gets its own generator, seeded from the base
 *       seed mixed with a per-thread counter.</li>
 * </ul>
 * Safe for concurrent use; no state is shared between threads.
 */
public final class SearchRng {

    /**
     * Fixed algorithm so runs with the same seed stay reproducible.
     */
    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    /** Golden-ratio increment used to spread per-thread seeds. */
    private static final long SEED_GAMMA = 0x9E3779B97F4A7C15L;

    private final long initialSeed;
    private final AtomicLong threadCounter = new AtomicLong();
    private final ThreadLocal<UniformRandomProvider> local;

    /**
     * Create new RNG with given seed.
     */
    public SearchRng(long seed) {
        this.initialSeed = seed;
        this.local = ThreadLocal.withInitial(
                () -> ALGORITHM.create(seed + SEED_GAMMA * threadCounter.incrementAndGet()));
        this.local.set(ALGORITHM.create(seed));
    }

    /**
     * Seed 0 means "pick one from the clock".
     */
    public static SearchRng fromConfigSeed(long seed) {
        return new SearchRng(seed != 0 ? seed : System.nanoTime());
    }

    private UniformRandomProvider rng() {
        return local.get();
    }

    // ========== Random Methods ==========

    /**
     * Returns uniformly distributed int.
     */
    public int nextInt() {
        return rng().nextInt();
    }

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng().nextInt(bound);
    }

    /**
     * Returns uniformly distributed long.
     */
    public long nextLong() {
        return rng().nextLong();
    }

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng().nextDouble();
    }

    /**
     * Returns uniformly distributed double in [low, high).
     */
    public double nextDouble(double low, double high) {
        return low + (high - low) * rng().nextDouble();
    }

    /**
     * Returns uniformly distributed boolean.
     */
    public boolean nextBoolean() {
        return rng().nextBoolean();
    }

    /**
     * Returns true with probability p.
     */
    public boolean nextBoolean(double probability) {
        return rng().nextDouble() < probability;
    }

    /**
     * Uniformly pick one element.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    public <T> T pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return items.get(rng().nextInt(items.size()));
    }

    /**
     * Get initial seed (for logging and reproducing runs).
     */
    public long getInitialSeed() {
        return initialSeed;
    }
}
