package io.github.manjago.evoformula.engine;

/**
 * Snapshot of one finished epoch.
 *
 * @param epoch       1-based index of the finished epoch
 * @param bestScore   score of the best candidate
 * @param meanScore   mean over finite scores of the new population
 * @param poolSize    candidates in the pool before deduplication
 * @param uniqueCount distinct candidates after deduplication
 * @param backfilled  candidates added by backfill
 * @param elapsedMs   wall time of the epoch
 */
public record EpochStats(
    int epoch,
    double bestScore,
    double meanScore,
    int poolSize,
    int uniqueCount,
    int backfilled,
    long elapsedMs
) {

    /**
     * Fraction of the pool removed as duplicates.
     */
    public double duplicateRate() {
        return poolSize > 0 ? 1.0 - (double) uniqueCount / poolSize : 0;
    }

    @Override
    public String toString() {
        return String.format("Epoch %d: best %.6g, mean %.6g, pool %d, unique %d (%.1f%% dup), backfilled %d, %d ms",
                epoch, bestScore, meanScore, poolSize, uniqueCount, duplicateRate() * 100, backfilled, elapsedMs);
    }
}
