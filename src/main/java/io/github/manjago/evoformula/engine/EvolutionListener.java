package io.github.manjago.evoformula.engine;

/**
 * Listener for search events, for example to print progress or plot the
 * current best candidate. Called synchronously on the engine's thread and
 * never consulted by the engine itself.
 */
public interface EvolutionListener<T> {

    /**
     * Called at the end of every epoch.
     *
     * @param stats statistics of the finished epoch
     * @param best  current best candidate
     */
    default void onEpoch(EpochStats stats, Scored<T> best) {}

    /**
     * Called when {@link Evolution#train(int)} returns.
     *
     * @param best   best candidate found
     * @param epochs epochs completed in total
     */
    default void onFinish(Scored<T> best, int epochs) {}

    /**
     * Listener that ignores every event.
     */
    static <T> EvolutionListener<T> noop() {
        return new EvolutionListener<>() {};
    }
}
