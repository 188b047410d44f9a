package io.github.manjago.evoformula.engine;

import io.github.manjago.evoformula.core.SearchRng;

import java.util.List;

/**
 * Everything the evolutionary engine needs to know about a candidate type.
 *
 * @param <T> candidate type; must implement structural {@code equals}/{@code hashCode},
 *            which the engine uses to deduplicate
 */
public interface Breeder<T> {

    /**
     * Brand-new random candidate.
     */
    T newInstance(SearchRng rng);

    /**
     * Randomly perturbed copy; the argument is not modified.
     */
    T mutate(T candidate, SearchRng rng);

    /**
     * Offspring of two parents.
     */
    T cross(T first, T second, SearchRng rng);

    /**
     * Fitness of a candidate. Called concurrently from worker threads.
     */
    double score(T candidate);

    /**
     * Diagnostics reported for the best candidate; never used for selection.
     */
    default List<Metric<T>> metrics() {
        return List.of();
    }
}
