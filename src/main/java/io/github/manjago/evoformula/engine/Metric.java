package io.github.manjago.evoformula.engine;

import java.util.function.ToDoubleFunction;

/**
 * Named auxiliary measurement of a candidate.
 */
public record Metric<T>(String name, ToDoubleFunction<T> function) {

    public double measure(T candidate) {
        return function.applyAsDouble(candidate);
    }
}
