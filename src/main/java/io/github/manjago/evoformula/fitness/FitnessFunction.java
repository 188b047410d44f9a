package io.github.manjago.evoformula.fitness;

import io.github.manjago.evoformula.expr.Expression;

/**
 * Opaque scoring of a candidate expression. Must be safe to call from
 * several threads at once.
 */
@FunctionalInterface
public interface FitnessFunction {

    double score(Expression candidate);
}
