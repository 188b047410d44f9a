package io.github.manjago.evoformula.fitness;

import io.github.manjago.evoformula.engine.Objective;
import io.github.manjago.evoformula.expr.ArgumentProvider;
import io.github.manjago.evoformula.expr.Expression;

import java.util.Locale;

/**
 * Stock fitness functions comparing a candidate against a target expression.
 */
public enum FitnessFunctions {

    /** Normalised correlation; higher is better. */
    CORRELATION(Objective.MAXIMIZE),

    /** Mean squared error; lower is better. */
    MSE(Objective.MINIMIZE);

    private final Objective objective;

    FitnessFunctions(Objective objective) {
        this.objective = objective;
    }

    /**
     * Direction the engine must sort scores of this function in.
     */
    public Objective objective() {
        return objective;
    }

    public FitnessFunction against(Expression target, Domain domain, String variable) {
        return switch (this) {
            case CORRELATION -> candidate ->
                    Numerics.correlation(target, candidate, domain, variable, ArgumentProvider.EMPTY);
            case MSE -> candidate ->
                    Numerics.meanSquaredError(target, candidate, domain, variable, ArgumentProvider.EMPTY);
        };
    }

    public static FitnessFunctions fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
