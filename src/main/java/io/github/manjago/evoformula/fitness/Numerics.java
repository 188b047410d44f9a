package io.github.manjago.evoformula.fitness;

import io.github.manjago.evoformula.expr.*;

/**
 * Numeric sweeps over a sampled domain: integration into a {@link Table} and
 * similarity measures between two expressions.
 * <p>
 * Each sweep reuses one {@link SingleVariableProvider}, updated per sample.
 */
public final class Numerics {

    /** Norms and dot products below this are treated as zero. */
    public static final double EPS = 1e-5;

    /** Correlation returned when one of the functions is identically zero. */
    public static final double DEGENERATE_CORRELATION = -1 / EPS;

    private Numerics() {}

    /**
     * Running left Riemann sum of {@code function} over the domain.
     * <p>
     * The table maps x to the sum of {@code f(t) * step} for samples
     * {@code t <= x}; below the domain it is 0, above it the total.
     *
     * @param name     display name of the resulting table
     * @param variable integration variable
     * @param defaults bindings for the other variables of {@code function}
     */
    public static Table integrate(String name, Expression function, Domain domain,
                                  String variable, ArgumentProvider defaults) {
        Expression bound = Bound.bind(function, defaults);
        SingleVariableProvider x = new SingleVariableProvider(variable);

        int samples = domain.samples();
        double[] values = new double[samples];
        double sum = 0;
        for (int i = 0; i < samples; i++) {
            x.set(domain.at(i));
            sum += bound.eval(x) * domain.step();
            values[i] = sum;
        }
        return new Table(name, domain.left(), domain.right(), domain.step(),
                values, 0, sum, new Variable(variable));
    }

    /**
     * Normalised dot product {@code Σ f1·f2 / sqrt(Σ f1² · Σ f2²)}, in [-1, 1].
     * Returns {@link #DEGENERATE_CORRELATION} when the dot product and either
     * norm vanish.
     */
    public static double correlation(Expression f1, Expression f2, Domain domain,
                                     String variable, ArgumentProvider defaults) {
        Expression b1 = Bound.bind(f1, defaults);
        Expression b2 = Bound.bind(f2, defaults);
        SingleVariableProvider x = new SingleVariableProvider(variable);

        double dot = 0;
        double sum1 = 0;
        double sum2 = 0;
        int samples = domain.samples();
        for (int i = 0; i < samples; i++) {
            x.set(domain.at(i));
            double v1 = b1.eval(x);
            double v2 = b2.eval(x);
            dot += v1 * v2;
            sum1 += v1 * v1;
            sum2 += v2 * v2;
        }

        if (Math.abs(dot) < EPS && (Math.abs(sum1) < EPS || Math.abs(sum2) < EPS)) {
            return DEGENERATE_CORRELATION;
        }
        return dot / Math.sqrt(sum1 * sum2);
    }

    /**
     * Mean of {@code (f1 - f2)²} over the samples.
     */
    public static double meanSquaredError(Expression f1, Expression f2, Domain domain,
                                          String variable, ArgumentProvider defaults) {
        Expression b1 = Bound.bind(f1, defaults);
        Expression b2 = Bound.bind(f2, defaults);
        SingleVariableProvider x = new SingleVariableProvider(variable);

        double sum = 0;
        int samples = domain.samples();
        for (int i = 0; i < samples; i++) {
            x.set(domain.at(i));
            double diff = b1.eval(x) - b2.eval(x);
            sum += diff * diff;
        }
        return sum / samples;
    }
}
