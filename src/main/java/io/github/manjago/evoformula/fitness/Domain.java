package io.github.manjago.evoformula.fitness;

/**
 * Sampled interval {@code [left, right)} with a fixed step.
 */
public record Domain(double left, double right, double step) {

    public Domain {
        if (!(right > left)) {
            throw new IllegalArgumentException("Empty domain [" + left + ", " + right + ")");
        }
        if (!(step > 0)) {
            throw new IllegalArgumentException("Domain step must be positive: " + step);
        }
    }

    /**
     * Number of sample points.
     */
    public int samples() {
        return (int) Math.ceil((right - left) / step - 1e-9);
    }

    /**
     * The i-th sample point.
     */
    public double at(int index) {
        return left + index * step;
    }

    @Override
    public String toString() {
        return String.format("[%s, %s) step %s", left, right, step);
    }
}
