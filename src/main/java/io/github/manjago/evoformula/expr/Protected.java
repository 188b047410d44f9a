package io.github.manjago.evoformula.expr;

/**
 * Protected arithmetic helpers.
 * <p>
 * Operator functions never return NaN or infinity: results are clamped
 * into {@code [-CEILING, CEILING]} and NaN becomes 0.
 */
public final class Protected {

    /** Smallest magnitude treated as non-zero by division, log and pow. */
    public static final double EPS = 1e-3;

    /** Largest magnitude an operator function may return. */
    public static final double CEILING = 1e6;

    private Protected() {}

    /**
     * Clamp value into {@code [-CEILING, CEILING]}; NaN maps to 0.
     */
    public static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        if (value > CEILING) {
            return CEILING;
        }
        if (value < -CEILING) {
            return -CEILING;
        }
        return value;
    }

    /**
     * Replace NaN and infinities with 0, keep everything else as is.
     */
    public static double finiteOrZero(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? 0 : value;
    }

    public static double divide(double x, double y) {
        if (Math.abs(y) < EPS) {
            return CEILING;
        }
        return clamp(x / y);
    }

    public static double power(double x, double y) {
        return clamp(Math.min(Math.pow(Math.abs(x) + EPS, y), CEILING));
    }

    public static double exp(double x) {
        return Math.min(Math.exp(x), CEILING);
    }

    public static double log(double x) {
        return clamp(Math.log(Math.abs(x) + EPS));
    }

    public static double sqrt(double x) {
        return Math.sqrt(Math.abs(x));
    }
}
