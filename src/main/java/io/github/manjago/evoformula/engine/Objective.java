package io.github.manjago.evoformula.engine;

import java.util.Comparator;
import java.util.Locale;

/**
 * Direction of the fitness comparison.
 * <p>
 * The scoring function alone does not say whether larger is better (an error
 * is minimised, a similarity maximised), so the direction is configured
 * explicitly. NaN scores always rank last.
 */
public enum Objective {

    /** Lower score is better; population sorted ascending. */
    MINIMIZE,

    /** Higher score is better; population sorted descending. */
    MAXIMIZE;

    /**
     * Negative if {@code a} ranks before {@code b}.
     */
    public int compare(double a, double b) {
        boolean aNaN = Double.isNaN(a);
        boolean bNaN = Double.isNaN(b);
        if (aNaN || bNaN) {
            return Boolean.compare(aNaN, bNaN);
        }
        return this == MINIMIZE ? Double.compare(a, b) : Double.compare(b, a);
    }

    public boolean isBetter(double a, double b) {
        return compare(a, b) < 0;
    }

    public <T> Comparator<Scored<T>> comparator() {
        return (x, y) -> compare(x.score(), y.score());
    }

    public static Objective fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
