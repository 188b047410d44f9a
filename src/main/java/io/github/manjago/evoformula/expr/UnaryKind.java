package io.github.manjago.evoformula.expr;

import org.apache.commons.math3.special.Erf;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Unary operator table: display symbol and protected scalar function.
 * <p>
 * A node stores only the kind, so two nodes with the same kind and
 * equal children are equal and hash alike.
 */
public enum UnaryKind {

    SIN("sin", Math::sin),
    COS("cos", Math::cos),

    /** e^x, capped at {@link Protected#CEILING}. */
    EXP("exp", Protected::exp),

    /** sqrt(|x|). */
    SQRT("sqrt", Protected::sqrt),

    /** ln(|x| + EPS). */
    LN("ln", Protected::log),

    /** Gauss error function. */
    ERF("erf", Erf::erf),

    ABS("abs", Math::abs),
    NEG("neg", x -> -x);

    private final String symbol;
    private final DoubleUnaryOperator function;

    UnaryKind(String symbol, DoubleUnaryOperator function) {
        this.symbol = symbol;
        this.function = function;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Apply the operator; the result is always finite.
     */
    public double apply(double x) {
        return Protected.clamp(function.applyAsDouble(x));
    }

    // ========== Lookup ==========

    private static final Map<String, UnaryKind> BY_SYMBOL = new HashMap<>();

    static {
        for (UnaryKind kind : values()) {
            BY_SYMBOL.put(kind.symbol, kind);
        }
    }

    /**
     * Find a kind by its display symbol (case-insensitive).
     *
     * @return kind or null if unknown
     */
    @Contract(pure = true)
    public static @Nullable UnaryKind fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol.toLowerCase(Locale.ROOT));
    }
}
