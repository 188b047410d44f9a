package io.github.manjago.evoformula.expr;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

/**
 * Binary operator table: display symbol, protected function and render priority.
 * <p>
 * Priority is used only by {@link ExpressionPrinter}: higher binds tighter.
 */
public enum BinaryKind {

    ADD("+", 1, (x, y) -> x + y),
    SUB("-", 1, (x, y) -> x - y),
    MUL("*", 2, (x, y) -> x * y),

    /** x / y, or CEILING when |y| &lt; EPS. */
    DIV("/", 2, Protected::divide),

    /** (|x| + EPS)^y, capped at CEILING. */
    POW("^", 3, Protected::power);

    private final String symbol;
    private final int priority;
    private final DoubleBinaryOperator function;

    BinaryKind(String symbol, int priority, DoubleBinaryOperator function) {
        this.symbol = symbol;
        this.priority = priority;
        this.function = function;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Right-associative operators are printed and parsed as {@code a ^ (b ^ c)}.
     */
    public boolean isRightAssociative() {
        return this == POW;
    }

    /**
     * Apply the operator; the result is always finite.
     */
    public double apply(double x, double y) {
        return Protected.clamp(function.applyAsDouble(x, y));
    }

    // ========== Lookup ==========

    private static final Map<String, BinaryKind> BY_SYMBOL = new HashMap<>();

    static {
        for (BinaryKind kind : values()) {
            BY_SYMBOL.put(kind.symbol, kind);
        }
    }

    /**
     * Find a kind by its display symbol.
     *
     * @return kind or null if unknown
     */
    @Contract(pure = true)
    public static @Nullable BinaryKind fromSymbol(String symbol) {
        return BY_SYMBOL.get(symbol);
    }
}
