package io.github.manjago.evoformula.expr;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

/**
 * Fixed irrational constant; equal by symbol identity.
 */
public enum NamedConstant implements Expression {

    PI("pi", Math.PI),
    E("e", Math.E);

    private final String symbol;
    private final double value;

    NamedConstant(String symbol, double value) {
        this.symbol = symbol;
        this.value = value;
    }

    public String getSymbol() {
        return symbol;
    }

    public double getValue() {
        return value;
    }

    @Override
    public double eval(ArgumentProvider provider) {
        return value;
    }

    @Override
    public int arity() {
        return 0;
    }

    @Override
    public int priority() {
        return LEAF_PRIORITY;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNamedConstant(this);
    }

    @Override
    public String toString() {
        return symbol;
    }

    /**
     * @return constant with this symbol, or null
     */
    @Contract(pure = true)
    public static @Nullable NamedConstant fromSymbol(String symbol) {
        for (NamedConstant constant : values()) {
            if (constant.symbol.equals(symbol)) {
                return constant;
            }
        }
        return null;
    }
}
