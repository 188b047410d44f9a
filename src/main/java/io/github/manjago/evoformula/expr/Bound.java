package io.github.manjago.evoformula.expr;

import java.util.Objects;

/**
 * Expression with fallback bindings: variables the caller does not bind are
 * looked up in {@code defaults}. Used to pin some variables to constants while
 * leaving the others free.
 */
public record Bound(Expression inner, ArgumentProvider defaults) implements Expression {

    public Bound {
        Objects.requireNonNull(inner, "inner");
        Objects.requireNonNull(defaults, "defaults");
    }

    public static Bound bind(Expression expression, ArgumentProvider defaults) {
        return new Bound(expression, defaults);
    }

    @Override
    public double eval(ArgumentProvider provider) {
        return inner.eval(new FallbackProvider(provider, defaults));
    }

    /**
     * Renders like its inner expression, so it parenthesises like one.
     */
    @Override
    public int arity() {
        return inner.arity();
    }

    @Override
    public int priority() {
        return inner.priority();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBound(this);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
