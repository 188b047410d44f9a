package io.github.manjago.evoformula.expr;

import java.util.Objects;

/**
 * Free variable, resolved through the active {@link ArgumentProvider}.
 */
public record Variable(String name) implements Expression {

    public Variable {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public double eval(ArgumentProvider provider) {
        Double value = provider.get(name);
        if (value == null) {
            throw new UnboundVariableException(name);
        }
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
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
