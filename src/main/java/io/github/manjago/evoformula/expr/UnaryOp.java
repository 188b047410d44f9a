package io.github.manjago.evoformula.expr;

import java.util.Objects;

/**
 * One-argument operator node, rendered as {@code symbol(child)}.
 */
public record UnaryOp(UnaryKind kind, Expression child) implements Expression {

    public UnaryOp {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(child, "child");
    }

    @Override
    public double eval(ArgumentProvider provider) {
        return kind.apply(child.eval(provider));
    }

    @Override
    public int arity() {
        return 1;
    }

    @Override
    public int priority() {
        return CALL_PRIORITY;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    public UnaryOp withChild(Expression newChild) {
        return new UnaryOp(kind, newChild);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
