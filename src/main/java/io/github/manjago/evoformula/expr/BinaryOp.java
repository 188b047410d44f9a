package io.github.manjago.evoformula.expr;

import java.util.Objects;

/**
 * Two-argument operator node, rendered infix.
 */
public record BinaryOp(BinaryKind kind, Expression left, Expression right) implements Expression {

    public BinaryOp {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public double eval(ArgumentProvider provider) {
        return kind.apply(left.eval(provider), right.eval(provider));
    }

    @Override
    public int arity() {
        return 2;
    }

    @Override
    public int priority() {
        return kind.getPriority();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    /**
     * @param side 0 for left, 1 for right
     */
    public Expression child(int side) {
        return side == 0 ? left : right;
    }

    /**
     * Copy with one side replaced.
     *
     * @param side 0 for left, 1 for right
     */
    public BinaryOp withChild(int side, Expression newChild) {
        return side == 0 ? new BinaryOp(kind, newChild, right) : new BinaryOp(kind, left, newChild);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
