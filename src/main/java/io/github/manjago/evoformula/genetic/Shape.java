package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.expr.*;

/**
 * How the genetic operators see a node.
 * <p>
 * Tables and bound expressions are opaque to the operators and count as
 * plain leaves.
 */
public enum Shape {

    /** Numeric {@link Const}. */
    CONSTANT,

    /** Any other leaf-like node. */
    LEAF,

    /** {@link UnaryOp}. */
    LINEAR,

    /** {@link BinaryOp}. */
    FORKED;

    public boolean isLeaf() {
        return this == CONSTANT || this == LEAF;
    }

    public static Shape of(Expression expression) {
        return expression.accept(CLASSIFIER);
    }

    private static final ExpressionVisitor<Shape> CLASSIFIER = new ExpressionVisitor<>() {
        @Override public Shape visitVariable(Variable variable) { return LEAF; }
        @Override public Shape visitConst(Const constant) { return CONSTANT; }
        @Override public Shape visitNamedConstant(NamedConstant constant) { return LEAF; }
        @Override public Shape visitUnary(UnaryOp op) { return LINEAR; }
        @Override public Shape visitBinary(BinaryOp op) { return FORKED; }
        @Override public Shape visitTable(Table table) { return LEAF; }
        @Override public Shape visitBound(Bound bound) { return LEAF; }
    };
}
