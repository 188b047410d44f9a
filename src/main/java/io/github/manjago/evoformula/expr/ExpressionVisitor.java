package io.github.manjago.evoformula.expr;

/**
 * Dispatch over the closed set of expression variants.
 *
 * @param <R> result type
 */
public interface ExpressionVisitor<R> {

    R visitVariable(Variable variable);

    R visitConst(Const constant);

    R visitNamedConstant(NamedConstant constant);

    R visitUnary(UnaryOp op);

    R visitBinary(BinaryOp op);

    R visitTable(Table table);

    R visitBound(Bound bound);
}
