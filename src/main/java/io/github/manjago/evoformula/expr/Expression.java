package io.github.manjago.evoformula.expr;

/**
 * Immutable mathematical expression tree.
 * <p>
 * Variants: {@link Variable}, {@link Const}, {@link NamedConstant},
 * {@link UnaryOp}, {@link BinaryOp}, {@link Table} and {@link Bound}.
 * Equality is structural and deep; constants compare with a small tolerance
 * (see {@link Const}). Subtrees may be shared between trees freely.
 * <p>
 * Operations that need to tell variants apart go through a single
 * {@link ExpressionVisitor} rather than instanceof chains.
 */
public interface Expression {

    /** Priority of leaves and leaf-like nodes when rendering. */
    int LEAF_PRIORITY = Integer.MAX_VALUE;

    /** Priority of function-call style nodes when rendering. */
    int CALL_PRIORITY = 10;

    /**
     * Evaluate with the given bindings.
     *
     * @throws UnboundVariableException if a variable cannot be resolved
     */
    double eval(ArgumentProvider provider);

    /**
     * Number of genetic children: 0 for leaves, 1 for unary, 2 for binary.
     */
    int arity();

    /**
     * Render priority; a non-leaf child is parenthesised when its priority is
     * not strictly greater than its parent's.
     */
    int priority();

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Evaluate without any bindings.
     */
    default double eval() {
        return eval(ArgumentProvider.EMPTY);
    }

    default boolean isLeaf() {
        return arity() == 0;
    }
}
