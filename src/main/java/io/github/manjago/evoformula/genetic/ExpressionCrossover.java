package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.expr.*;

/**
 * Recombines two parent trees into one offspring.
 * <ul>
 *   <li>two numeric constants blend into their midpoint;</li>
 *   <li>if either side is a leaf, one parent is returned whole;</li>
 *   <li>same shapes recombine position by position under one parent's operator;</li>
 *   <li>a unary against a binary crosses the unary's child with a random side
 *       of the binary, then keeps either the unary or the binary wrapper
 *       (the binary's other side untouched).</li>
 * </ul>
 */
public class ExpressionCrossover {

    public Expression cross(Expression first, Expression second, SearchRng rng) {
        Shape a = Shape.of(first);
        Shape b = Shape.of(second);

        if (a == Shape.CONSTANT && b == Shape.CONSTANT) {
            return midpoint((Const) first, (Const) second);
        }

        if (a.isLeaf() || b.isLeaf()) {
            return rng.nextBoolean() ? first : second;
        }

        if (a == Shape.LINEAR && b == Shape.LINEAR) {
            UnaryOp x = (UnaryOp) first;
            UnaryOp y = (UnaryOp) second;
            UnaryKind kind = rng.nextBoolean() ? x.kind() : y.kind();
            return new UnaryOp(kind, cross(x.child(), y.child(), rng));
        }

        if (a == Shape.FORKED && b == Shape.FORKED) {
            BinaryOp x = (BinaryOp) first;
            BinaryOp y = (BinaryOp) second;
            BinaryKind kind = rng.nextBoolean() ? x.kind() : y.kind();
            return new BinaryOp(kind,
                    cross(x.left(), y.left(), rng),
                    cross(x.right(), y.right(), rng));
        }

        UnaryOp linear = (UnaryOp) (a == Shape.LINEAR ? first : second);
        BinaryOp forked = (BinaryOp) (a == Shape.FORKED ? first : second);
        return crossMixed(linear, forked, rng);
    }

    private Expression crossMixed(UnaryOp linear, BinaryOp forked, SearchRng rng) {
        int side = rng.nextInt(2);
        Expression crossed = cross(linear.child(), forked.child(side), rng);

        if (rng.nextBoolean()) {
            return linear.withChild(crossed);
        }
        return forked.withChild(side, crossed);
    }

    static Const midpoint(Const a, Const b) {
        return new Const((a.value() + b.value()) / 2);
    }
}
