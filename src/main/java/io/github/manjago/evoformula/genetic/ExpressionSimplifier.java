package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.expr.*;

/**
 * Bottom-up simplification and depth limiting, run after every genetic operation.
 * <p>
 * Depth limit: a non-leaf node reached with {@link #MIN_DEPTH} levels left is
 * replaced by a fresh random leaf, so the result never exceeds the requested
 * depth (a leaf has depth 1).
 * <p>
 * Folding: an operator whose operands are all numeric constants becomes the
 * constant it evaluates to, with NaN and infinities replaced by 0.
 * <p>
 * Identities, applied only when the two operands are not both constants:
 * <pre>
 * x - x  = 0        x / x  = 1        x / 0 = CEILING
 * 0 + x  = x        x + 0  = x        x - 0 = x
 * 0 - x  = -1 * x   x - -c = x + c
 * 0 * x  = 0        x * 0  = 0        1 * x = x       x * 1 = x
 * 0 / x  = 0        x / 1  = x        x ^ 0 = 1
 * </pre>
 * Each rewrite yields a tree no rule applies to again, so simplifying an
 * already simplified tree returns an equal tree.
 */
public class ExpressionSimplifier {

    /** Remaining depth at which non-leaf subtrees are cut. */
    public static final int MIN_DEPTH = 1;

    private static final Const MINUS_ONE = new Const(-1);

    private final ExpressionGenerator generator;

    public ExpressionSimplifier(ExpressionGenerator generator) {
        this.generator = generator;
    }

    /**
     * Simplify and cut the tree to at most {@code maxDepth} levels.
     *
     * @param rng source for replacement leaves
     */
    public Expression simplify(Expression tree, SearchRng rng, int maxDepth) {
        return tree.accept(new Pass(rng, maxDepth));
    }

    private final class Pass implements ExpressionVisitor<Expression> {
        private final SearchRng rng;
        private final int remaining;

        Pass(SearchRng rng, int remaining) {
            this.rng = rng;
            this.remaining = remaining;
        }

        private Expression child(Expression node) {
            return node.accept(new Pass(rng, remaining - 1));
        }

        private boolean exhausted() {
            return remaining <= MIN_DEPTH;
        }

        @Override
        public Expression visitVariable(Variable variable) {
            return variable;
        }

        @Override
        public Expression visitConst(Const constant) {
            return constant;
        }

        @Override
        public Expression visitNamedConstant(NamedConstant constant) {
            return constant;
        }

        @Override
        public Expression visitTable(Table table) {
            return table;
        }

        @Override
        public Expression visitBound(Bound bound) {
            return bound;
        }

        @Override
        public Expression visitUnary(UnaryOp op) {
            if (exhausted()) {
                return generator.leaf(rng);
            }
            Expression arg = child(op.child());
            if (Shape.of(arg) == Shape.CONSTANT) {
                return fold(op.kind().apply(((Const) arg).value()));
            }
            return arg == op.child() ? op : op.withChild(arg);
        }

        @Override
        public Expression visitBinary(BinaryOp op) {
            if (exhausted()) {
                return generator.leaf(rng);
            }
            Expression left = child(op.left());
            Expression right = child(op.right());

            if (Shape.of(left) == Shape.CONSTANT && Shape.of(right) == Shape.CONSTANT) {
                return fold(op.kind().apply(((Const) left).value(), ((Const) right).value()));
            }

            Expression rewritten = rewrite(op.kind(), left, right);
            if (rewritten != null) {
                return rewritten;
            }
            if (left == op.left() && right == op.right()) {
                return op;
            }
            return new BinaryOp(op.kind(), left, right);
        }
    }

    /**
     * Algebraic identities for a binary node whose operands are not both constants.
     *
     * @return rewritten tree, or null when no identity applies
     */
    static Expression rewrite(BinaryKind kind, Expression left, Expression right) {
        return switch (kind) {
            case ADD -> {
                if (isZero(left)) yield right;
                if (isZero(right)) yield left;
                yield null;
            }
            case SUB -> {
                if (left.equals(right)) yield Const.ZERO;
                if (isZero(right)) yield left;
                if (isZero(left)) yield new BinaryOp(BinaryKind.MUL, MINUS_ONE, right);
                if (Shape.of(right) == Shape.CONSTANT && ((Const) right).isNegative()) {
                    yield new BinaryOp(BinaryKind.ADD, left, new Const(-((Const) right).value()));
                }
                yield null;
            }
            case MUL -> {
                if (isZero(left) || isZero(right)) yield Const.ZERO;
                if (isOne(left)) yield right;
                if (isOne(right)) yield left;
                yield null;
            }
            case DIV -> {
                if (isZero(right)) yield new Const(Protected.CEILING);
                if (left.equals(right)) yield Const.ONE;
                if (isZero(left)) yield Const.ZERO;
                if (isOne(right)) yield left;
                yield null;
            }
            case POW -> isZero(right) ? Const.ONE : null;
        };
    }

    private static Const fold(double value) {
        return new Const(Protected.finiteOrZero(value));
    }

    private static boolean isZero(Expression e) {
        return Const.ZERO.equals(e);
    }

    private static boolean isOne(Expression e) {
        return Const.ONE.equals(e);
    }
}
