package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.expr.*;

/**
 * Top-down random mutation.
 * <p>
 * At each visited node, with probability {@code mutationChance}, the whole
 * subtree is replaced by one of the {@link Kind} rewrites. Otherwise the walk
 * continues into exactly one child (a random side for binary nodes) and the
 * rest of the tree is shared unchanged. Leaves that are not replaced are
 * returned as is.
 */
public class ExpressionMutator {

    /**
     * Subtree rewrites, drawn uniformly.
     */
    public enum Kind {
        /** {@code c * tree} with c near 1. */
        SCALE,
        /** {@code c + tree} with c near 0. */
        SHIFT,
        /** Fresh random tree of the initial depth. */
        REPLACE,
        /** Replace a node by one of its children. */
        SHRINK,
        /** Wrap in a new unary or binary node. */
        GROW
    }

    private static final Kind[] KINDS = Kind.values();

    private final TreeSettings settings;
    private final ExpressionGenerator generator;

    public ExpressionMutator(ExpressionGenerator generator) {
        this.generator = generator;
        this.settings = generator.getSettings();
    }

    public Expression mutate(Expression tree, SearchRng rng) {
        if (rng.nextBoolean(settings.mutationChance())) {
            return apply(KINDS[rng.nextInt(KINDS.length)], tree, rng);
        }

        return switch (Shape.of(tree)) {
            case LINEAR -> {
                UnaryOp op = (UnaryOp) tree;
                yield op.withChild(mutate(op.child(), rng));
            }
            case FORKED -> {
                BinaryOp op = (BinaryOp) tree;
                int side = rng.nextInt(2);
                yield op.withChild(side, mutate(op.child(side), rng));
            }
            case CONSTANT, LEAF -> tree;
        };
    }

    /**
     * Apply one rewrite to the root of {@code tree}.
     */
    public Expression apply(Kind kind, Expression tree, SearchRng rng) {
        return switch (kind) {
            case SCALE -> new BinaryOp(BinaryKind.MUL, new Const(1 + jitter(rng)), tree);
            case SHIFT -> new BinaryOp(BinaryKind.ADD, new Const(jitter(rng)), tree);
            case REPLACE -> generator.generate(settings.initialDepth(), rng);
            case SHRINK -> shrink(tree, rng);
            case GROW -> grow(tree, rng);
        };
    }

    private Expression shrink(Expression tree, SearchRng rng) {
        return switch (Shape.of(tree)) {
            case LINEAR -> ((UnaryOp) tree).child();
            case FORKED -> ((BinaryOp) tree).child(rng.nextInt(2));
            case CONSTANT, LEAF -> tree;
        };
    }

    private Expression grow(Expression tree, SearchRng rng) {
        if (generator.chooseUnary(rng)) {
            return new UnaryOp(generator.unaryKind(rng), tree);
        }
        Expression sibling = generator.generate(rng.nextInt(settings.initialDepth() + 1), rng);
        BinaryKind kind = generator.binaryKind(rng);
        return rng.nextBoolean()
                ? new BinaryOp(kind, tree, sibling)
                : new BinaryOp(kind, sibling, tree);
    }

    /**
     * Uniform in [-jitter/2, jitter/2).
     */
    private double jitter(SearchRng rng) {
        return (rng.nextDouble() - 0.5) * settings.jitter();
    }
}
