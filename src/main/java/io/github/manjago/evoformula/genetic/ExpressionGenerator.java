package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.expr.*;

/**
 * Depth-bounded random tree generation.
 * <p>
 * Every non-leaf choice recurses with {@code depth - 1}, so each
 * root-to-leaf path has exactly {@code depth} operator nodes: generated trees
 * are full rather than randomly balanced.
 */
public class ExpressionGenerator {

    private final TreeSettings settings;

    public ExpressionGenerator(TreeSettings settings) {
        this.settings = settings;
    }

    /**
     * Generate a random tree.
     *
     * @param depth number of operator levels; 0 yields a single leaf
     */
    public Expression generate(int depth, SearchRng rng) {
        if (depth <= 0) {
            return leaf(rng);
        }
        if (chooseUnary(rng)) {
            return new UnaryOp(rng.pick(settings.unaryKinds()), generate(depth - 1, rng));
        }
        return new BinaryOp(rng.pick(settings.binaryKinds()),
                generate(depth - 1, rng),
                generate(depth - 1, rng));
    }

    /**
     * Uniformly one of: a variable, a named constant, a fresh numeric constant.
     * Categories with nothing configured are skipped.
     */
    public Expression leaf(SearchRng rng) {
        boolean hasVariables = !settings.variables().isEmpty();
        boolean hasNamed = !settings.namedConstants().isEmpty();
        int categories = 1 + (hasVariables ? 1 : 0) + (hasNamed ? 1 : 0);

        int choice = rng.nextInt(categories);
        if (hasVariables) {
            if (choice == 0) {
                return new Variable(rng.pick(settings.variables()));
            }
            choice--;
        }
        if (hasNamed && choice == 0) {
            return rng.pick(settings.namedConstants());
        }
        return constant(rng);
    }

    /**
     * Fresh constant, uniform in (-constantRange, constantRange).
     */
    public Const constant(SearchRng rng) {
        double range = settings.constantRange();
        return new Const(rng.nextDouble(-range, range));
    }

    public UnaryKind unaryKind(SearchRng rng) {
        return rng.pick(settings.unaryKinds());
    }

    public BinaryKind binaryKind(SearchRng rng) {
        return rng.pick(settings.binaryKinds());
    }

    /**
     * Coin flip between unary and binary, forced when only one kind is configured.
     */
    public boolean chooseUnary(SearchRng rng) {
        if (settings.binaryKinds().isEmpty()) {
            return true;
        }
        if (settings.unaryKinds().isEmpty()) {
            return false;
        }
        return rng.nextBoolean();
    }

    public TreeSettings getSettings() {
        return settings;
    }
}
