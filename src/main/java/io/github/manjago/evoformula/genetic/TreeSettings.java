package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.expr.BinaryKind;
import io.github.manjago.evoformula.expr.NamedConstant;
import io.github.manjago.evoformula.expr.UnaryKind;

import java.util.List;

/**
 * Parameters shared by the expression operators.
 *
 * @param variables      variable names leaves may use
 * @param unaryKinds     unary operators the generator may draw
 * @param binaryKinds    binary operators the generator may draw
 * @param namedConstants named constants leaves may use
 * @param constantRange  fresh constants are uniform in (-range, range)
 * @param jitter         width of the near-1 / near-0 mutation constants
 * @param initialDepth   depth of freshly generated trees
 * @param maxDepth       depth limit enforced by the simplifier (a leaf has depth 1)
 * @param mutationChance per-node replacement probability
 */
public record TreeSettings(
    List<String> variables,
    List<UnaryKind> unaryKinds,
    List<BinaryKind> binaryKinds,
    List<NamedConstant> namedConstants,
    double constantRange,
    double jitter,
    int initialDepth,
    int maxDepth,
    double mutationChance
) {

    public TreeSettings {
        variables = List.copyOf(variables);
        unaryKinds = List.copyOf(unaryKinds);
        binaryKinds = List.copyOf(binaryKinds);
        namedConstants = List.copyOf(namedConstants);

        for (String name : variables) {
            if (NamedConstant.fromSymbol(name) != null || UnaryKind.fromSymbol(name) != null) {
                throw new IllegalArgumentException("Variable name '" + name
                        + "' is taken by a constant or function");
            }
        }
        if (unaryKinds.isEmpty() && binaryKinds.isEmpty()) {
            throw new IllegalArgumentException("At least one unary or binary operator is required");
        }
        if (!(constantRange > 0)) {
            throw new IllegalArgumentException("constantRange must be positive: " + constantRange);
        }
        if (jitter < 0) {
            throw new IllegalArgumentException("jitter must not be negative: " + jitter);
        }
        if (initialDepth < 0) {
            throw new IllegalArgumentException("initialDepth must not be negative: " + initialDepth);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        if (mutationChance < 0 || mutationChance > 1) {
            throw new IllegalArgumentException("mutationChance must be in [0, 1]: " + mutationChance);
        }
    }

    /**
     * Single variable {@code x}, every operator, both named constants.
     */
    public static TreeSettings defaults() {
        return new TreeSettings(
            List.of("x"),
            List.of(UnaryKind.SIN, UnaryKind.EXP, UnaryKind.SQRT, UnaryKind.LN),
            List.of(BinaryKind.values()),
            List.of(NamedConstant.values()),
            10.0, 0.2, 2, 6, 0.05
        );
    }

    public TreeSettings withDepths(int initial, int max) {
        return new TreeSettings(variables, unaryKinds, binaryKinds, namedConstants,
                constantRange, jitter, initial, max, mutationChance);
    }

    public TreeSettings withMutationChance(double chance) {
        return new TreeSettings(variables, unaryKinds, binaryKinds, namedConstants,
                constantRange, jitter, initialDepth, maxDepth, chance);
    }
}
