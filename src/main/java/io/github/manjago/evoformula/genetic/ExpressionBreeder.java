package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.engine.Breeder;
import io.github.manjago.evoformula.engine.Metric;
import io.github.manjago.evoformula.expr.Expression;
import io.github.manjago.evoformula.expr.Expressions;
import io.github.manjago.evoformula.fitness.FitnessFunction;

import java.util.List;

/**
 * Genetic operators specialised to expression trees.
 * <p>
 * Every produced tree goes through {@link ExpressionSimplifier}, so the
 * engine only ever sees simplified trees of at most {@code maxDepth} levels.
 */
public class ExpressionBreeder implements Breeder<Expression> {

    private final TreeSettings settings;
    private final ExpressionGenerator generator;
    private final ExpressionMutator mutator;
    private final ExpressionCrossover crossover;
    private final ExpressionSimplifier simplifier;
    private final FitnessFunction fitness;

    public ExpressionBreeder(TreeSettings settings, FitnessFunction fitness) {
        this.settings = settings;
        this.generator = new ExpressionGenerator(settings);
        this.mutator = new ExpressionMutator(generator);
        this.crossover = new ExpressionCrossover();
        this.simplifier = new ExpressionSimplifier(generator);
        this.fitness = fitness;
    }

    @Override
    public Expression newInstance(SearchRng rng) {
        return finish(generator.generate(settings.initialDepth(), rng), rng);
    }

    @Override
    public Expression mutate(Expression candidate, SearchRng rng) {
        return finish(mutator.mutate(candidate, rng), rng);
    }

    @Override
    public Expression cross(Expression first, Expression second, SearchRng rng) {
        return finish(crossover.cross(first, second, rng), rng);
    }

    @Override
    public double score(Expression candidate) {
        return fitness.score(candidate);
    }

    @Override
    public List<Metric<Expression>> metrics() {
        return List.of(
            new Metric<>("depth", Expressions::depth),
            new Metric<>("size", Expressions::size)
        );
    }

    /**
     * Simplify and depth-limit an operator result.
     */
    public Expression finish(Expression tree, SearchRng rng) {
        return simplifier.simplify(tree, rng, settings.maxDepth());
    }

    public TreeSettings getSettings() {
        return settings;
    }
}
