package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.engine.Metric;
import io.github.manjago.evoformula.expr.Expression;
import io.github.manjago.evoformula.expr.Expressions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionBreederTest {

    private ExpressionBreeder breeder;
    private SearchRng rng;

    @BeforeEach
    void setUp() {
        TreeSettings settings = TreeSettings.defaults().withDepths(2, 4).withMutationChance(0.3);
        breeder = new ExpressionBreeder(settings, Expressions::size);
        rng = new SearchRng(55);
    }

    @Test
    @DisplayName("Every operator output respects the depth limit")
    void depthLimit() {
        Expression a = breeder.newInstance(rng);
        Expression b = breeder.newInstance(rng);
        for (int i = 0; i < 500; i++) {
            Expression mutant = breeder.mutate(a, rng);
            Expression child = breeder.cross(a, b, rng);
            assertTrue(Expressions.depth(mutant) <= 4, mutant.toString());
            assertTrue(Expressions.depth(child) <= 4, child.toString());
            // Keep growing from the latest offspring
            a = mutant;
            b = child;
        }
    }

    @Test
    @DisplayName("Score delegates to the fitness function")
    void scoreDelegates() {
        Expression tree = breeder.newInstance(rng);
        assertEquals(Expressions.size(tree), breeder.score(tree), 0);
    }

    @Test
    @DisplayName("Depth and size are reported as metrics")
    void metrics() {
        List<Metric<Expression>> metrics = breeder.metrics();
        assertEquals(List.of("depth", "size"), metrics.stream().map(Metric::name).toList());

        Expression tree = breeder.newInstance(rng);
        assertEquals(Expressions.depth(tree), metrics.get(0).measure(tree), 0);
    }
}
