package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.expr.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionGeneratorTest {

    private SearchRng rng;

    @BeforeEach
    void setUp() {
        rng = new SearchRng(2024);
    }

    /** Shortest root-to-leaf path, counting nodes. */
    static int minDepth(Expression e) {
        return switch (Shape.of(e)) {
            case CONSTANT, LEAF -> 1;
            case LINEAR -> 1 + minDepth(((UnaryOp) e).child());
            case FORKED -> 1 + Math.min(minDepth(((BinaryOp) e).left()), minDepth(((BinaryOp) e).right()));
        };
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 5})
    @DisplayName("Generated trees are full: every path has the requested operator count")
    void fullTrees(int depth) {
        ExpressionGenerator generator = new ExpressionGenerator(TreeSettings.defaults());
        for (int i = 0; i < 50; i++) {
            Expression tree = generator.generate(depth, rng);
            assertEquals(depth + 1, Expressions.depth(tree), tree.toString());
            assertEquals(depth + 1, minDepth(tree), tree.toString());
        }
    }

    @Test
    @DisplayName("Leaves use only configured variables, named constants and in-range constants")
    void leafCategories() {
        TreeSettings settings = TreeSettings.defaults();
        ExpressionGenerator generator = new ExpressionGenerator(settings);
        boolean sawVariable = false;
        boolean sawNamed = false;
        boolean sawConst = false;

        for (int i = 0; i < 300; i++) {
            Expression leaf = generator.leaf(rng);
            if (leaf instanceof Variable v) {
                assertEquals("x", v.name());
                sawVariable = true;
            } else if (leaf instanceof NamedConstant) {
                sawNamed = true;
            } else {
                Const c = assertInstanceOf(Const.class, leaf);
                assertTrue(Math.abs(c.value()) < settings.constantRange());
                sawConst = true;
            }
        }
        assertTrue(sawVariable && sawNamed && sawConst, "all leaf categories should appear");
    }

    @Test
    @DisplayName("Empty categories are skipped")
    void emptyCategories() {
        TreeSettings constantsOnly = new TreeSettings(List.of(), List.of(UnaryKind.SIN), List.of(), List.of(),
                1.0, 0.2, 2, 6, 0.05);
        ExpressionGenerator generator = new ExpressionGenerator(constantsOnly);
        for (int i = 0; i < 50; i++) {
            assertInstanceOf(Const.class, generator.leaf(rng));
        }
    }

    @Test
    @DisplayName("Only unary operators configured: chains of unary nodes")
    void unaryOnly() {
        TreeSettings unaryOnly = new TreeSettings(List.of("x"), List.of(UnaryKind.SIN, UnaryKind.COS), List.of(),
                List.of(), 1.0, 0.2, 3, 6, 0.05);
        ExpressionGenerator generator = new ExpressionGenerator(unaryOnly);
        Expression tree = generator.generate(3, rng);
        assertEquals(4, Expressions.size(tree));
        assertEquals(Shape.LINEAR, Shape.of(tree));
    }

    @Test
    @DisplayName("Operators come from the configured sets")
    void configuredOperators() {
        TreeSettings settings = new TreeSettings(List.of("x"), List.of(UnaryKind.ABS), List.of(BinaryKind.MUL),
                List.of(), 1.0, 0.2, 2, 6, 0.05);
        ExpressionGenerator generator = new ExpressionGenerator(settings);
        for (int i = 0; i < 50; i++) {
            assertEquals(UnaryKind.ABS, generator.unaryKind(rng));
            assertEquals(BinaryKind.MUL, generator.binaryKind(rng));
        }
    }
}
