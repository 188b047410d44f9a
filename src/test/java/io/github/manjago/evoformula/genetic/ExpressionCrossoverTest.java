package io.github.manjago.evoformula.genetic;

import io.github.manjago.evoformula.core.SearchRng;
import io.github.manjago.evoformula.expr.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static io.github.manjago.evoformula.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionCrossoverTest {

    private static final Variable X = variable("x");

    private ExpressionCrossover crossover;

    @BeforeEach
    void setUp() {
        crossover = new ExpressionCrossover();
    }

    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 42, 1000})
    @DisplayName("Two constants blend into their midpoint regardless of randomness")
    void constantMidpoint(long seed) {
        Expression child = crossover.cross(constant(2), constant(5), new SearchRng(seed));
        assertEquals(constant(3.5), child);
    }

    @Test
    @DisplayName("A leaf against a tree returns one of the parents")
    void leafAgainstTree() {
        SearchRng rng = new SearchRng(5);
        Expression tree = binary(BinaryKind.ADD, X, constant(1));
        boolean sawLeaf = false;
        boolean sawTree = false;
        for (int i = 0; i < 50; i++) {
            Expression child = crossover.cross(X, tree, rng);
            assertTrue(child == X || child == tree);
            sawLeaf |= child == X;
            sawTree |= child == tree;
        }
        assertTrue(sawLeaf && sawTree);
    }

    @Test
    @DisplayName("Unary against unary: one parent's operator over the crossed children")
    void unaryAgainstUnary() {
        SearchRng rng = new SearchRng(6);
        for (int i = 0; i < 20; i++) {
            UnaryOp child = assertInstanceOf(UnaryOp.class,
                    crossover.cross(unary(UnaryKind.SIN, constant(2)), unary(UnaryKind.EXP, constant(4)), rng));
            assertTrue(Set.of(UnaryKind.SIN, UnaryKind.EXP).contains(child.kind()));
            assertEquals(constant(3), child.child());
        }
    }

    @Test
    @DisplayName("Binary against binary: sides cross position by position")
    void binaryAgainstBinary() {
        SearchRng rng = new SearchRng(7);
        Expression first = binary(BinaryKind.ADD, constant(1), constant(2));
        Expression second = binary(BinaryKind.MUL, constant(3), constant(4));
        for (int i = 0; i < 20; i++) {
            BinaryOp child = assertInstanceOf(BinaryOp.class, crossover.cross(first, second, rng));
            assertTrue(child.kind() == BinaryKind.ADD || child.kind() == BinaryKind.MUL);
            assertEquals(constant(2), child.left());
            assertEquals(constant(3), child.right());
        }
    }

    @Test
    @DisplayName("Unary against binary keeps one of the two wrappers")
    void mixedShapes() {
        SearchRng rng = new SearchRng(8);
        Expression linear = unary(UnaryKind.SIN, constant(2));
        Expression forked = binary(BinaryKind.SUB, constant(4), constant(6));
        boolean sawUnary = false;
        boolean sawBinary = false;

        for (int i = 0; i < 50; i++) {
            Expression child = crossover.cross(linear, forked, rng);
            switch (Shape.of(child)) {
                case LINEAR -> {
                    UnaryOp op = (UnaryOp) child;
                    assertEquals(UnaryKind.SIN, op.kind());
                    // sin's child crossed with 4 or 6
                    assertTrue(op.child().equals(constant(3)) || op.child().equals(constant(4)));
                    sawUnary = true;
                }
                case FORKED -> {
                    BinaryOp op = (BinaryOp) child;
                    assertEquals(BinaryKind.SUB, op.kind());
                    boolean leftCrossed = op.left().equals(constant(3)) && op.right().equals(constant(6));
                    boolean rightCrossed = op.left().equals(constant(4)) && op.right().equals(constant(4));
                    assertTrue(leftCrossed || rightCrossed, child.toString());
                    sawBinary = true;
                }
                default -> fail("unexpected offspring " + child);
            }
        }
        assertTrue(sawUnary && sawBinary);
    }

    @Test
    @DisplayName("Argument order does not matter for mixed shapes")
    void mixedShapesReversed() {
        SearchRng rng = new SearchRng(9);
        Expression linear = unary(UnaryKind.SIN, X);
        Expression forked = binary(BinaryKind.SUB, X, X);
        for (int i = 0; i < 20; i++) {
            Expression child = crossover.cross(forked, linear, rng);
            assertTrue(child.equals(linear) || child.equals(forked), child.toString());
        }
    }
}
