package io.github.manjago.evoformula.expr;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for precomputed step-function tables.
 */
class TableTest {

    private Table table;

    @BeforeEach
    void setUp() {
        table = new Table("F", 0, 4, 1, new double[] {1, 2, 3, 4}, new Variable("x"));
    }

    private double at(double x) {
        return table.eval(MapArgumentProvider.of("x", x));
    }

    @Test
    @DisplayName("Bucket lookup inside the domain")
    void insideDomain() {
        assertEquals(1.0, at(0), 0);
        assertEquals(1.0, at(0.99), 0);
        assertEquals(3.0, at(2.5), 0);
        assertEquals(4.0, at(4), 0);
    }

    @Test
    @DisplayName("Outside the domain: boundary values")
    void outsideDomain() {
        assertEquals(1.0, at(-1), 0);
        assertEquals(4.0, at(100), 0);
    }

    @Test
    @DisplayName("Explicit boundary values")
    void explicitBoundaries() {
        Table t = new Table("G", 0, 2, 1, new double[] {5, 6}, -1, 99, new Variable("x"));
        assertEquals(-1.0, t.eval(MapArgumentProvider.of("x", -0.1)), 0);
        assertEquals(99.0, t.eval(MapArgumentProvider.of("x", 2.1)), 0);
    }

    @Test
    @DisplayName("Argument expression is evaluated first")
    void composedArgument() {
        Table shifted = table.withArgument(new BinaryOp(BinaryKind.ADD, new Variable("x"), new Const(2)));
        assertEquals(3.0, shifted.eval(MapArgumentProvider.of("x", 0)), 0);
    }

    @Test
    @DisplayName("Renders as a function call")
    void rendering() {
        assertEquals("F(x)", table.toString());
        assertEquals("F(x) * 2.0", new BinaryOp(BinaryKind.MUL, table, new Const(2)).toString());
    }

    @Test
    @DisplayName("Equality includes the values")
    void equality() {
        Table same = new Table("F", 0, 4, 1, new double[] {1, 2, 3, 4}, new Variable("x"));
        Table other = new Table("F", 0, 4, 1, new double[] {1, 2, 3, 5}, new Variable("x"));
        assertEquals(table, same);
        assertEquals(table.hashCode(), same.hashCode());
        assertNotEquals(table, other);
    }

    @Test
    @DisplayName("Invalid tables are rejected")
    void validation() {
        Variable x = new Variable("x");
        assertThrows(IllegalArgumentException.class, () -> new Table("T", 1, 1, 1, new double[] {1}, x));
        assertThrows(IllegalArgumentException.class, () -> new Table("T", 0, 1, 0, new double[] {1}, x));
        assertThrows(IllegalArgumentException.class, () -> new Table("T", 0, 1, 1, new double[0], 0, 0, x));
    }
}
