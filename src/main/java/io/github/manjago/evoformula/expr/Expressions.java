package io.github.manjago.evoformula.expr;

import java.util.Set;
import java.util.TreeSet;

/**
 * Structural measurements and shorthand factories.
 */
public final class Expressions {

    private Expressions() {}

    // ========== Factories ==========

    public static Variable variable(String name) {
        return new Variable(name);
    }

    public static Const constant(double value) {
        return new Const(value);
    }

    public static UnaryOp unary(UnaryKind kind, Expression child) {
        return new UnaryOp(kind, child);
    }

    public static BinaryOp binary(BinaryKind kind, Expression left, Expression right) {
        return new BinaryOp(kind, left, right);
    }

    // ========== Measurements ==========

    /**
     * Height of the tree; a leaf has depth 1. Tables and bound expressions are
     * opaque and count as leaves.
     */
    public static int depth(Expression expression) {
        return expression.accept(DEPTH);
    }

    /**
     * Number of nodes, counting opaque nodes as one.
     */
    public static int size(Expression expression) {
        return expression.accept(SIZE);
    }

    /**
     * Names of all free variables reachable from the root, including those
     * under tables and bound expressions.
     */
    public static Set<String> variables(Expression expression) {
        Set<String> names = new TreeSet<>();
        expression.accept(new VariableCollector(names));
        return names;
    }

    private static final ExpressionVisitor<Integer> DEPTH = new OpaqueLeafVisitor() {
        @Override
        public Integer visitUnary(UnaryOp op) {
            return 1 + op.child().accept(this);
        }

        @Override
        public Integer visitBinary(BinaryOp op) {
            return 1 + Math.max(op.left().accept(this), op.right().accept(this));
        }
    };

    private static final ExpressionVisitor<Integer> SIZE = new OpaqueLeafVisitor() {
        @Override
        public Integer visitUnary(UnaryOp op) {
            return 1 + op.child().accept(this);
        }

        @Override
        public Integer visitBinary(BinaryOp op) {
            return 1 + op.left().accept(this) + op.right().accept(this);
        }
    };

    private abstract static class OpaqueLeafVisitor implements ExpressionVisitor<Integer> {
        @Override public Integer visitVariable(Variable variable) { return 1; }
        @Override public Integer visitConst(Const constant) { return 1; }
        @Override public Integer visitNamedConstant(NamedConstant constant) { return 1; }
        @Override public Integer visitTable(Table table) { return 1; }
        @Override public Integer visitBound(Bound bound) { return 1; }
    }

    private record VariableCollector(Set<String> names) implements ExpressionVisitor<Void> {
        @Override
        public Void visitVariable(Variable variable) {
            names.add(variable.name());
            return null;
        }

        @Override public Void visitConst(Const constant) { return null; }
        @Override public Void visitNamedConstant(NamedConstant constant) { return null; }

        @Override
        public Void visitUnary(UnaryOp op) {
            op.child().accept(this);
            return null;
        }

        @Override
        public Void visitBinary(BinaryOp op) {
            op.left().accept(this);
            op.right().accept(this);
            return null;
        }

        @Override
        public Void visitTable(Table table) {
            table.getArgument().accept(this);
            return null;
        }

        @Override
        public Void visitBound(Bound bound) {
            bound.inner().accept(this);
            return null;
        }
    }
}
