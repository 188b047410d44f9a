package io.github.manjago.evoformula.expr;

import java.util.Arrays;
import java.util.Objects;

/**
 * Precomputed step function over {@code [left, right]}, applied to an argument
 * expression.
 * <p>
 * Bucket {@code floor((x - left) / step)} holds the value for {@code x};
 * arguments outside the domain evaluate to the boundary values. Tables are
 * built by numeric helpers and never produced by genetic operators, which
 * treat them as opaque leaves.
 */
public final class Table implements Expression {

    private final String name;
    private final double left;
    private final double right;
    private final double step;
    private final double[] values;
    private final double leftValue;
    private final double rightValue;
    private final Expression argument;

    public Table(String name, double left, double right, double step, double[] values,
                 double leftValue, double rightValue, Expression argument) {
        if (!(right > left)) {
            throw new IllegalArgumentException("Empty table domain [" + left + ", " + right + "]");
        }
        if (!(step > 0)) {
            throw new IllegalArgumentException("Table step must be positive: " + step);
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("Table has no values");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.left = left;
        this.right = right;
        this.step = step;
        this.values = values.clone();
        this.leftValue = leftValue;
        this.rightValue = rightValue;
        this.argument = Objects.requireNonNull(argument, "argument");
    }

    /**
     * Table whose outside-domain values are its first and last entries.
     */
    public Table(String name, double left, double right, double step, double[] values, Expression argument) {
        this(name, left, right, step, values, values[0], values[values.length - 1], argument);
    }

    @Override
    public double eval(ArgumentProvider provider) {
        double x = argument.eval(provider);
        if (x < left) {
            return leftValue;
        }
        if (x > right) {
            return rightValue;
        }
        int index = (int) Math.floor((x - left) / step);
        return values[Math.max(0, Math.min(values.length - 1, index))];
    }

    @Override
    public int arity() {
        return 0;
    }

    @Override
    public int priority() {
        return CALL_PRIORITY;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitTable(this);
    }

    public String getName() { return name; }
    public double getLeft() { return left; }
    public double getRight() { return right; }
    public double getStep() { return step; }
    public int size() { return values.length; }
    public Expression getArgument() { return argument; }

    /**
     * Same table applied to another argument.
     */
    public Table withArgument(Expression newArgument) {
        return new Table(name, left, right, step, values, leftValue, rightValue, newArgument);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table other)) return false;
        return name.equals(other.name)
                && Double.compare(left, other.left) == 0
                && Double.compare(right, other.right) == 0
                && Double.compare(step, other.step) == 0
                && Double.compare(leftValue, other.leftValue) == 0
                && Double.compare(rightValue, other.rightValue) == 0
                && Arrays.equals(values, other.values)
                && argument.equals(other.argument);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, left, right, step, argument);
        return 31 * result + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return ExpressionPrinter.print(this);
    }
}
