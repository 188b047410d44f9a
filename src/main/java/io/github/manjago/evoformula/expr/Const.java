package io.github.manjago.evoformula.expr;

/**
 * Numeric constant.
 * <p>
 * Equality is tolerant: finite values are quantised to multiples of
 * {@link #TOLERANCE} and two constants are equal iff they fall into the same
 * bucket. {@link #hashCode()} hashes the same bucket, so tolerant equality and
 * hashing always agree and hash-based deduplication sees near-equal constants
 * as duplicates. Values too large to quantise, infinities and NaN compare by
 * their exact bits.
 */
public record Const(double value) implements Expression {

    /** Bucket width for tolerant equality. */
    public static final double TOLERANCE = 1e-6;

    /** Above this magnitude values are compared exactly. */
    private static final double QUANTISE_LIMIT = 1e9;

    public static final Const ZERO = new Const(0);
    public static final Const ONE = new Const(1);

    @Override
    public double eval(ArgumentProvider provider) {
        return value;
    }

    @Override
    public int arity() {
        return 0;
    }

    @Override
    public int priority() {
        return LEAF_PRIORITY;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitConst(this);
    }

    public boolean isNegative() {
        return value < 0;
    }

    private boolean quantised() {
        return Double.isFinite(value) && Math.abs(value) < QUANTISE_LIMIT;
    }

    private long bucket() {
        return quantised() ? Math.round(value / TOLERANCE) : Double.doubleToLongBits(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Const other)) return false;
        return quantised() == other.quantised() && bucket() == other.bucket();
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bucket()) * 31 + (quantised() ? 1 : 0);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
