package io.fnanalyzer.core.model;

import io.fnanalyzer.core.algebra.RealNumber;

/**
 * A real interval. A {@code null} bound is infinite and always open.
 *
 * <p>Renders as {@code [1, ∞)}, {@code (-∞, 0]} or, when degenerate, {@code {c}}.
 *
 * @param lower       lower bound, {@code null} for -∞
 * @param lowerClosed whether the lower bound belongs to the interval
 * @param upper       upper bound, {@code null} for +∞
 * @param upperClosed whether the upper bound belongs to the interval
 */
public record Interval(RealNumber lower, boolean lowerClosed, RealNumber upper, boolean upperClosed) {

    static final double TOLERANCE = 1e-9;

    public Interval {
        if (lower == null) {
            lowerClosed = false;
        }
        if (upper == null) {
            upperClosed = false;
        }
        if (lower != null && upper != null) {
            int cmp = Double.compare(lower.doubleValue(), upper.doubleValue());
            if (cmp > 0) {
                throw new IllegalArgumentException("Empty interval: lower " + lower + " > upper " + upper);
            }
            if (cmp == 0 && !(lowerClosed && upperClosed)) {
                throw new IllegalArgumentException("Empty interval at " + lower);
            }
        }
    }

    public static Interval all() {
        return new Interval(null, false, null, false);
    }

    public static Interval closed(RealNumber lower, RealNumber upper) {
        return new Interval(lower, true, upper, true);
    }

    public static Interval open(RealNumber lower, RealNumber upper) {
        return new Interval(lower, false, upper, false);
    }

    /** {@code [lower, ∞)}. */
    public static Interval atLeast(RealNumber lower) {
        return new Interval(lower, true, null, false);
    }

    /** {@code (lower, ∞)}. */
    public static Interval greaterThan(RealNumber lower) {
        return new Interval(lower, false, null, false);
    }

    /** {@code (-∞, upper]}. */
    public static Interval atMost(RealNumber upper) {
        return new Interval(null, false, upper, true);
    }

    /** {@code (-∞, upper)}. */
    public static Interval lessThan(RealNumber upper) {
        return new Interval(null, false, upper, false);
    }

    /** The single point {@code [c, c]}. */
    public static Interval point(RealNumber c) {
        return new Interval(c, true, c, true);
    }

    /** Whether an interval with these bounds would be non-empty. */
    static boolean isNonEmpty(RealNumber lower, boolean lowerClosed, RealNumber upper, boolean upperClosed) {
        if (lower == null || upper == null) {
            return true;
        }
        int cmp = Double.compare(lower.doubleValue(), upper.doubleValue());
        return cmp < 0 || (cmp == 0 && lowerClosed && upperClosed);
    }

    public boolean isDegenerate() {
        return lower != null && upper != null && lower.doubleValue() == upper.doubleValue();
    }

    public boolean isAll() {
        return lower == null && upper == null;
    }

    /** Lower bound as a double, {@code -∞} when unbounded. */
    public double lowerValue() {
        return lower == null ? Double.NEGATIVE_INFINITY : lower.doubleValue();
    }

    /** Upper bound as a double, {@code +∞} when unbounded. */
    public double upperValue() {
        return upper == null ? Double.POSITIVE_INFINITY : upper.doubleValue();
    }

    /** Membership; closed bounds admit values within a small relative tolerance. */
    public boolean contains(double v) {
        return aboveLower(v) && belowUpper(v);
    }

    private boolean aboveLower(double v) {
        if (lower == null) {
            return true;
        }
        double lo = lower.doubleValue();
        return v > lo || (lowerClosed && near(v, lo));
    }

    private boolean belowUpper(double v) {
        if (upper == null) {
            return true;
        }
        double hi = upper.doubleValue();
        return v < hi || (upperClosed && near(v, hi));
    }

    /** Equality within the membership tolerance. */
    public static boolean near(double a, double b) {
        return Math.abs(a - b) <= TOLERANCE * Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
    }

    @Override
    public String toString() {
        if (isDegenerate()) {
            return "{" + lower + "}";
        }
        return (lowerClosed ? "[" : "(")
                + (lower == null ? "-∞" : lower.toString())
                + ", "
                + (upper == null ? "∞" : upper.toString())
                + (upperClosed ? "]" : ")");
    }
}
