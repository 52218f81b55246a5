package io.fnanalyzer.core.model;

import io.fnanalyzer.core.algebra.PiLinear;
import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.algebra.RealNumber;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The infinite set {@code offset + k·period, k ∈ ℤ}, e.g. the poles {@code π/2 + kπ} of
 * {@code tan(x)}. The period is stored positive and, when the ratio is rational, the offset is
 * reduced into {@code [0, period)} so equal sets compare equal.
 *
 * @param offset one member of the family
 * @param period distance between consecutive members
 */
public record PeriodicFamily(PiLinear offset, PiLinear period) {

    /** Upper bound on the members listed by {@link #members}. */
    private static final int MAX_MEMBERS = 10_000;

    public PeriodicFamily {
        Objects.requireNonNull(offset, "offset must not be null");
        Objects.requireNonNull(period, "period must not be null");
        if (period.isZero()) {
            throw new IllegalArgumentException("period must not be zero");
        }
        period = period.abs();
        Optional<PiLinear> ratio = offset.divide(period);
        if (ratio.isPresent() && ratio.get().isRational()) {
            BigInteger k = ratio.get().rational().floor();
            offset = offset.subtract(period.scale(Rational.of(k, BigInteger.ONE)));
        }
    }

    /** Whether {@code v} is (numerically) a member. */
    public boolean contains(double v) {
        double p = period.value();
        double k = Math.rint((v - offset.value()) / p);
        return Interval.near(v, offset.value() + k * p);
    }

    /** Members inside {@code [lo, hi]}, ascending, as exact or symbolic values. */
    public List<RealNumber> members(double lo, double hi) {
        double p = period.value();
        long first = (long) Math.ceil((lo - offset.value()) / p - Interval.TOLERANCE);
        long last = (long) Math.floor((hi - offset.value()) / p + Interval.TOLERANCE);
        List<RealNumber> members = new ArrayList<>();
        for (long k = first; k <= last && members.size() < MAX_MEMBERS; k++) {
            members.add(offset.add(period.scale(Rational.of(k))).toRealNumber());
        }
        return members;
    }

    /** Renders {@code π/2 + kπ}, {@code kπ}, {@code 2kπ}, {@code π/4 + kπ/2}. */
    @Override
    public String toString() {
        String term = periodTerm();
        return offset.isZero() ? term : offset + " + " + term;
    }

    private String periodTerm() {
        if (period.isRational()) {
            return scaledK(period.rational(), "");
        }
        if (period.isPureMultipleOfPi()) {
            return scaledK(period.piCoefficient(), "π");
        }
        return "k(" + period + ")";
    }

    private static String scaledK(Rational coefficient, String unit) {
        BigInteger n = coefficient.numerator();
        String head = (n.equals(BigInteger.ONE) ? "" : n.toString()) + "k" + unit;
        return coefficient.isInteger() ? head : head + "/" + coefficient.denominator();
    }
}
