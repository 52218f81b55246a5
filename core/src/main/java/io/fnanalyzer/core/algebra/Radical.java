package io.fnanalyzer.core.algebra;

import java.math.BigInteger;

/**
 * Builds closed-form values of the shape {@code m + t·√r} (rational {@code m}, {@code t},
 * square-free integer {@code r}) as {@link RealNumber}s with readable text, e.g.
 * {@code 1 - √2} or {@code 3√5/2}.
 */
public final class Radical {

    /** Trial divisors tried when extracting square factors. */
    private static final long MAX_TRIAL_DIVISOR = 100_000;

    private Radical() {}

    /** {@code √q} for a non-negative rational {@code q}. */
    public static RealNumber sqrt(Rational q) {
        return of(Rational.ZERO, Rational.ONE, q);
    }

    /**
     * {@code m + t·√q}. Collapses to an exact rational when {@code q} is a perfect square or
     * {@code t} is zero.
     *
     * @throws IllegalArgumentException if {@code q} is negative
     */
    public static RealNumber of(Rational m, Rational t, Rational q) {
        if (q.signum() < 0) {
            throw new IllegalArgumentException("Square root of a negative rational: " + q);
        }
        if (t.isZero() || q.isZero()) {
            return RealNumber.exact(m);
        }
        var exactRoot = q.sqrtExact();
        if (exactRoot.isPresent()) {
            return RealNumber.exact(m.add(t.multiply(exactRoot.get())));
        }
        // √(n/d) = √(n·d)/d, then pull square factors out of n·d
        BigInteger radicand = q.numerator().multiply(q.denominator());
        BigInteger[] split = splitSquareFactor(radicand);
        Rational coefficient = t.multiply(Rational.of(split[0], q.denominator()));
        BigInteger r = split[1];
        double value = m.doubleValue() + coefficient.doubleValue() * Math.sqrt(r.doubleValue());
        return RealNumber.symbolic(render(m, coefficient, r), value);
    }

    /** Returns {@code [s, r]} with {@code n = s²·r}; {@code r} is square-free up to the trial limit. */
    static BigInteger[] splitSquareFactor(BigInteger n) {
        BigInteger outside = BigInteger.ONE;
        BigInteger inside = n;
        for (long p = 2; p <= MAX_TRIAL_DIVISOR; p++) {
            BigInteger square = BigInteger.valueOf(p * p);
            if (square.compareTo(inside) > 0) {
                break;
            }
            while (inside.mod(square).signum() == 0) {
                inside = inside.divide(square);
                outside = outside.multiply(BigInteger.valueOf(p));
            }
        }
        return new BigInteger[] {outside, inside};
    }

    private static String render(Rational m, Rational coefficient, BigInteger r) {
        String term = surdTerm(coefficient.abs(), r);
        boolean negative = coefficient.signum() < 0;
        if (m.isZero()) {
            return negative ? "-" + term : term;
        }
        return m + (negative ? " - " : " + ") + term;
    }

    private static String surdTerm(Rational magnitude, BigInteger r) {
        String root = "√" + r;
        BigInteger num = magnitude.numerator();
        String head = num.equals(BigInteger.ONE) ? root : num + root;
        return magnitude.isInteger() ? head : head + "/" + magnitude.denominator();
    }
}
