package io.fnanalyzer.core.algebra;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * A number of the form {@code rational + piCoefficient·π}. Used for exact offsets and periods of
 * trigonometric zero and pole families, e.g. {@code π/2 + kπ}.
 *
 * @param rational      rational part
 * @param piCoefficient coefficient of π
 */
public record PiLinear(Rational rational, Rational piCoefficient) {

    public static final PiLinear ZERO = new PiLinear(Rational.ZERO, Rational.ZERO);
    public static final PiLinear PI = new PiLinear(Rational.ZERO, Rational.ONE);

    public PiLinear {
        Objects.requireNonNull(rational, "rational must not be null");
        Objects.requireNonNull(piCoefficient, "piCoefficient must not be null");
    }

    public static PiLinear of(Rational rational) {
        return new PiLinear(rational, Rational.ZERO);
    }

    public static PiLinear piTimes(Rational coefficient) {
        return new PiLinear(Rational.ZERO, coefficient);
    }

    public double value() {
        return rational.doubleValue() + piCoefficient.doubleValue() * Math.PI;
    }

    public boolean isZero() {
        return rational.isZero() && piCoefficient.isZero();
    }

    /** {@code true} if there is no π part. */
    public boolean isRational() {
        return piCoefficient.isZero();
    }

    /** {@code true} if there is no rational part. */
    public boolean isPureMultipleOfPi() {
        return rational.isZero();
    }

    public PiLinear add(PiLinear other) {
        return new PiLinear(rational.add(other.rational), piCoefficient.add(other.piCoefficient));
    }

    public PiLinear subtract(PiLinear other) {
        return add(other.negate());
    }

    public PiLinear negate() {
        return new PiLinear(rational.negate(), piCoefficient.negate());
    }

    public PiLinear scale(Rational factor) {
        return new PiLinear(rational.multiply(factor), piCoefficient.multiply(factor));
    }

    public PiLinear abs() {
        return value() < 0 ? negate() : this;
    }

    /**
     * Product, defined only when at least one factor is rational (the result stays π-linear).
     */
    public Optional<PiLinear> multiply(PiLinear other) {
        if (other.isRational()) {
            return Optional.of(scale(other.rational));
        }
        if (isRational()) {
            return Optional.of(other.scale(rational));
        }
        return Optional.empty();
    }

    /**
     * Quotient, defined when the divisor is a non-zero rational or when both operands are pure
     * multiples of π (the result is then rational).
     */
    public Optional<PiLinear> divide(PiLinear divisor) {
        if (divisor.isZero()) {
            return Optional.empty();
        }
        if (divisor.isRational()) {
            return Optional.of(scale(divisor.rational.reciprocal()));
        }
        if (divisor.isPureMultipleOfPi() && isPureMultipleOfPi()) {
            return Optional.of(of(piCoefficient.divide(divisor.piCoefficient)));
        }
        return Optional.empty();
    }

    /** Returns this value as a {@link RealNumber}: exact when rational, symbolic otherwise. */
    public RealNumber toRealNumber() {
        return isRational() ? RealNumber.exact(rational) : RealNumber.symbolic(toString(), value());
    }

    /** Renders {@code π/2}, {@code -3π/4}, {@code 1 + π}, {@code 0}. */
    @Override
    public String toString() {
        if (piCoefficient.isZero()) {
            return rational.toString();
        }
        String pi = piTerm(piCoefficient);
        if (rational.isZero()) {
            return pi;
        }
        return pi.startsWith("-")
                ? rational + " - " + pi.substring(1)
                : rational + " + " + pi;
    }

    /** Renders {@code c·π} compactly: {@code π}, {@code -π}, {@code 2π}, {@code π/2}, {@code 3π/2}. */
    static String piTerm(Rational coefficient) {
        String sign = coefficient.signum() < 0 ? "-" : "";
        Rational magnitude = coefficient.abs();
        String numerator = magnitude.numerator().equals(BigInteger.ONE) ? "π" : magnitude.numerator() + "π";
        return magnitude.isInteger() ? sign + numerator : sign + numerator + "/" + magnitude.denominator();
    }
}
