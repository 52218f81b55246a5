package io.fnanalyzer.core.algebra;

import java.util.Objects;

/**
 * Quotient of two polynomials {@code numerator / denominator}. Instances built from an
 * expression keep common factors, so the denominator still carries every pole and hole;
 * {@link #reduced()} cancels them.
 *
 * @param numerator   numerator polynomial
 * @param denominator non-zero denominator polynomial
 */
public record RationalFunction(Polynomial numerator, Polynomial denominator) {

    public RationalFunction {
        Objects.requireNonNull(numerator, "numerator must not be null");
        Objects.requireNonNull(denominator, "denominator must not be null");
        if (denominator.isZero()) {
            throw new ArithmeticException("Rational function with zero denominator");
        }
    }

    public static RationalFunction of(Polynomial polynomial) {
        return new RationalFunction(polynomial, Polynomial.ONE);
    }

    public RationalFunction add(RationalFunction other) {
        return new RationalFunction(
                numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
                denominator.multiply(other.denominator));
    }

    public RationalFunction subtract(RationalFunction other) {
        return add(other.negate());
    }

    public RationalFunction negate() {
        return new RationalFunction(numerator.negate(), denominator);
    }

    public RationalFunction multiply(RationalFunction other) {
        return new RationalFunction(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
    }

    /** @throws ArithmeticException if {@code other} is identically zero */
    public RationalFunction divide(RationalFunction other) {
        if (other.numerator.isZero()) {
            throw new ArithmeticException("Division by the zero function");
        }
        return new RationalFunction(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
    }

    /** Integer power; negative exponents invert. */
    public RationalFunction pow(int exponent) {
        if (exponent >= 0) {
            return new RationalFunction(numerator.pow(exponent), denominator.pow(exponent));
        }
        if (numerator.isZero()) {
            throw new ArithmeticException("Negative power of the zero function");
        }
        return new RationalFunction(denominator.pow(-exponent), numerator.pow(-exponent));
    }

    /** Cancels the greatest common divisor and makes the denominator monic. */
    public RationalFunction reduced() {
        Polynomial gcd = numerator.gcd(denominator);
        Polynomial n = numerator;
        Polynomial d = denominator;
        if (!gcd.isZero() && gcd.degree() > 0) {
            n = n.divide(gcd).quotient();
            d = d.divide(gcd).quotient();
        }
        Rational lead = d.leadingCoefficient();
        return new RationalFunction(n.scale(lead.reciprocal()), d.scale(lead.reciprocal()));
    }

    /** {@code true} if the denominator is a constant. */
    public boolean isPolynomial() {
        return denominator.isConstant();
    }

    /** The polynomial {@code numerator / c} when the denominator is a constant {@code c}. */
    public Polynomial asPolynomial() {
        if (!isPolynomial()) {
            throw new IllegalStateException("Not a polynomial: " + this);
        }
        return numerator.scale(denominator.leadingCoefficient().reciprocal());
    }

    public double evaluate(double x) {
        return numerator.evaluate(x) / denominator.evaluate(x);
    }

    /** Renders {@code (x + 1)/(x - 2)}, or just the numerator over a unit denominator. */
    public String render(String variable) {
        if (denominator.equals(Polynomial.ONE)) {
            return numerator.render(variable);
        }
        return "(" + numerator.render(variable) + ")/(" + denominator.render(variable) + ")";
    }

    @Override
    public String toString() {
        return render("x");
    }
}
