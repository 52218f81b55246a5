package io.fnanalyzer.core.algebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Univariate polynomial with exact {@link Rational} coefficients, stored in ascending order of
 * power. The zero polynomial has no coefficients and degree {@code -1}.
 *
 * <p>Immutable and thread-safe.
 */
public final class Polynomial {

    public static final Polynomial ZERO = new Polynomial(List.of());
    public static final Polynomial ONE = constant(Rational.ONE);
    public static final Polynomial X = new Polynomial(List.of(Rational.ZERO, Rational.ONE));

    private final List<Rational> coefficients;

    private Polynomial(List<Rational> coefficients) {
        this.coefficients = coefficients;
    }

    /** Creates a polynomial from ascending coefficients, trimming trailing zeros. */
    public static Polynomial of(List<Rational> ascending) {
        List<Rational> trimmed = new ArrayList<>(ascending);
        while (!trimmed.isEmpty() && trimmed.get(trimmed.size() - 1).isZero()) {
            trimmed.remove(trimmed.size() - 1);
        }
        return new Polynomial(List.copyOf(trimmed));
    }

    public static Polynomial of(Rational... ascending) {
        return of(List.of(ascending));
    }

    /** Convenience factory from integer coefficients, ascending. */
    public static Polynomial ofIntegers(long... ascending) {
        List<Rational> list = new ArrayList<>();
        for (long c : ascending) {
            list.add(Rational.of(c));
        }
        return of(list);
    }

    public static Polynomial constant(Rational value) {
        return of(List.of(value));
    }

    /** {@code x - root}. */
    public static Polynomial linearFactor(Rational root) {
        return of(root.negate(), Rational.ONE);
    }

    public int degree() {
        return coefficients.size() - 1;
    }

    public boolean isZero() {
        return coefficients.isEmpty();
    }

    /** {@code true} for the zero polynomial and non-zero constants. */
    public boolean isConstant() {
        return coefficients.size() <= 1;
    }

    public Rational coefficient(int power) {
        return power < coefficients.size() ? coefficients.get(power) : Rational.ZERO;
    }

    public List<Rational> coefficients() {
        return coefficients;
    }

    public Rational leadingCoefficient() {
        return isZero() ? Rational.ZERO : coefficients.get(coefficients.size() - 1);
    }

    public Polynomial add(Polynomial other) {
        int size = Math.max(coefficients.size(), other.coefficients.size());
        List<Rational> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add(coefficient(i).add(other.coefficient(i)));
        }
        return of(result);
    }

    public Polynomial subtract(Polynomial other) {
        return add(other.negate());
    }

    public Polynomial negate() {
        return scale(Rational.ONE.negate());
    }

    public Polynomial scale(Rational factor) {
        List<Rational> result = new ArrayList<>(coefficients.size());
        for (Rational c : coefficients) {
            result.add(c.multiply(factor));
        }
        return of(result);
    }

    public Polynomial multiply(Polynomial other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        List<Rational> result = new ArrayList<>(Collections.nCopies(degree() + other.degree() + 1, Rational.ZERO));
        for (int i = 0; i < coefficients.size(); i++) {
            for (int j = 0; j < other.coefficients.size(); j++) {
                result.set(i + j, result.get(i + j).add(coefficients.get(i).multiply(other.coefficients.get(j))));
            }
        }
        return of(result);
    }

    public Polynomial pow(int exponent) {
        if (exponent < 0) {
            throw new IllegalArgumentException("Polynomial exponent must be non-negative, got: " + exponent);
        }
        Polynomial result = ONE;
        Polynomial base = this;
        int e = exponent;
        while (e > 0) {
            if ((e & 1) == 1) {
                result = result.multiply(base);
            }
            base = base.multiply(base);
            e >>= 1;
        }
        return result;
    }

    public Polynomial derivative() {
        List<Rational> result = new ArrayList<>();
        for (int i = 1; i < coefficients.size(); i++) {
            result.add(coefficients.get(i).multiply(Rational.of(i)));
        }
        return of(result);
    }

    /** Exact evaluation (Horner). */
    public Rational evaluate(Rational x) {
        Rational result = Rational.ZERO;
        for (int i = coefficients.size() - 1; i >= 0; i--) {
            result = result.multiply(x).add(coefficients.get(i));
        }
        return result;
    }

    /** Floating-point evaluation (Horner). */
    public double evaluate(double x) {
        double result = 0.0;
        for (int i = coefficients.size() - 1; i >= 0; i--) {
            result = result * x + coefficients.get(i).doubleValue();
        }
        return result;
    }

    /** Coefficients as doubles, ascending. */
    public double[] toDoubleArray() {
        double[] result = new double[coefficients.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = coefficients.get(i).doubleValue();
        }
        return result;
    }

    /** Quotient and remainder of polynomial long division. */
    public record Division(Polynomial quotient, Polynomial remainder) {}

    /** @throws ArithmeticException if the divisor is the zero polynomial */
    public Division divide(Polynomial divisor) {
        if (divisor.isZero()) {
            throw new ArithmeticException("Polynomial division by zero");
        }
        List<Rational> quotient = new ArrayList<>(Collections.nCopies(Math.max(0, degree() - divisor.degree() + 1), Rational.ZERO));
        Polynomial remainder = this;
        Rational lead = divisor.leadingCoefficient();
        while (!remainder.isZero() && remainder.degree() >= divisor.degree()) {
            int shift = remainder.degree() - divisor.degree();
            Rational factor = remainder.leadingCoefficient().divide(lead);
            quotient.set(shift, factor);
            remainder = remainder.subtract(divisor.shift(shift).scale(factor));
        }
        return new Division(of(quotient), remainder);
    }

    /** Monic greatest common divisor (Euclid); {@code gcd(0, 0) = 0}. */
    public Polynomial gcd(Polynomial other) {
        Polynomial a = this;
        Polynomial b = other;
        while (!b.isZero()) {
            Polynomial r = a.divide(b).remainder();
            a = b;
            b = r;
        }
        return a.monic();
    }

    /** Scales so that the leading coefficient is 1; the zero polynomial is returned unchanged. */
    public Polynomial monic() {
        return isZero() ? this : scale(leadingCoefficient().reciprocal());
    }

    private Polynomial shift(int power) {
        if (power == 0 || isZero()) {
            return this;
        }
        List<Rational> result = new ArrayList<>(Collections.nCopies(power, Rational.ZERO));
        result.addAll(coefficients);
        return of(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Polynomial other)) return false;
        return coefficients.equals(other.coefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coefficients);
    }

    @Override
    public String toString() {
        return render("x");
    }

    /** Renders in descending powers, e.g. {@code x^2 - 4}, {@code 3x + 1/2}. */
    public String render(String variable) {
        if (isZero()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (int power = degree(); power >= 0; power--) {
            Rational c = coefficient(power);
            if (c.isZero()) {
                continue;
            }
            boolean negative = c.signum() < 0;
            if (sb.length() == 0) {
                sb.append(negative ? "-" : "");
            } else {
                sb.append(negative ? " - " : " + ");
            }
            Rational magnitude = c.abs();
            boolean unit = magnitude.equals(Rational.ONE);
            if (power == 0) {
                sb.append(magnitude);
                continue;
            }
            if (!unit) {
                sb.append(magnitude.isInteger() ? magnitude.toString() : "(" + magnitude + ")");
            }
            sb.append(variable);
            if (power > 1) {
                sb.append('^').append(power);
            }
        }
        return sb.toString();
    }
}
