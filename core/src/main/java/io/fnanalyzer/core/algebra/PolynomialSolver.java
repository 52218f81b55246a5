package io.fnanalyzer.core.algebra;

import io.fnanalyzer.core.error.SolveBudgetExceededException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Real roots of a polynomial with rational coefficients.
 *
 * <p>Order of attack: the root {@code 0}, rational roots (rational root theorem), then closed
 * forms for the remaining linear or quadratic square-free factor (surds via {@link Radical}).
 * A remaining factor of degree three or more is solved numerically by isolating roots between
 * the critical points and bisecting; such roots are reported as approximate.
 *
 * <p>Thread-safe: all state lives in the per-call {@link SolveBudget.Tracker}.
 */
public final class PolynomialSolver {

    private static final Logger LOG = LoggerFactory.getLogger(PolynomialSolver.class);

    /** Coefficients beyond this many bits skip the rational root search. */
    private static final int MAX_CANDIDATE_BITS = 40;

    private final SolveBudget budget;

    public PolynomialSolver(SolveBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
    }

    /** Distinct real roots sorted ascending. */
    public record RootSet(List<RealNumber> roots, boolean approximate) {
        public RootSet {
            roots = List.copyOf(roots);
        }
    }

    /**
     * Solves {@code p(x) = 0}.
     *
     * @throws IllegalArgumentException if {@code p} is the zero polynomial
     * @throws SolveBudgetExceededException if the degree, iteration or time limit is hit
     */
    public RootSet realRoots(Polynomial p) {
        if (p.isZero()) {
            throw new IllegalArgumentException("The zero polynomial vanishes everywhere");
        }
        SolveBudget.Tracker tracker = budget.start("roots of " + p);
        tracker.requireDegree(p.degree());

        List<RealNumber> roots = new ArrayList<>();
        Polynomial rest = p;
        if (rest.degree() > 0 && rest.coefficient(0).isZero()) {
            roots.add(RealNumber.ZERO);
            while (rest.coefficient(0).isZero()) {
                rest = rest.divide(Polynomial.X).quotient();
            }
        }
        rest = squareFree(rest);

        for (Rational candidate : rationalRootCandidates(rest)) {
            if (rest.degree() < 1) {
                break;
            }
            tracker.tick();
            if (rest.evaluate(candidate).isZero()) {
                roots.add(RealNumber.exact(candidate));
                rest = rest.divide(Polynomial.linearFactor(candidate)).quotient();
            }
        }

        boolean approximate = false;
        switch (Math.max(rest.degree(), 0)) {
            case 0:
                break;
            case 1:
                roots.add(RealNumber.exact(rest.coefficient(0).negate().divide(rest.coefficient(1))));
                break;
            case 2:
                roots.addAll(quadraticRoots(rest));
                break;
            default:
                LOG.debug("No closed form for degree-{} factor {}, isolating roots numerically", rest.degree(), rest);
                for (double root : numericRoots(rest, tracker)) {
                    roots.add(RealNumber.approximate(root));
                }
                approximate = true;
        }
        roots.sort(Comparator.naturalOrder());
        return new RootSet(roots, approximate);
    }

    /** {@code p / gcd(p, p')}: the same roots, each with multiplicity one. */
    static Polynomial squareFree(Polynomial p) {
        if (p.degree() < 2) {
            return p;
        }
        Polynomial gcd = p.gcd(p.derivative());
        return gcd.degree() > 0 ? p.divide(gcd).quotient() : p;
    }

    private static List<RealNumber> quadraticRoots(Polynomial q) {
        Rational a = q.coefficient(2);
        Rational b = q.coefficient(1);
        Rational c = q.coefficient(0);
        Rational discriminant = b.multiply(b).subtract(Rational.of(4).multiply(a).multiply(c));
        if (discriminant.signum() < 0) {
            return List.of();
        }
        Rational twoA = a.multiply(Rational.TWO);
        Rational vertex = b.negate().divide(twoA);
        if (discriminant.isZero()) {
            return List.of(RealNumber.exact(vertex));
        }
        Rational half = twoA.reciprocal();
        List<RealNumber> roots = new ArrayList<>(2);
        roots.add(Radical.of(vertex, half.negate(), discriminant));
        roots.add(Radical.of(vertex, half, discriminant));
        return roots;
    }

    /** Candidates {@code ±p/q} with {@code p | a0} and {@code q | an}, smallest magnitude first. */
    private static List<Rational> rationalRootCandidates(Polynomial p) {
        if (p.degree() < 1) {
            return List.of();
        }
        BigInteger lcm = BigInteger.ONE;
        for (Rational c : p.coefficients()) {
            lcm = lcm.divide(lcm.gcd(c.denominator())).multiply(c.denominator());
        }
        Rational scale = Rational.of(lcm, BigInteger.ONE);
        BigInteger constant = p.coefficient(0).multiply(scale).numerator().abs();
        BigInteger leading = p.leadingCoefficient().multiply(scale).numerator().abs();
        if (constant.bitLength() > MAX_CANDIDATE_BITS || leading.bitLength() > MAX_CANDIDATE_BITS) {
            LOG.debug("Coefficients of {} too large for the rational root search", p);
            return List.of();
        }
        Set<Rational> candidates = new LinkedHashSet<>();
        for (long numerator : divisors(constant.longValueExact())) {
            for (long denominator : divisors(leading.longValueExact())) {
                Rational r = Rational.of(numerator, denominator);
                candidates.add(r);
                candidates.add(r.negate());
            }
        }
        List<Rational> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparing(Rational::abs).thenComparing(Comparator.naturalOrder()));
        return sorted;
    }

    private static List<Long> divisors(long n) {
        List<Long> small = new ArrayList<>();
        List<Long> large = new ArrayList<>();
        for (long d = 1; d * d <= n; d++) {
            if (n % d == 0) {
                small.add(d);
                if (d != n / d) {
                    large.add(0, n / d);
                }
            }
        }
        small.addAll(large);
        return small;
    }

    /** Roots of a square-free polynomial by recursion on the derivative's roots. */
    private static List<Double> numericRoots(Polynomial p, SolveBudget.Tracker tracker) {
        if (p.degree() < 1) {
            return List.of();
        }
        if (p.degree() == 1) {
            return List.of(-p.coefficient(0).doubleValue() / p.coefficient(1).doubleValue());
        }
        double bound = cauchyBound(p);
        List<Double> breakpoints = new ArrayList<>();
        breakpoints.add(-bound);
        for (double critical : numericRoots(p.derivative(), tracker)) {
            if (critical > -bound && critical < bound) {
                breakpoints.add(critical);
            }
        }
        breakpoints.add(bound);

        List<Double> roots = new ArrayList<>();
        double scale = Math.max(1.0, Math.abs(p.leadingCoefficient().doubleValue()));
        for (int i = 0; i + 1 < breakpoints.size(); i++) {
            double a = breakpoints.get(i);
            double b = breakpoints.get(i + 1);
            double fa = p.evaluate(a);
            double fb = p.evaluate(b);
            if (Math.abs(fa) <= 1e-12 * scale) {
                addDistinct(roots, a);
            } else if (Math.signum(fa) != Math.signum(fb) && fb != 0.0) {
                addDistinct(roots, bisect(p, a, b, fa, tracker));
            }
        }
        return roots;
    }

    private static double bisect(Polynomial p, double a, double b, double fa, SolveBudget.Tracker tracker) {
        double lo = a;
        double hi = b;
        double flo = fa;
        for (int i = 0; i < 200 && hi - lo > 1e-15 * Math.max(1.0, Math.abs(lo)); i++) {
            tracker.tick();
            double mid = 0.5 * (lo + hi);
            double fm = p.evaluate(mid);
            if (fm == 0.0) {
                return mid;
            }
            if (Math.signum(fm) == Math.signum(flo)) {
                lo = mid;
                flo = fm;
            } else {
                hi = mid;
            }
        }
        return 0.5 * (lo + hi);
    }

    /** Every real root lies in {@code (-B, B)} with {@code B = 1 + max |a_i / a_n|}. */
    private static double cauchyBound(Polynomial p) {
        double lead = Math.abs(p.leadingCoefficient().doubleValue());
        double max = 0.0;
        for (int i = 0; i < p.degree(); i++) {
            max = Math.max(max, Math.abs(p.coefficient(i).doubleValue()) / lead);
        }
        return 1.0 + max;
    }

    private static void addDistinct(List<Double> roots, double root) {
        for (double existing : roots) {
            if (Math.abs(existing - root) <= 1e-12 * Math.max(1.0, Math.abs(root))) {
                return;
            }
        }
        roots.add(root);
    }
}
