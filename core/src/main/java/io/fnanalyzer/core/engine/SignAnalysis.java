package io.fnanalyzer.core.engine;

import io.fnanalyzer.core.algebra.PolynomialSolver;
import io.fnanalyzer.core.algebra.RationalFunction;
import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.model.ExcludedSet;
import io.fnanalyzer.core.model.Interval;
import java.util.ArrayList;
import java.util.List;

/**
 * Sign chart of a rational function: the real line is cut at the zeros of the reduced numerator
 * and denominator, and each piece takes the sign of its midpoint.
 */
final class SignAnalysis {

    private SignAnalysis() {}

    /**
     * Where a rational function is negative (or non-positive).
     *
     * @param excluded    the region, as open intervals plus zeros when {@code includeZero}
     * @param approximate whether some breakpoint is a numeric root
     */
    record Region(ExcludedSet excluded, boolean approximate) {}

    /**
     * Inputs where {@code rf < 0}, or {@code rf <= 0} with {@code includeZero}.
     *
     * @throws io.fnanalyzer.core.error.SolveBudgetExceededException if root finding is too costly
     */
    static Region negativeRegion(RationalFunction rf, boolean includeZero, PolynomialSolver solver) {
        RationalFunction reduced = rf.reduced();
        if (reduced.numerator().isZero()) {
            return new Region(includeZero ? ExcludedSet.ofInterval(Interval.all()) : ExcludedSet.NONE, false);
        }
        PolynomialSolver.RootSet zeros = solver.realRoots(reduced.numerator());
        PolynomialSolver.RootSet poles = solver.realRoots(reduced.denominator());

        List<RealNumber> breakpoints = new ArrayList<>(zeros.roots());
        breakpoints.addAll(poles.roots());
        breakpoints.sort(RealNumber::compareTo);

        List<Interval> negative = new ArrayList<>();
        for (int i = 0; i <= breakpoints.size(); i++) {
            RealNumber lo = i == 0 ? null : breakpoints.get(i - 1);
            RealNumber hi = i == breakpoints.size() ? null : breakpoints.get(i);
            if (lo != null && hi != null && lo.doubleValue() >= hi.doubleValue()) {
                continue;
            }
            if (reduced.evaluate(probe(lo, hi)) < 0) {
                negative.add(Interval.open(lo, hi));
            }
        }
        List<RealNumber> points = includeZero ? zeros.roots() : List.of();
        return new Region(
                ExcludedSet.of(points, negative, List.of()), zeros.approximate() || poles.approximate());
    }

    private static double probe(RealNumber lo, RealNumber hi) {
        if (lo == null && hi == null) {
            return 0.0;
        }
        if (lo == null) {
            return hi.doubleValue() - 1.0;
        }
        if (hi == null) {
            return lo.doubleValue() + 1.0;
        }
        return 0.5 * (lo.doubleValue() + hi.doubleValue());
    }
}
