package io.fnanalyzer.core.engine.range;

import io.fnanalyzer.core.algebra.Polynomial;
import io.fnanalyzer.core.algebra.PolynomialSolver;
import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.algebra.RationalFunction;
import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.expr.RationalConverter;
import io.fnanalyzer.core.model.ExcludedSet;
import io.fnanalyzer.core.model.Interval;
import io.fnanalyzer.core.model.StepTrace;
import io.fnanalyzer.core.spi.RangeContext;
import io.fnanalyzer.core.spi.RangeOutcome;
import io.fnanalyzer.core.spi.RangeStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Range of a rational function {@code P/Q}, including polynomials with removed points.
 *
 * <p>The domain splits into branches at the real poles. On each branch {@code f} is continuous
 * and monotonic between consecutive critical points (roots of {@code P'Q - PQ'}), so the branch
 * covers the span between its end limits and critical values. Limits at a pole are infinite with
 * the sign of {@code f} next to it; limits at ±∞ follow the degrees. The value a removed point
 * would have taken is excluded unless another branch reaches it.
 */
public final class RationalRangeStrategy implements RangeStrategy {

    public static final String ID = "rational";

    private static final double TOLERANCE = 1e-9;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RangeOutcome attempt(RangeContext context) {
        int maxDegree = context.config().solveBudget().maxDegree();
        Optional<RationalFunction> converted = RationalConverter.convert(context.expression(), maxDegree);
        if (converted.isEmpty()) {
            return RangeOutcome.notApplicable("not a rational function");
        }
        ExcludedSet domainGaps = context.domain().excluded();
        if (converted.get().denominator().isConstant() && domainGaps.isEmpty()) {
            return RangeOutcome.notApplicable("no variable in a denominator and no removed points");
        }
        if (!domainGaps.intervals().isEmpty() || !domainGaps.families().isEmpty()) {
            return RangeOutcome.notApplicable("domain is not ℝ minus finitely many points");
        }
        return new Solver(converted.get().reduced(), domainGaps.points(), context).solve();
    }

    /** One rational function, solved once. */
    private static final class Solver {
        private final Polynomial p;
        private final Polynomial q;
        private final List<RealNumber> removed;
        private final String x;
        private final StepTrace.Builder trace;
        private final PolynomialSolver roots;
        private final List<RealNumber> poles = new ArrayList<>();
        private final List<RealNumber> holes = new ArrayList<>();
        private final List<Double> breakpoints = new ArrayList<>();
        private final List<Piece> pieces = new ArrayList<>();
        private boolean approximate;

        Solver(RationalFunction reduced, List<RealNumber> removed, RangeContext context) {
            this.p = reduced.numerator();
            this.q = reduced.denominator();
            this.removed = removed;
            this.x = context.variable();
            this.trace = context.trace();
            this.roots = new PolynomialSolver(context.config().solveBudget());
        }

        RangeOutcome solve() {
            String f = new RationalFunction(p, q).render(x);
            if (p.isConstant() && q.isConstant()) {
                RealNumber c = RealNumber.exact(p.coefficient(0).divide(q.coefficient(0)));
                trace.step("f simplifies to the constant " + c + " wherever it is defined");
                return RangeOutcome.attained(List.of(Interval.point(c)), false);
            }
            trace.step("After cancelling common factors, f(" + x + ") = " + f);
            findPolesAndHoles();
            if (!q.isConstant()) {
                trace.step("Set y = f(" + x + ") and clear the denominator: y·(" + q.render(x) + ") = "
                        + p.render(x));
                if (p.degree() <= 1 && q.degree() == 1) {
                    traceInverse();
                }
            }

            List<RealNumber> critical = criticalPoints();
            for (int i = 0; i <= poles.size(); i++) {
                RealNumber lo = i == 0 ? null : poles.get(i - 1);
                RealNumber hi = i == poles.size() ? null : poles.get(i);
                branch(lo, hi, critical);
            }
            traceAsymptote();

            List<Interval> attained = pieces.stream().map(Piece::values).collect(Collectors.toList());
            ExcludedSet excluded = ExcludedSet.complementOf(attained);
            for (RealNumber hole : holes) {
                excluded = excluded.union(holeImage(hole));
            }
            return new RangeOutcome.Solved(excluded, approximate);
        }

        private void findPolesAndHoles() {
            if (!q.isConstant()) {
                PolynomialSolver.RootSet poleSet = roots.realRoots(q);
                approximate |= poleSet.approximate();
                poles.addAll(poleSet.roots());
            }
            for (RealNumber point : removed) {
                if (poles.stream().noneMatch(pole -> pole.closeTo(point.doubleValue(), TOLERANCE))) {
                    holes.add(point);
                }
            }
            if (!p.isConstant()) {
                PolynomialSolver.RootSet zeros = roots.realRoots(p);
                approximate |= zeros.approximate();
                zeros.roots().forEach(z -> breakpoints.add(z.doubleValue()));
            }
            poles.forEach(pole -> breakpoints.add(pole.doubleValue()));
            if (poles.isEmpty()) {
                trace.step("No real poles: f is continuous on all of ℝ apart from removed points");
            } else {
                trace.step("Vertical asymptotes at " + x + " = " + join(poles) + " split the domain into "
                        + (poles.size() + 1) + " branches");
            }
            if (!holes.isEmpty()) {
                trace.step("Removed points (holes) at " + x + " = " + join(holes));
            }
        }

        /** For {@code y = (ax + b)/(cx + d)}: {@code x = (b - dy)/(cy - a)}. */
        private void traceInverse() {
            Rational a = p.coefficient(1);
            Rational b = p.coefficient(0);
            Rational c = q.coefficient(1);
            Rational d = q.coefficient(0);
            Polynomial top = Polynomial.of(b, d.negate());
            Polynomial bottom = Polynomial.of(a.negate(), c);
            RealNumber forbidden = RealNumber.exact(a.divide(c));
            trace.step("Solve for " + x + ": " + x + " = (" + top.render("y") + ")/(" + bottom.render("y")
                    + "), which has a solution for every y except y = " + forbidden);
        }

        private List<RealNumber> criticalPoints() {
            Polynomial slope = p.derivative().multiply(q).subtract(p.multiply(q.derivative()));
            if (slope.isConstant()) {
                trace.step("f'(" + x + ") has numerator " + slope.render(x)
                        + ", which never vanishes: f is monotonic on each branch");
                return List.of();
            }
            PolynomialSolver.RootSet critical = roots.realRoots(slope);
            approximate |= critical.approximate();
            List<RealNumber> inside = critical.roots().stream()
                    .filter(c -> poles.stream().noneMatch(pole -> pole.closeTo(c.doubleValue(), TOLERANCE)))
                    .collect(Collectors.toList());
            if (inside.isEmpty()) {
                trace.step("P'Q - PQ' = " + slope.render(x) + " has no root inside a branch:"
                        + " f is monotonic on each branch");
            } else {
                trace.step("Critical points solve P'Q - PQ' = " + slope.render(x) + " = 0: " + x + " = "
                        + join(inside) + " with values " + inside.stream()
                                .map(c -> "f(" + c + ") = " + valueAt(c))
                                .collect(Collectors.joining(", ")));
            }
            inside.forEach(c -> breakpoints.add(c.doubleValue()));
            return inside;
        }

        private void branch(RealNumber lo, RealNumber hi, List<RealNumber> critical) {
            List<Node> nodes = new ArrayList<>();
            nodes.add(lo == null ? limitAtInfinity(-1) : limitAtPole(lo, +1));
            for (RealNumber c : critical) {
                double v = c.doubleValue();
                if ((lo == null || v > lo.doubleValue()) && (hi == null || v < hi.doubleValue())) {
                    RealNumber value = valueAt(c);
                    approximate |= value.isApproximate();
                    nodes.add(Node.at(v, value, !isHole(v)));
                }
            }
            nodes.add(hi == null ? limitAtInfinity(+1) : limitAtPole(hi, -1));

            List<Interval> covered = new ArrayList<>();
            for (int i = 0; i + 1 < nodes.size(); i++) {
                Node left = nodes.get(i);
                Node right = nodes.get(i + 1);
                Optional<Interval> span = span(left, right);
                span.ifPresent(values -> {
                    pieces.add(new Piece(left.x, right.x, values));
                    covered.add(values);
                });
            }
            trace.step("On the branch " + new Interval(lo, false, hi, false) + " f takes the values "
                    + (covered.isEmpty() ? "∅" : ExcludedSet.complementOf(covered).render()));
        }

        private Node limitAtInfinity(int direction) {
            double at = direction * Double.POSITIVE_INFINITY;
            int dp = p.degree();
            int dq = q.degree();
            if (dp < dq) {
                return Node.limit(at, RealNumber.ZERO);
            }
            Rational ratio = p.leadingCoefficient().divide(q.leadingCoefficient());
            if (dp == dq) {
                return Node.limit(at, RealNumber.exact(ratio));
            }
            int sign = ratio.signum();
            if (direction < 0 && (dp - dq) % 2 == 1) {
                sign = -sign;
            }
            return Node.infinite(at, sign);
        }

        /** Infinite limit next to a pole, signed by the value of f between the pole and the next breakpoint. */
        private Node limitAtPole(RealNumber pole, int side) {
            double at = pole.doubleValue();
            double gap = 1.0;
            for (double b : breakpoints) {
                double distance = (b - at) * side;
                if (distance > TOLERANCE && distance < gap * 2) {
                    gap = distance / 2;
                }
            }
            double probe = at + side * Math.min(gap, 0.5);
            int sign = new RationalFunction(p, q).evaluate(probe) > 0 ? 1 : -1;
            return Node.infinite(at, sign);
        }

        private static Optional<Interval> span(Node a, Node b) {
            Node low = compare(a, b) <= 0 ? a : b;
            Node high = low == a ? b : a;
            if (low.infinity > 0 || high.infinity < 0) {
                return Optional.empty();
            }
            RealNumber lower = low.infinity < 0 ? null : low.value;
            RealNumber upper = high.infinity > 0 ? null : high.value;
            if (lower != null && upper != null && lower.closeTo(upper.doubleValue(), TOLERANCE)) {
                return low.attained || high.attained ? Optional.of(Interval.point(lower)) : Optional.empty();
            }
            return Optional.of(new Interval(lower, low.attained, upper, high.attained));
        }

        private static int compare(Node a, Node b) {
            if (a.infinity != 0 || b.infinity != 0) {
                return Integer.compare(a.infinity, b.infinity);
            }
            return a.value.compareTo(b.value);
        }

        private void traceAsymptote() {
            if (q.isConstant() || p.degree() > q.degree()) {
                if (!q.isConstant()) {
                    trace.step("deg P > deg Q: no horizontal asymptote, |f| grows without bound as "
                            + x + " → ±∞");
                }
                return;
            }
            Rational level = p.degree() < q.degree()
                    ? Rational.ZERO
                    : p.leadingCoefficient().divide(q.leadingCoefficient());
            Polynomial crossing = p.subtract(q.scale(level));
            String equation = crossing.render(x) + " = 0";
            if (crossing.isConstant()) {
                trace.step("Horizontal asymptote y = " + level + ": f = " + level + " would need " + equation
                        + ", which is impossible, so y = " + level + " is never attained");
                return;
            }
            PolynomialSolver.RootSet hits = roots.realRoots(crossing);
            List<RealNumber> valid = hits.roots().stream()
                    .filter(r -> !isHole(r.doubleValue()))
                    .collect(Collectors.toList());
            if (valid.isEmpty()) {
                trace.step("Horizontal asymptote y = " + level + ": " + equation
                        + " has no admissible solution, so y = " + level + " is never attained");
            } else {
                trace.step("Horizontal asymptote y = " + level + " is crossed where " + equation + ": "
                        + x + " = " + join(valid));
            }
        }

        private ExcludedSet holeImage(RealNumber hole) {
            double h = hole.doubleValue();
            RealNumber image = valueAt(hole);
            approximate |= image.isApproximate();
            boolean reachedElsewhere = pieces.stream()
                    .filter(piece -> !(piece.from < h && h < piece.to))
                    .anyMatch(piece -> piece.values.contains(image.doubleValue()));
            if (reachedElsewhere) {
                trace.step("The hole at " + x + " = " + hole + " would give y = " + image
                        + ", but that value is reached elsewhere");
                return ExcludedSet.NONE;
            }
            trace.step("The hole at " + x + " = " + hole + " would give y = " + image
                    + ", which no other input reaches, so it is excluded");
            return ExcludedSet.ofPoint(image);
        }

        private RealNumber valueAt(RealNumber at) {
            Optional<Rational> exact = at.exact();
            if (exact.isPresent()) {
                return RealNumber.exact(p.evaluate(exact.get()).divide(q.evaluate(exact.get())));
            }
            return RealNumber.approximate(new RationalFunction(p, q).evaluate(at.doubleValue()));
        }

        private boolean isHole(double v) {
            return holes.stream().anyMatch(hole -> hole.closeTo(v, TOLERANCE));
        }

        private static String join(List<RealNumber> values) {
            return values.stream().map(RealNumber::toString).collect(Collectors.joining(", "));
        }
    }

    /** Monotonic stretch of a branch between two nodes, with the values it covers. */
    private record Piece(double from, double to, Interval values) {}

    /** Branch end or critical point with the (limit) value of f there. */
    private static final class Node {
        final double x;
        final RealNumber value;
        final int infinity;
        final boolean attained;

        private Node(double x, RealNumber value, int infinity, boolean attained) {
            this.x = x;
            this.value = value;
            this.infinity = infinity;
            this.attained = attained;
        }

        static Node at(double x, RealNumber value, boolean attained) {
            return new Node(x, value, 0, attained);
        }

        static Node limit(double x, RealNumber value) {
            return new Node(x, value, 0, false);
        }

        static Node infinite(double x, int sign) {
            return new Node(x, null, sign, false);
        }
    }
}
