package io.fnanalyzer.core.engine;

import io.fnanalyzer.core.algebra.NumericScanner;
import io.fnanalyzer.core.algebra.PiLinear;
import io.fnanalyzer.core.algebra.PolynomialSolver;
import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.algebra.RationalFunction;
import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.error.SolveBudgetExceededException;
import io.fnanalyzer.core.error.UndefinedEvaluationException;
import io.fnanalyzer.core.expr.Evaluator;
import io.fnanalyzer.core.expr.ExactEvaluator;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.expr.Exprs;
import io.fnanalyzer.core.expr.MathFunction;
import io.fnanalyzer.core.expr.RationalConverter;
import io.fnanalyzer.core.expr.SignInference;
import io.fnanalyzer.core.model.DomainResult;
import io.fnanalyzer.core.model.ExcludedSet;
import io.fnanalyzer.core.model.Interval;
import io.fnanalyzer.core.model.StepTrace;
import io.fnanalyzer.core.model.TraceCategory;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes where an expression is defined by walking it bottom-up and applying one exclusion
 * rule per risky subexpression:
 *
 * <ul>
 *   <li>division and negative integer powers: the divisor's zeros;
 *   <li>square roots and even roots: negative radicands;
 *   <li>logarithms and variable exponents: non-positive arguments or bases;
 *   <li>tangent: the zeros of the matching cosine.
 * </ul>
 *
 * <p>Zeros and sign regions are solved exactly for rational subexpressions, as periodic families
 * for {@code sin}/{@code cos} of an affine argument, and by sampling the configured window
 * otherwise. Every applied rule adds one trace step, even when it excludes nothing.
 *
 * <p>Stateless and thread-safe.
 */
public final class DomainAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(DomainAnalyzer.class);

    private final AnalyzerConfig config;
    private final PolynomialSolver solver;
    private final NumericScanner scanner;

    public DomainAnalyzer(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.solver = new PolynomialSolver(config.solveBudget());
        this.scanner = new NumericScanner(config.windowMin(), config.windowMax(), config.sampleCount());
    }

    public DomainResult analyze(Expr expr) {
        Walk walk = new Walk();
        expr.accept(walk);
        if (walk.trace.stepCount() == 0) {
            walk.trace.step("No division, root, logarithm or tangent occurs, so there are no restrictions");
        }
        for (RealNumber point : walk.removable) {
            walk.trace.step(config.variable() + " = " + point
                    + " is a removable discontinuity: numerator and denominator both vanish there");
        }
        String description = walk.excluded.render();
        walk.trace.conclusion("Domain: " + description);
        LOG.debug("Domain of {} is {}", expr, description);
        return new DomainResult(walk.excluded, description, walk.removable, walk.approximate, walk.trace.build());
    }

    /** Outcome of locating the zeros of one subexpression. */
    private record Zeros(ExcludedSet set, String text, boolean approximate) {}

    /** Rule collector; one instance per analysis. */
    private final class Walk implements Expr.Visitor<Void> {

        private final StepTrace.Builder trace = StepTrace.builder(TraceCategory.DOMAIN);
        private ExcludedSet excluded = ExcludedSet.NONE;
        private final List<RealNumber> removable = new ArrayList<>();
        private boolean approximate;

        @Override
        public Void visitVariable(Expr.Variable node) {
            return null;
        }

        @Override
        public Void visitNum(Expr.Num node) {
            return null;
        }

        @Override
        public Void visitConst(Expr.Const node) {
            return null;
        }

        @Override
        public Void visitAdd(Expr.Add node) {
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitSub(Expr.Sub node) {
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitMul(Expr.Mul node) {
            node.left().accept(this);
            node.right().accept(this);
            return null;
        }

        @Override
        public Void visitDiv(Expr.Div node) {
            node.numerator().accept(this);
            node.denominator().accept(this);
            excludeZeros("Denominator " + node.denominator() + " must not be zero", node.denominator(), node.numerator());
            return null;
        }

        @Override
        public Void visitPow(Expr.Pow node) {
            node.base().accept(this);
            node.exponent().accept(this);
            Expr base = node.base();
            if (!Exprs.containsVariable(base) && !Exprs.containsVariable(node.exponent())) {
                return null;
            }
            Optional<Rational> exponent = Exprs.rationalConstant(node.exponent());
            if (exponent.isEmpty()) {
                requireSign("Base " + base + " of the variable exponent " + node.exponent() + " must be positive", base, true);
                return null;
            }
            Rational e = exponent.get();
            boolean evenRoot = !e.isInteger() && !e.denominator().testBit(0);
            if (evenRoot) {
                requireSign(
                        "Radicand " + base + " of the even root in " + node + " must be "
                                + (e.signum() < 0 ? "positive" : "non-negative"),
                        base,
                        e.signum() < 0);
            } else if (e.signum() < 0) {
                excludeZeros("Base " + base + " of the negative power in " + node + " must not be zero", base, null);
            }
            return null;
        }

        @Override
        public Void visitNeg(Expr.Neg node) {
            node.operand().accept(this);
            return null;
        }

        @Override
        public Void visitCall(Expr.Call node) {
            node.argument().accept(this);
            if (node.function() == MathFunction.SQRT) {
                requireSign("Radicand " + node.argument() + " of " + node + " must be non-negative", node.argument(), false);
            } else if (node.function() == MathFunction.TAN) {
                excludeZeros(
                        node + " = sin/cos requires cos(" + node.argument() + ") ≠ 0",
                        new Expr.Call(MathFunction.COS, node.argument()),
                        null);
            }
            return null;
        }

        @Override
        public Void visitLog(Expr.Log node) {
            node.argument().accept(this);
            requireSign("Argument " + node.argument() + " of " + node + " must be positive", node.argument(), true);
            return null;
        }

        // --- Rules ---

        private void excludeZeros(String rule, Expr divisor, Expr numerator) {
            Zeros zeros = zerosOf(divisor);
            if (!Exprs.containsVariable(divisor) && zeros.set().isEmpty()) {
                return;
            }
            approximate |= zeros.approximate();
            excluded = excluded.union(zeros.set());
            trace.step(rule + ": " + zeros.text());
            if (numerator != null) {
                for (RealNumber root : zeros.set().points()) {
                    if (vanishesAt(numerator, root)) {
                        removable.add(root);
                    }
                }
            }
        }

        private void requireSign(String rule, Expr argument, boolean strict) {
            String relation = strict ? " > 0" : " ≥ 0";
            if (strict ? SignInference.isPositive(argument) : SignInference.isNonNegative(argument)) {
                trace.step(rule + ": " + argument + relation + " always holds, nothing to exclude");
                return;
            }
            if (!Exprs.containsVariable(argument)) {
                double value = Evaluator.evaluateOrNaN(argument, 0.0);
                boolean holds = strict ? value > 0 : value >= 0;
                if (!holds) {
                    excluded = excluded.union(ExcludedSet.ofInterval(Interval.all()));
                }
                trace.step(rule + ": the constant " + argument + (holds ? " satisfies it" : " violates it, so nothing is defined"));
                return;
            }
            Optional<RationalFunction> rational = RationalConverter.convert(argument, config.solveBudget().maxDegree());
            if (rational.isPresent()) {
                try {
                    SignAnalysis.Region region = SignAnalysis.negativeRegion(rational.get(), strict, solver);
                    approximate |= region.approximate();
                    excluded = excluded.union(region.excluded());
                    trace.step(rule + ": " + argument + relation + " holds on " + region.excluded().render()
                            + (region.excluded().isEmpty() ? ", nothing to exclude" : ", exclude the rest"));
                    return;
                } catch (SolveBudgetExceededException e) {
                    LOG.debug("Sign analysis of {} gave up: {}", argument, e.getMessage());
                }
            }
            List<NumericScanner.Region> regions =
                    scanner.negativeRegions(x -> Evaluator.evaluateOrNaN(argument, x), strict);
            List<Interval> bad = regions.stream()
                    .map(r -> r.lower() == r.upper()
                            ? Interval.point(RealNumber.approximate(r.lower()))
                            : Interval.open(RealNumber.approximate(r.lower()), RealNumber.approximate(r.upper())))
                    .collect(Collectors.toList());
            ExcludedSet found = ExcludedSet.ofIntervals(bad);
            approximate = true;
            excluded = excluded.union(found);
            trace.step(rule + ": no closed form, sampled " + window() + (found.isEmpty()
                    ? " and found no violation"
                    : " and found violations on " + bad.stream().map(Interval::toString).collect(Collectors.joining(", "))
                            + " (approximate)"));
        }

        private Zeros zerosOf(Expr divisor) {
            if (!Exprs.containsVariable(divisor)) {
                double value = Evaluator.evaluateOrNaN(divisor, 0.0);
                return value == 0.0
                        ? new Zeros(ExcludedSet.ofInterval(Interval.all()), "the constant divisor is zero everywhere", false)
                        : new Zeros(ExcludedSet.NONE, "the constant " + divisor + " is never zero", false);
            }
            if (divisor instanceof Expr.Call call
                    && (call.function() == MathFunction.SQRT || call.function() == MathFunction.ABS)) {
                return zerosOf(call.argument());
            }
            if (divisor instanceof Expr.Pow pow
                    && Exprs.rationalConstant(pow.exponent()).filter(e -> e.signum() > 0).isPresent()) {
                return zerosOf(pow.base());
            }
            if (SignInference.isPositive(divisor)) {
                return new Zeros(ExcludedSet.NONE, divisor + " is always positive, nothing to exclude", false);
            }
            Optional<RationalFunction> rational = RationalConverter.convert(divisor, config.solveBudget().maxDegree());
            if (rational.isPresent()) {
                try {
                    return polynomialZeros(divisor, rational.get().reduced());
                } catch (SolveBudgetExceededException e) {
                    LOG.debug("Solving {} = 0 gave up: {}", divisor, e.getMessage());
                }
            }
            Optional<Zeros> family = trigZeros(divisor);
            if (family.isPresent()) {
                return family.get();
            }
            List<RealNumber> near = scanner.roots(x -> Evaluator.evaluateOrNaN(divisor, x)).stream()
                    .map(RealNumber::approximate)
                    .collect(Collectors.toList());
            if (near.isEmpty()) {
                return new Zeros(ExcludedSet.NONE, "no closed form; sampling " + window() + " found no zeros", true);
            }
            String listed = near.stream().map(v -> config.variable() + " ≈ " + v).collect(Collectors.joining(", "));
            return new Zeros(ExcludedSet.ofPoints(near), "no closed form; sampling " + window() + " finds zeros near " + listed, true);
        }

        private Zeros polynomialZeros(Expr divisor, RationalFunction reduced) {
            if (reduced.numerator().isZero()) {
                return new Zeros(ExcludedSet.ofInterval(Interval.all()), divisor + " is identically zero", false);
            }
            PolynomialSolver.RootSet roots = solver.realRoots(reduced.numerator());
            String equation = "solving " + reduced.numerator().render(config.variable()) + " = 0";
            if (roots.roots().isEmpty()) {
                return new Zeros(ExcludedSet.NONE, equation + " gives no real roots, nothing to exclude", false);
            }
            ExcludedSet set = ExcludedSet.ofPoints(roots.roots());
            String listed = roots.roots().stream()
                    .map(r -> config.variable() + (r.isApproximate() ? " ≈ " : " = ") + r)
                    .collect(Collectors.joining(", "));
            return new Zeros(set, equation + " gives " + listed + ", exclude " + pointList(roots.roots()), roots.approximate());
        }

        private Optional<Zeros> trigZeros(Expr divisor) {
            if (!(divisor instanceof Expr.Call call)
                    || !call.function().isTrigonometric()) {
                return Optional.empty();
            }
            return PeriodicZeros.of(call).map(family -> {
                PiLinear target = PeriodicZeros.target(call.function());
                String solution = target.isZero() ? "kπ" : target + " + kπ";
                String text = call.argument() + " = " + solution + " gives " + config.variable() + " = " + family
                        + ", exclude {" + family + " : k ∈ ℤ}";
                return new Zeros(ExcludedSet.ofFamily(family), text, false);
            });
        }

        private boolean vanishesAt(Expr numerator, RealNumber root) {
            try {
                if (root.exact().isPresent()) {
                    Optional<Rational> exact = ExactEvaluator.evaluate(numerator, root.exact().get());
                    if (exact.isPresent()) {
                        return exact.get().isZero();
                    }
                }
                return Math.abs(Evaluator.evaluate(numerator, root.doubleValue())) < 1e-9;
            } catch (UndefinedEvaluationException e) {
                return false;
            }
        }

        private String window() {
            return "[" + RealNumber.approximate(config.windowMin()) + ", " + RealNumber.approximate(config.windowMax()) + "]";
        }

        private String pointList(List<RealNumber> points) {
            return points.stream().map(RealNumber::toString).collect(Collectors.joining(", ", "{", "}"));
        }
    }
}
