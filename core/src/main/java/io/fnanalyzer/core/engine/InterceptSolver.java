package io.fnanalyzer.core.engine;

import io.fnanalyzer.core.algebra.NumericScanner;
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
import io.fnanalyzer.core.model.DomainResult;
import io.fnanalyzer.core.model.InterceptResult;
import io.fnanalyzer.core.model.PeriodicFamily;
import io.fnanalyzer.core.model.Point;
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
 * Finds where the curve meets the axes.
 *
 * <p>The y-intercept is {@code f(0)} when 0 is in the domain. Zeros are found, in order of
 * preference, from the numerator of a rational function, from the structure of the expression
 * (a product vanishes where a factor does, {@code √u} and {@code |u|} where {@code u} does,
 * {@code log u} where {@code u = 1}, trigonometric calls on their periodic families inside the
 * window), and finally by sampling the window. Candidates outside the domain are discarded.
 */
public final class InterceptSolver {

    private static final Logger LOG = LoggerFactory.getLogger(InterceptSolver.class);

    /** Largest |f| accepted at a numerically located zero. */
    private static final double NUMERIC_TOLERANCE = 1e-6;

    private final AnalyzerConfig config;
    private final PolynomialSolver solver;
    private final NumericScanner scanner;

    public InterceptSolver(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.solver = new PolynomialSolver(config.solveBudget());
        this.scanner = new NumericScanner(config.windowMin(), config.windowMax(), config.sampleCount());
    }

    /** Candidate zeros with how they were found. */
    private record Candidates(List<RealNumber> roots, boolean approximate, String how) {}

    public InterceptResult solve(Expr expr, DomainResult domain) {
        StepTrace.Builder trace = StepTrace.builder(TraceCategory.INTERCEPTS);
        String x = config.variable();

        Optional<Point> yIntercept = yIntercept(expr, domain, trace);

        Candidates candidates = candidates(expr, trace);
        trace.step("Solve f(" + x + ") = 0: " + candidates.how());
        List<Point> xIntercepts = new ArrayList<>();
        for (RealNumber root : candidates.roots()) {
            if (!domain.contains(root.doubleValue())) {
                trace.step(x + " = " + root + " is not in the domain, discarded");
                continue;
            }
            if (!vanishes(expr, root)) {
                trace.step(x + " = " + root + " does not make f zero, discarded");
                continue;
            }
            if (xIntercepts.stream().noneMatch(p -> p.x().closeTo(root.doubleValue(), 1e-9))) {
                xIntercepts.add(new Point(root, RealNumber.ZERO));
            }
        }
        xIntercepts.sort((a, b) -> a.x().compareTo(b.x()));
        boolean approximate = candidates.approximate() || yIntercept.map(p -> p.y().isApproximate()).orElse(false);
        trace.conclusion("x-intercepts: " + (xIntercepts.isEmpty()
                        ? "none"
                        : xIntercepts.stream().map(Point::toString).collect(Collectors.joining(", ")))
                + "; y-intercept: " + yIntercept.map(Point::toString).orElse("none"));
        LOG.debug("Intercepts of {}: x {} y {}", expr, xIntercepts, yIntercept);
        return new InterceptResult(yIntercept, xIntercepts, approximate, trace.build());
    }

    private Optional<Point> yIntercept(Expr expr, DomainResult domain, StepTrace.Builder trace) {
        String x = config.variable();
        if (!domain.contains(0.0)) {
            trace.step(x + " = 0 is not in the domain, so there is no y-intercept");
            return Optional.empty();
        }
        try {
            Optional<Rational> exact = ExactEvaluator.evaluate(expr, Rational.ZERO);
            RealNumber y = exact.isPresent()
                    ? RealNumber.exact(exact.get())
                    : RealNumber.approximate(Evaluator.evaluate(expr, 0.0));
            trace.step("Set " + x + " = 0: f(0) " + (y.isApproximate() ? "≈ " : "= ") + y
                    + ", so the y-intercept is (0, " + y + ")");
            return Optional.of(new Point(RealNumber.ZERO, y));
        } catch (UndefinedEvaluationException | IllegalArgumentException e) {
            trace.step("f(0) is undefined (" + e.getMessage() + "), so there is no y-intercept");
            return Optional.empty();
        }
    }

    private Candidates candidates(Expr expr, StepTrace.Builder trace) {
        Optional<RationalFunction> rational = RationalConverter.convert(expr, config.solveBudget().maxDegree());
        if (rational.isPresent()) {
            RationalFunction reduced = rational.get().reduced();
            if (reduced.numerator().isZero()) {
                trace.step("f is identically zero on its domain, so every point of it lies on the x-axis");
                return new Candidates(List.of(), false, "no isolated zeros");
            }
            try {
                return numeratorRoots(reduced);
            } catch (SolveBudgetExceededException e) {
                LOG.debug("Solving the numerator of {} gave up: {}", expr, e.getMessage());
            }
        }
        Optional<Candidates> structural = structuralZeros(expr);
        if (structural.isPresent()) {
            return structural.get();
        }
        List<RealNumber> near = scanner.roots(v -> Evaluator.evaluateOrNaN(expr, v)).stream()
                .map(RealNumber::approximate)
                .collect(Collectors.toList());
        return new Candidates(near, true, "no closed form, sampling " + window() + " finds "
                + (near.isEmpty() ? "no sign change" : near.stream()
                        .map(r -> config.variable() + " ≈ " + r)
                        .collect(Collectors.joining(", "))));
    }

    private Candidates numeratorRoots(RationalFunction reduced) {
        String equation = "the numerator " + reduced.numerator().render(config.variable()) + " = 0";
        if (reduced.numerator().isConstant()) {
            return new Candidates(List.of(), false, equation + " has no solution");
        }
        PolynomialSolver.RootSet roots = solver.realRoots(reduced.numerator());
        return new Candidates(roots.roots(), roots.approximate(), equation + (roots.roots().isEmpty()
                ? " has no real roots"
                : " gives " + list(roots.roots())));
    }

    /** Zeros read off the expression tree; empty when some part has no closed form. */
    private Optional<Candidates> structuralZeros(Expr expr) {
        if (!Exprs.containsVariable(expr)) {
            Optional<Rational> constant = Exprs.rationalConstant(expr);
            if (constant.isPresent() && !constant.get().isZero()) {
                return Optional.of(new Candidates(List.of(), false, "the nonzero constant " + expr + " never vanishes"));
            }
            return Optional.empty();
        }
        if (expr instanceof Expr.Mul mul) {
            return either(structuralZeros(mul.left()), structuralZeros(mul.right()), "a product vanishes where a factor does");
        }
        if (expr instanceof Expr.Div div) {
            return structuralZeros(div.numerator())
                    .map(c -> new Candidates(c.roots(), c.approximate(), "a quotient vanishes where its numerator does; " + c.how()));
        }
        if (expr instanceof Expr.Neg neg) {
            return structuralZeros(neg.operand());
        }
        if (expr instanceof Expr.Pow pow) {
            Optional<Rational> exponent = Exprs.rationalConstant(pow.exponent());
            if (exponent.isPresent() && exponent.get().signum() > 0) {
                return structuralZeros(pow.base());
            }
            if (exponent.isPresent()) {
                return Optional.of(new Candidates(List.of(), false, "a negative power never vanishes"));
            }
            return Optional.empty();
        }
        if (expr instanceof Expr.Call call) {
            return callZeros(call);
        }
        if (expr instanceof Expr.Log log) {
            Expr shifted = new Expr.Sub(log.argument(), Expr.num(1));
            return structuralZeros(shifted)
                    .map(c -> new Candidates(c.roots(), c.approximate(),
                            "a logarithm vanishes where its argument equals 1, i.e. " + c.how()));
        }
        Optional<RationalFunction> rational = RationalConverter.convert(expr, config.solveBudget().maxDegree());
        if (rational.isEmpty()) {
            return Optional.empty();
        }
        RationalFunction reduced = rational.get().reduced();
        if (reduced.numerator().isZero()) {
            return Optional.empty();
        }
        try {
            return Optional.of(numeratorRoots(reduced));
        } catch (SolveBudgetExceededException e) {
            LOG.debug("Solving {} = 0 gave up: {}", expr, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Candidates> callZeros(Expr.Call call) {
        MathFunction function = call.function();
        if (function == MathFunction.EXP) {
            return Optional.of(new Candidates(List.of(), false, "the exponential is never zero"));
        }
        if (function == MathFunction.SQRT || function == MathFunction.ABS) {
            return structuralZeros(call.argument());
        }
        Optional<PeriodicFamily> family = PeriodicZeros.of(call);
        if (family.isEmpty()) {
            return Optional.empty();
        }
        List<RealNumber> members = family.get().members(config.windowMin(), config.windowMax());
        return Optional.of(new Candidates(members, false, call + " = 0 when " + config.variable() + " = "
                + family.get() + ", k ∈ ℤ; inside " + window() + (members.isEmpty() ? " there are none" : ": " + list(members))));
    }

    private static Optional<Candidates> either(Optional<Candidates> a, Optional<Candidates> b, String how) {
        if (a.isEmpty() || b.isEmpty()) {
            return Optional.empty();
        }
        List<RealNumber> roots = new ArrayList<>(a.get().roots());
        roots.addAll(b.get().roots());
        roots.sort(RealNumber::compareTo);
        return Optional.of(new Candidates(roots, a.get().approximate() || b.get().approximate(),
                how + ": " + a.get().how() + "; " + b.get().how()));
    }

    private boolean vanishes(Expr expr, RealNumber root) {
        try {
            if (root.exact().isPresent()) {
                Optional<Rational> exact = ExactEvaluator.evaluate(expr, root.exact().get());
                if (exact.isPresent()) {
                    return exact.get().isZero();
                }
            }
            double value = Evaluator.evaluate(expr, root.doubleValue());
            return Math.abs(value) <= (root.isApproximate() ? NUMERIC_TOLERANCE : 1e-9);
        } catch (UndefinedEvaluationException e) {
            return false;
        }
    }

    private String list(List<RealNumber> roots) {
        return roots.stream()
                .map(r -> config.variable() + (r.isApproximate() ? " ≈ " : " = ") + r)
                .collect(Collectors.joining(", "));
    }

    private String window() {
        return "[" + RealNumber.approximate(config.windowMin()) + ", " + RealNumber.approximate(config.windowMax()) + "]";
    }
}
