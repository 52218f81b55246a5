package io.fnanalyzer.core.engine;

import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.error.UndefinedEvaluationException;
import io.fnanalyzer.core.expr.Evaluator;
import io.fnanalyzer.core.expr.ExactEvaluator;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.expr.Exprs;
import io.fnanalyzer.core.model.DomainResult;
import io.fnanalyzer.core.model.EvaluationResult;
import io.fnanalyzer.core.model.ExcludedSet;
import io.fnanalyzer.core.model.Interval;
import io.fnanalyzer.core.model.StepTrace;
import io.fnanalyzer.core.model.TraceCategory;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates the expression at one point. Rational inputs are evaluated exactly where possible;
 * everything else in double precision. A point outside the domain is reported with the flag set
 * and still substituted; the value is kept when the substitution happens to be defined, except
 * at a pole, where a finite double is only a rounding artifact.
 */
public final class PointEvaluator {

    private final AnalyzerConfig config;

    public PointEvaluator(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * The value of a constant expression such as {@code 3/2} or {@code pi/4}: exact when rational,
     * otherwise symbolic with the expression as its text.
     *
     * @throws UndefinedEvaluationException if the constant itself is undefined, e.g. {@code 1/0}
     */
    public static RealNumber pointValue(Expr point) {
        Optional<Rational> exact = Exprs.rationalConstant(point);
        if (exact.isPresent()) {
            return RealNumber.exact(exact.get());
        }
        double value = Evaluator.evaluateConstant(point);
        if (!Double.isFinite(value)) {
            throw new UndefinedEvaluationException("The point " + point + " is not a finite real number");
        }
        return RealNumber.symbolic(point.toString(), value);
    }

    public EvaluationResult evaluate(Expr expr, DomainResult domain, RealNumber x) {
        StepTrace.Builder trace = StepTrace.builder(TraceCategory.EVALUATION);
        String variable = config.variable();
        String at = "f(" + x + ")";
        Optional<String> outside = Optional.empty();
        if (!domain.contains(x.doubleValue())) {
            outside = Optional.of(variable + " = " + x + " is outside the domain " + domain.description());
            trace.step(outside.get() + "; substituting anyway");
        }
        trace.step("Substitute " + variable + " = " + x + " into f(" + variable + ") = " + expr);
        try {
            RealNumber y = value(expr, x);
            if (outside.isPresent() && y.isApproximate() && isolatedExclusion(domain, x.doubleValue())) {
                throw new UndefinedEvaluationException(
                        variable + " = " + x + " is a pole, the floating-point value " + y + " is a rounding artifact");
            }
            if (y.isExact()) {
                trace.step(at + " = " + y);
            }
            trace.conclusion(at + " = " + y.decimal(config.decimalPlaces()));
            return new EvaluationResult(x, Optional.of(y), outside.isPresent(), outside, trace.build());
        } catch (UndefinedEvaluationException e) {
            trace.step("The substitution is undefined: " + e.getMessage());
            trace.conclusion(at + " is undefined");
            return new EvaluationResult(
                    x, Optional.empty(), outside.isPresent(), Optional.of(outside.orElse(e.getMessage())), trace.build());
        }
    }

    /** Whether {@code v} is an excluded point or a member of an excluded family. */
    private static boolean isolatedExclusion(DomainResult domain, double v) {
        ExcludedSet excluded = domain.excluded();
        return excluded.families().stream().anyMatch(f -> f.contains(v))
                || excluded.points().stream().anyMatch(p -> Interval.near(p.doubleValue(), v));
    }

    private static RealNumber value(Expr expr, RealNumber x) {
        if (x.exact().isPresent()) {
            Optional<Rational> exact = ExactEvaluator.evaluate(expr, x.exact().get());
            if (exact.isPresent()) {
                return RealNumber.exact(exact.get());
            }
        }
        double y = Evaluator.evaluate(expr, x.doubleValue());
        if (!Double.isFinite(y)) {
            throw new UndefinedEvaluationException("the value is not a finite real number");
        }
        return RealNumber.approximate(y);
    }
}
