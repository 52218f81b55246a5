package io.fnanalyzer.core.engine.range;

import io.fnanalyzer.core.algebra.Radical;
import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.algebra.RationalFunction;
import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.expr.Exprs;
import io.fnanalyzer.core.expr.MathFunction;
import io.fnanalyzer.core.expr.RationalConverter;
import io.fnanalyzer.core.model.Interval;
import io.fnanalyzer.core.spi.RangeContext;
import io.fnanalyzer.core.spi.RangeOutcome;
import io.fnanalyzer.core.spi.RangeStrategy;
import java.util.List;
import java.util.Optional;

/**
 * Range of {@code A·sin(u) + B·cos(u) + D} and {@code A·tan(u) + D} for rational {@code A},
 * {@code B}, {@code D} and a non-constant polynomial argument {@code u}.
 *
 * <p>A non-constant polynomial sweeps at least a half-line, hence a full period, so the sine
 * combination reaches exactly {@code [D - R, D + R]} with amplitude {@code R = √(A² + B²)} and the
 * tangent reaches every real value.
 */
public final class TrigRangeStrategy implements RangeStrategy {

    public static final String ID = "trig";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public RangeOutcome attempt(RangeContext context) {
        Combination combination = new Combination();
        if (!combination.collect(context.expression(), Rational.ONE) || combination.argument == null) {
            return RangeOutcome.notApplicable("not a linear combination of sin, cos or tan of one argument");
        }
        Optional<RationalFunction> argument =
                RationalConverter.convert(combination.argument, context.config().solveBudget().maxDegree());
        if (argument.isEmpty() || !argument.get().isPolynomial() || argument.get().asPolynomial().isConstant()) {
            return RangeOutcome.notApplicable("the argument " + combination.argument + " is not a non-constant polynomial");
        }
        var trace = context.trace();
        String u = combination.argument.toString();
        boolean hasTan = !combination.tan.isZero();
        boolean hasSinCos = !combination.sin.isZero() || !combination.cos.isZero();
        if (hasTan && hasSinCos) {
            return RangeOutcome.notApplicable("tan is mixed with sin or cos");
        }
        if (hasTan) {
            trace.step("f = " + combination.tan + "·tan(" + u + ") + " + combination.shift
                    + " with u = " + u + " a non-constant polynomial");
            trace.step("tan(u) takes every real value on each branch between consecutive poles,"
                    + " and scaling or shifting keeps that");
            return RangeOutcome.attained(List.of(Interval.all()), false);
        }
        if (!hasSinCos) {
            return RangeOutcome.notApplicable("the trigonometric terms cancel");
        }

        Rational a = combination.sin;
        Rational b = combination.cos;
        Rational d = combination.shift;
        Rational squared = a.multiply(a).add(b.multiply(b));
        RealNumber amplitude = Radical.sqrt(squared);
        trace.step("Write f as A·sin(u) + B·cos(u) + D with u = " + u + ", A = " + a + ", B = " + b + ", D = " + d);
        trace.step("The argument u is a non-constant polynomial, so it sweeps at least one full period");
        trace.step("A·sin(u) + B·cos(u) = R·sin(u + φ) with amplitude R = √(A² + B²) = " + amplitude
                + ", which oscillates over [-R, R]");
        RealNumber low = Radical.of(d, Rational.ONE.negate(), squared);
        RealNumber high = Radical.of(d, Rational.ONE, squared);
        trace.step("Shift by D = " + d + ": minimum " + low + ", maximum " + high);
        return RangeOutcome.attained(List.of(Interval.closed(low, high)), false);
    }

    /** Accumulates {@code sin·sin(u) + cos·cos(u) + tan·tan(u) + shift}. */
    private static final class Combination {
        Expr argument;
        Rational sin = Rational.ZERO;
        Rational cos = Rational.ZERO;
        Rational tan = Rational.ZERO;
        Rational shift = Rational.ZERO;

        boolean collect(Expr expr, Rational scale) {
            if (!Exprs.containsVariable(expr)) {
                Optional<Rational> constant = Exprs.rationalConstant(expr);
                constant.ifPresent(c -> shift = shift.add(scale.multiply(c)));
                return constant.isPresent();
            }
            if (expr instanceof Expr.Add add) {
                return collect(add.left(), scale) && collect(add.right(), scale);
            }
            if (expr instanceof Expr.Sub sub) {
                return collect(sub.left(), scale) && collect(sub.right(), scale.negate());
            }
            if (expr instanceof Expr.Neg neg) {
                return collect(neg.operand(), scale.negate());
            }
            if (expr instanceof Expr.Mul mul) {
                Optional<Rational> left = Exprs.rationalConstant(mul.left());
                if (left.isPresent()) {
                    return collect(mul.right(), scale.multiply(left.get()));
                }
                Optional<Rational> right = Exprs.rationalConstant(mul.right());
                return right.isPresent() && collect(mul.left(), scale.multiply(right.get()));
            }
            if (expr instanceof Expr.Div div) {
                Optional<Rational> divisor = Exprs.rationalConstant(div.denominator());
                return divisor.isPresent() && !divisor.get().isZero()
                        && collect(div.numerator(), scale.divide(divisor.get()));
            }
            if (expr instanceof Expr.Call call && call.function().isTrigonometric()) {
                if (argument != null && !argument.equals(call.argument())) {
                    return false;
                }
                argument = call.argument();
                if (call.function() == MathFunction.SIN) {
                    sin = sin.add(scale);
                } else if (call.function() == MathFunction.COS) {
                    cos = cos.add(scale);
                } else {
                    tan = tan.add(scale);
                }
                return true;
            }
            return false;
        }
    }
}
