package io.fnanalyzer.core.expr;

import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.error.UndefinedEvaluationException;
import java.util.Optional;

/**
 * Floating-point evaluation over the reals.
 *
 * <p>Operations that are undefined over ℝ (division by exactly zero, logarithm of a non-positive
 * number, square root or even root of a negative number, zero to a negative power) raise {@link
 * UndefinedEvaluationException}. Overflow yields an infinite result rather than an error, which
 * the sampling code relies on.
 */
public final class Evaluator implements Expr.Visitor<Double> {

    private final Double x;

    private Evaluator(Double x) {
        this.x = x;
    }

    /**
     * Evaluates {@code expr} at {@code x}.
     *
     * @throws UndefinedEvaluationException if the value is not a real number
     */
    public static double evaluate(Expr expr, double x) {
        return expr.accept(new Evaluator(x));
    }

    /** Like {@link #evaluate} but returns {@code NaN} where the expression is undefined. */
    public static double evaluateOrNaN(Expr expr, double x) {
        try {
            return evaluate(expr, x);
        } catch (UndefinedEvaluationException e) {
            return Double.NaN;
        }
    }

    /**
     * Evaluates a variable-free expression.
     *
     * @throws UndefinedEvaluationException if the value is undefined
     * @throws IllegalArgumentException if the expression mentions the variable
     */
    public static double evaluateConstant(Expr expr) {
        return expr.accept(new Evaluator(null));
    }

    @Override
    public Double visitVariable(Expr.Variable node) {
        if (x == null) {
            throw new IllegalArgumentException("Constant expected but found variable " + node.name());
        }
        return x;
    }

    @Override
    public Double visitNum(Expr.Num node) {
        return node.value().doubleValue();
    }

    @Override
    public Double visitConst(Expr.Const node) {
        return node.constant().value();
    }

    @Override
    public Double visitAdd(Expr.Add node) {
        return checked(node.left().accept(this) + node.right().accept(this));
    }

    @Override
    public Double visitSub(Expr.Sub node) {
        return checked(node.left().accept(this) - node.right().accept(this));
    }

    @Override
    public Double visitMul(Expr.Mul node) {
        return checked(node.left().accept(this) * node.right().accept(this));
    }

    @Override
    public Double visitDiv(Expr.Div node) {
        double numerator = node.numerator().accept(this);
        double denominator = node.denominator().accept(this);
        if (denominator == 0.0) {
            throw new UndefinedEvaluationException("division by zero in " + node);
        }
        return checked(numerator / denominator);
    }

    @Override
    public Double visitPow(Expr.Pow node) {
        double base = node.base().accept(this);
        Optional<Rational> rationalExponent = Exprs.rationalConstant(node.exponent());
        if (rationalExponent.isPresent()) {
            return rationalPower(node, base, rationalExponent.get());
        }
        double exponent = node.exponent().accept(this);
        if (base < 0) {
            throw new UndefinedEvaluationException("negative base " + base + " with non-rational exponent in " + node);
        }
        if (base == 0.0 && exponent <= 0) {
            throw new UndefinedEvaluationException("zero raised to a non-positive power in " + node);
        }
        return checked(Math.pow(base, exponent));
    }

    private double rationalPower(Expr.Pow node, double base, Rational exponent) {
        if (base == 0.0 && exponent.signum() < 0) {
            throw new UndefinedEvaluationException("zero raised to a negative power in " + node);
        }
        if (base >= 0 || exponent.isInteger()) {
            return checked(Math.pow(base, exponent.doubleValue()));
        }
        if (exponent.denominator().testBit(0)) {
            // odd root of a negative base: sign follows the numerator's parity
            double magnitude = Math.pow(-base, exponent.doubleValue());
            return checked(exponent.numerator().testBit(0) ? -magnitude : magnitude);
        }
        throw new UndefinedEvaluationException("even root of negative number " + base + " in " + node);
    }

    @Override
    public Double visitNeg(Expr.Neg node) {
        return -node.operand().accept(this);
    }

    @Override
    public Double visitCall(Expr.Call node) {
        double u = node.argument().accept(this);
        switch (node.function()) {
            case SIN:
                return checked(Math.sin(u));
            case COS:
                return checked(Math.cos(u));
            case TAN:
                return checked(Math.tan(u));
            case SQRT:
                if (u < 0) {
                    throw new UndefinedEvaluationException("square root of negative number " + u);
                }
                return Math.sqrt(u);
            case EXP:
                return checked(Math.exp(u));
            case ABS:
                return Math.abs(u);
            default:
                throw new IllegalStateException("Unhandled function: " + node.function());
        }
    }

    @Override
    public Double visitLog(Expr.Log node) {
        double u = node.argument().accept(this);
        if (u <= 0) {
            throw new UndefinedEvaluationException("logarithm of non-positive number " + u);
        }
        double value = Math.log(u);
        if (node.isNatural()) {
            return value;
        }
        return checked(value / Math.log(node.base().accept(this)));
    }

    private static double checked(double value) {
        if (Double.isNaN(value)) {
            throw new UndefinedEvaluationException("result is not a real number");
        }
        return value;
    }
}
