package io.fnanalyzer.core.expr;

import io.fnanalyzer.core.algebra.Rational;
import java.util.Optional;

/**
 * Structural sign reasoning: proves that an expression is positive (or non-negative) wherever it
 * is defined, e.g. {@code exp(u)}, {@code x^2 + 1}, {@code sqrt(u) + 2}. A {@code false} answer
 * means "not proven", not "negative somewhere".
 */
public final class SignInference {

    private SignInference() {}

    /** {@code true} if the expression is provably {@code > 0} wherever defined. */
    public static boolean isPositive(Expr expr) {
        if (expr instanceof Expr.Num num) {
            return num.value().signum() > 0;
        }
        if (expr instanceof Expr.Const) {
            return true;
        }
        if (expr instanceof Expr.Add add) {
            return (isPositive(add.left()) && isNonNegative(add.right()))
                    || (isNonNegative(add.left()) && isPositive(add.right()));
        }
        if (expr instanceof Expr.Sub sub) {
            return isPositive(sub.left()) && isNonPositive(sub.right())
                    || isNonNegative(sub.left()) && isNegative(sub.right());
        }
        if (expr instanceof Expr.Mul mul) {
            return (isPositive(mul.left()) && isPositive(mul.right()))
                    || (isNegative(mul.left()) && isNegative(mul.right()));
        }
        if (expr instanceof Expr.Div div) {
            return (isPositive(div.numerator()) && isPositive(div.denominator()))
                    || (isNegative(div.numerator()) && isNegative(div.denominator()));
        }
        if (expr instanceof Expr.Pow pow) {
            return isPositive(pow.base());
        }
        if (expr instanceof Expr.Neg neg) {
            return isNegative(neg.operand());
        }
        if (expr instanceof Expr.Call call) {
            switch (call.function()) {
                case EXP:
                    return true;
                case SQRT:
                case ABS:
                    return isPositive(call.argument()) || isNegative(call.argument());
                default:
                    return false;
            }
        }
        return false;
    }

    /** {@code true} if the expression is provably {@code >= 0} wherever defined. */
    public static boolean isNonNegative(Expr expr) {
        if (isPositive(expr)) {
            return true;
        }
        if (expr instanceof Expr.Num num) {
            return num.value().signum() >= 0;
        }
        if (expr instanceof Expr.Add add) {
            return isNonNegative(add.left()) && isNonNegative(add.right());
        }
        if (expr instanceof Expr.Sub sub) {
            return isNonNegative(sub.left()) && isNonPositive(sub.right());
        }
        if (expr instanceof Expr.Mul mul) {
            return (isNonNegative(mul.left()) && isNonNegative(mul.right()))
                    || (isNonPositive(mul.left()) && isNonPositive(mul.right()));
        }
        if (expr instanceof Expr.Div div) {
            return isNonNegative(div.numerator()) && isPositive(div.denominator());
        }
        if (expr instanceof Expr.Pow pow) {
            return isNonNegative(pow.base()) || hasEvenIntegerExponent(pow);
        }
        if (expr instanceof Expr.Neg neg) {
            return isNonPositive(neg.operand());
        }
        if (expr instanceof Expr.Call call) {
            return call.function() == MathFunction.SQRT || call.function() == MathFunction.ABS;
        }
        return false;
    }

    private static boolean isNegative(Expr expr) {
        if (expr instanceof Expr.Num num) {
            return num.value().signum() < 0;
        }
        if (expr instanceof Expr.Neg neg) {
            return isPositive(neg.operand());
        }
        return false;
    }

    private static boolean isNonPositive(Expr expr) {
        if (expr instanceof Expr.Num num) {
            return num.value().signum() <= 0;
        }
        if (expr instanceof Expr.Neg neg) {
            return isNonNegative(neg.operand());
        }
        return false;
    }

    private static boolean hasEvenIntegerExponent(Expr.Pow pow) {
        Optional<Rational> exponent = Exprs.rationalConstant(pow.exponent());
        return exponent.isPresent()
                && exponent.get().isInteger()
                && !exponent.get().numerator().testBit(0);
    }
}
