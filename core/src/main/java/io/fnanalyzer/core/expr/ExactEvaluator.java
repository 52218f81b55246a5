package io.fnanalyzer.core.expr;

import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.error.UndefinedEvaluationException;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Exact evaluation at a rational point. Produces a value only when every operation stays in ℚ
 * (field operations, integer powers, perfect-square roots, and a few special values such as
 * {@code sin(0)} or {@code log(1)}); otherwise the result is empty and callers fall back to
 * {@link Evaluator}.
 *
 * <p>Real-undefined operations detected exactly raise {@link UndefinedEvaluationException}.
 */
public final class ExactEvaluator implements Expr.Visitor<Optional<Rational>> {

    /** Largest integer exponent evaluated exactly; larger powers are left to floating point. */
    private static final int MAX_EXACT_EXPONENT = 256;

    private final Rational x;

    private ExactEvaluator(Rational x) {
        this.x = x;
    }

    /**
     * Evaluates {@code expr} at {@code x}; a {@code null} x treats the variable as unknown.
     *
     * @throws UndefinedEvaluationException if the expression is exactly undefined at x
     */
    public static Optional<Rational> evaluate(Expr expr, Rational x) {
        return expr.accept(new ExactEvaluator(x));
    }

    @Override
    public Optional<Rational> visitVariable(Expr.Variable node) {
        return Optional.ofNullable(x);
    }

    @Override
    public Optional<Rational> visitNum(Expr.Num node) {
        return Optional.of(node.value());
    }

    @Override
    public Optional<Rational> visitConst(Expr.Const node) {
        return Optional.empty();
    }

    @Override
    public Optional<Rational> visitAdd(Expr.Add node) {
        Optional<Rational> left = node.left().accept(this);
        Optional<Rational> right = node.right().accept(this);
        return left.isPresent() && right.isPresent() ? Optional.of(left.get().add(right.get())) : Optional.empty();
    }

    @Override
    public Optional<Rational> visitSub(Expr.Sub node) {
        Optional<Rational> left = node.left().accept(this);
        Optional<Rational> right = node.right().accept(this);
        return left.isPresent() && right.isPresent()
                ? Optional.of(left.get().subtract(right.get()))
                : Optional.empty();
    }

    @Override
    public Optional<Rational> visitMul(Expr.Mul node) {
        Optional<Rational> left = node.left().accept(this);
        Optional<Rational> right = node.right().accept(this);
        return left.isPresent() && right.isPresent()
                ? Optional.of(left.get().multiply(right.get()))
                : Optional.empty();
    }

    @Override
    public Optional<Rational> visitDiv(Expr.Div node) {
        Optional<Rational> numerator = node.numerator().accept(this);
        Optional<Rational> denominator = node.denominator().accept(this);
        if (denominator.isPresent() && denominator.get().isZero()) {
            throw new UndefinedEvaluationException("division by zero in " + node);
        }
        return numerator.isPresent() && denominator.isPresent()
                ? Optional.of(numerator.get().divide(denominator.get()))
                : Optional.empty();
    }

    @Override
    public Optional<Rational> visitPow(Expr.Pow node) {
        Optional<Rational> base = node.base().accept(this);
        Optional<Rational> exponent = node.exponent().accept(this);
        if (base.isEmpty() || exponent.isEmpty()) {
            return Optional.empty();
        }
        Rational b = base.get();
        Rational e = exponent.get();
        if (b.isZero() && e.signum() < 0) {
            throw new UndefinedEvaluationException("zero raised to a negative power in " + node);
        }
        if (e.isInteger()) {
            return e.intValueExact()
                    .filter(n -> Math.abs(n) <= MAX_EXACT_EXPONENT)
                    .map(b::pow);
        }
        if (b.isZero()) {
            return Optional.of(Rational.ZERO);
        }
        boolean evenRoot = !e.denominator().testBit(0);
        if (b.signum() < 0 && evenRoot) {
            throw new UndefinedEvaluationException("even root of negative number " + b + " in " + node);
        }
        if (e.denominator().equals(BigInteger.TWO)) {
            return b.sqrtExact()
                    .flatMap(root -> e.numerator().abs().bitLength() <= 9
                            ? Optional.of(root.pow(e.numerator().intValue()))
                            : Optional.empty());
        }
        return Optional.empty();
    }

    @Override
    public Optional<Rational> visitNeg(Expr.Neg node) {
        return node.operand().accept(this).map(Rational::negate);
    }

    @Override
    public Optional<Rational> visitCall(Expr.Call node) {
        Optional<Rational> argument = node.argument().accept(this);
        if (argument.isEmpty()) {
            return Optional.empty();
        }
        Rational u = argument.get();
        switch (node.function()) {
            case SQRT:
                if (u.signum() < 0) {
                    throw new UndefinedEvaluationException("square root of negative number " + u);
                }
                return u.sqrtExact();
            case ABS:
                return Optional.of(u.abs());
            case SIN:
            case TAN:
                return u.isZero() ? Optional.of(Rational.ZERO) : Optional.empty();
            case COS:
            case EXP:
                return u.isZero() ? Optional.of(Rational.ONE) : Optional.empty();
            default:
                throw new IllegalStateException("Unhandled function: " + node.function());
        }
    }

    @Override
    public Optional<Rational> visitLog(Expr.Log node) {
        Optional<Rational> argument = node.argument().accept(this);
        if (argument.isEmpty()) {
            return Optional.empty();
        }
        Rational u = argument.get();
        if (u.signum() <= 0) {
            throw new UndefinedEvaluationException("logarithm of non-positive number " + u);
        }
        if (u.equals(Rational.ONE)) {
            return Optional.of(Rational.ZERO);
        }
        if (node.isNatural()) {
            return Optional.empty();
        }
        return node.base().accept(this).flatMap(base -> integerLogarithm(u, base));
    }

    /** {@code k} with {@code base^k = u} for small integer k, e.g. {@code log(8, 2) = 3}. */
    private static Optional<Rational> integerLogarithm(Rational u, Rational base) {
        Rational power = Rational.ONE;
        Rational inversePower = Rational.ONE;
        Rational inverse = base.reciprocal();
        for (int k = 1; k <= 64; k++) {
            power = power.multiply(base);
            inversePower = inversePower.multiply(inverse);
            if (power.equals(u)) {
                return Optional.of(Rational.of(k));
            }
            if (inversePower.equals(u)) {
                return Optional.of(Rational.of(-k));
            }
        }
        return Optional.empty();
    }
}
