package io.fnanalyzer.core.expr;

import io.fnanalyzer.core.algebra.Polynomial;
import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.algebra.RationalFunction;
import java.util.Optional;
import java.util.function.BinaryOperator;

/**
 * Converts an expression built only from the variable, rational literals, the four field
 * operations and constant integer powers into a {@link RationalFunction}. Anything else (named
 * constants, function calls without a rational value, non-integer exponents, degrees above the limit) yields empty.
 */
public final class RationalConverter implements Expr.Visitor<Optional<RationalFunction>> {

    private final int maxDegree;

    private RationalConverter(int maxDegree) {
        this.maxDegree = maxDegree;
    }

    /** Converts {@code expr}, keeping common factors of numerator and denominator. */
    public static Optional<RationalFunction> convert(Expr expr, int maxDegree) {
        return expr.accept(new RationalConverter(maxDegree));
    }

    @Override
    public Optional<RationalFunction> visitVariable(Expr.Variable node) {
        return Optional.of(RationalFunction.of(Polynomial.X));
    }

    @Override
    public Optional<RationalFunction> visitNum(Expr.Num node) {
        return Optional.of(RationalFunction.of(Polynomial.constant(node.value())));
    }

    @Override
    public Optional<RationalFunction> visitConst(Expr.Const node) {
        return Optional.empty();
    }

    @Override
    public Optional<RationalFunction> visitAdd(Expr.Add node) {
        return bounded(combine(node.left(), node.right(), RationalFunction::add));
    }

    @Override
    public Optional<RationalFunction> visitSub(Expr.Sub node) {
        return bounded(combine(node.left(), node.right(), RationalFunction::subtract));
    }

    @Override
    public Optional<RationalFunction> visitMul(Expr.Mul node) {
        return bounded(combine(node.left(), node.right(), RationalFunction::multiply));
    }

    @Override
    public Optional<RationalFunction> visitDiv(Expr.Div node) {
        Optional<RationalFunction> denominator = node.denominator().accept(this);
        if (denominator.isEmpty() || denominator.get().numerator().isZero()) {
            return Optional.empty();
        }
        return bounded(node.numerator().accept(this).map(n -> n.divide(denominator.get())));
    }

    @Override
    public Optional<RationalFunction> visitPow(Expr.Pow node) {
        Optional<Rational> exponent = Exprs.rationalConstant(node.exponent());
        if (exponent.isEmpty() || !exponent.get().isInteger()) {
            return Optional.empty();
        }
        Optional<Integer> n = exponent.get().intValueExact().filter(v -> Math.abs(v) <= maxDegree);
        if (n.isEmpty()) {
            return Optional.empty();
        }
        Optional<RationalFunction> base = node.base().accept(this);
        if (base.isEmpty() || (n.get() < 0 && base.get().numerator().isZero())) {
            return Optional.empty();
        }
        return bounded(Optional.of(base.get().pow(n.get())));
    }

    @Override
    public Optional<RationalFunction> visitNeg(Expr.Neg node) {
        return node.operand().accept(this).map(RationalFunction::negate);
    }

    @Override
    public Optional<RationalFunction> visitCall(Expr.Call node) {
        return constant(node);
    }

    @Override
    public Optional<RationalFunction> visitLog(Expr.Log node) {
        return constant(node);
    }

    private Optional<RationalFunction> combine(
            Expr left, Expr right, BinaryOperator<RationalFunction> op) {
        Optional<RationalFunction> l = left.accept(this);
        if (l.isEmpty()) {
            return Optional.empty();
        }
        return right.accept(this).map(r -> op.apply(l.get(), r));
    }

    private static Optional<RationalFunction> constant(Expr node) {
        return Exprs.rationalConstant(node).map(value -> RationalFunction.of(Polynomial.constant(value)));
    }

    private Optional<RationalFunction> bounded(Optional<RationalFunction> candidate) {
        return candidate.filter(
                rf -> rf.numerator().degree() <= maxDegree && rf.denominator().degree() <= maxDegree);
    }
}
