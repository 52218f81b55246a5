package io.fnanalyzer.core.expr;

import io.fnanalyzer.core.algebra.PiLinear;
import io.fnanalyzer.core.algebra.Rational;
import java.util.Optional;

/**
 * An expression of the shape {@code slope·x + intercept} where both coefficients are
 * {@link PiLinear}, e.g. {@code 2x - π/3} or {@code πx}. Used to turn trigonometric zeros and
 * poles into exact periodic families.
 *
 * @param slope     coefficient of the variable
 * @param intercept constant term
 */
public record AffineForm(PiLinear slope, PiLinear intercept) {

    private static final AffineForm IDENTITY = new AffineForm(PiLinear.of(Rational.ONE), PiLinear.ZERO);

    /** Decomposes {@code expr}; empty if it is not affine with π-linear coefficients. */
    public static Optional<AffineForm> of(Expr expr) {
        return expr.accept(Decomposer.INSTANCE);
    }

    public static AffineForm constant(PiLinear value) {
        return new AffineForm(PiLinear.ZERO, value);
    }

    public boolean isConstant() {
        return slope.isZero();
    }

    /** Solves {@code slope·x + intercept = target} for x, if the division stays π-linear. */
    public Optional<PiLinear> solve(PiLinear target) {
        return target.subtract(intercept).divide(slope);
    }

    private AffineForm add(AffineForm other) {
        return new AffineForm(slope.add(other.slope), intercept.add(other.intercept));
    }

    private AffineForm negate() {
        return new AffineForm(slope.negate(), intercept.negate());
    }

    private Optional<AffineForm> times(PiLinear factor) {
        Optional<PiLinear> s = slope.multiply(factor);
        Optional<PiLinear> i = intercept.multiply(factor);
        return s.isPresent() && i.isPresent() ? Optional.of(new AffineForm(s.get(), i.get())) : Optional.empty();
    }

    private Optional<AffineForm> dividedBy(PiLinear divisor) {
        if (slope.isZero()) {
            return intercept.divide(divisor).map(AffineForm::constant);
        }
        Optional<PiLinear> s = slope.divide(divisor);
        Optional<PiLinear> i = intercept.divide(divisor);
        return s.isPresent() && i.isPresent() ? Optional.of(new AffineForm(s.get(), i.get())) : Optional.empty();
    }

    private static final class Decomposer implements Expr.Visitor<Optional<AffineForm>> {

        private static final Decomposer INSTANCE = new Decomposer();

        @Override
        public Optional<AffineForm> visitVariable(Expr.Variable node) {
            return Optional.of(IDENTITY);
        }

        @Override
        public Optional<AffineForm> visitNum(Expr.Num node) {
            return Optional.of(constant(PiLinear.of(node.value())));
        }

        @Override
        public Optional<AffineForm> visitConst(Expr.Const node) {
            return node.constant() == NamedConstant.PI ? Optional.of(constant(PiLinear.PI)) : Optional.empty();
        }

        @Override
        public Optional<AffineForm> visitAdd(Expr.Add node) {
            return both(node.left(), node.right()).map(pair -> pair[0].add(pair[1]));
        }

        @Override
        public Optional<AffineForm> visitSub(Expr.Sub node) {
            return both(node.left(), node.right()).map(pair -> pair[0].add(pair[1].negate()));
        }

        @Override
        public Optional<AffineForm> visitMul(Expr.Mul node) {
            return both(node.left(), node.right()).flatMap(pair -> {
                if (pair[1].isConstant()) {
                    return pair[0].times(pair[1].intercept());
                }
                if (pair[0].isConstant()) {
                    return pair[1].times(pair[0].intercept());
                }
                return Optional.empty();
            });
        }

        @Override
        public Optional<AffineForm> visitDiv(Expr.Div node) {
            return both(node.numerator(), node.denominator()).flatMap(pair -> pair[1].isConstant()
                    ? pair[0].dividedBy(pair[1].intercept())
                    : Optional.empty());
        }

        @Override
        public Optional<AffineForm> visitPow(Expr.Pow node) {
            Optional<Integer> exponent = Exprs.integerConstant(node.exponent());
            if (exponent.isEmpty()) {
                return Optional.empty();
            }
            int n = exponent.get();
            if (n == 1) {
                return node.base().accept(this);
            }
            return Exprs.rationalConstant(node)
                    .map(value -> constant(PiLinear.of(value)));
        }

        @Override
        public Optional<AffineForm> visitNeg(Expr.Neg node) {
            return node.operand().accept(this).map(AffineForm::negate);
        }

        @Override
        public Optional<AffineForm> visitCall(Expr.Call node) {
            return Exprs.rationalConstant(node).map(value -> constant(PiLinear.of(value)));
        }

        @Override
        public Optional<AffineForm> visitLog(Expr.Log node) {
            return Exprs.rationalConstant(node).map(value -> constant(PiLinear.of(value)));
        }

        private Optional<AffineForm[]> both(Expr left, Expr right) {
            Optional<AffineForm> l = left.accept(this);
            if (l.isEmpty()) {
                return Optional.empty();
            }
            return right.accept(this).map(r -> new AffineForm[] {l.get(), r});
        }
    }
}
