package io.fnanalyzer.core.expr;

import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.error.UndefinedEvaluationException;
import java.util.Optional;

/** Static queries over expression trees. */
public final class Exprs {

    private Exprs() {}

    /** {@code true} if the free variable occurs anywhere in the tree. */
    public static boolean containsVariable(Expr expr) {
        return expr.accept(VariableFinder.INSTANCE);
    }

    /**
     * Exact rational value of a variable-free expression, e.g. {@code 3/2} or {@code 2^-1}.
     * Empty if the expression mentions the variable, an irrational constant, or is undefined.
     */
    public static Optional<Rational> rationalConstant(Expr expr) {
        if (containsVariable(expr)) {
            return Optional.empty();
        }
        try {
            return ExactEvaluator.evaluate(expr, null);
        } catch (UndefinedEvaluationException e) {
            return Optional.empty();
        }
    }

    /** Integer value of a variable-free expression, if it has one. */
    public static Optional<Integer> integerConstant(Expr expr) {
        return rationalConstant(expr).flatMap(Rational::intValueExact);
    }

    private static final class VariableFinder implements Expr.Visitor<Boolean> {

        private static final VariableFinder INSTANCE = new VariableFinder();

        @Override
        public Boolean visitVariable(Expr.Variable node) {
            return true;
        }

        @Override
        public Boolean visitNum(Expr.Num node) {
            return false;
        }

        @Override
        public Boolean visitConst(Expr.Const node) {
            return false;
        }

        @Override
        public Boolean visitAdd(Expr.Add node) {
            return node.left().accept(this) || node.right().accept(this);
        }

        @Override
        public Boolean visitSub(Expr.Sub node) {
            return node.left().accept(this) || node.right().accept(this);
        }

        @Override
        public Boolean visitMul(Expr.Mul node) {
            return node.left().accept(this) || node.right().accept(this);
        }

        @Override
        public Boolean visitDiv(Expr.Div node) {
            return node.numerator().accept(this) || node.denominator().accept(this);
        }

        @Override
        public Boolean visitPow(Expr.Pow node) {
            return node.base().accept(this) || node.exponent().accept(this);
        }

        @Override
        public Boolean visitNeg(Expr.Neg node) {
            return node.operand().accept(this);
        }

        @Override
        public Boolean visitCall(Expr.Call node) {
            return node.argument().accept(this);
        }

        @Override
        public Boolean visitLog(Expr.Log node) {
            return node.argument().accept(this) || (!node.isNatural() && node.base().accept(this));
        }
    }
}
