package io.fnanalyzer.core.expr;

import io.fnanalyzer.core.algebra.Rational;
import java.util.Objects;

/**
 * Immutable expression tree over a single real variable. Built once by {@link ExpressionParser}
 * and only read afterwards.
 *
 * <p>The hierarchy is sealed; traversals implement {@link Visitor}, so adding a node kind is a
 * compile error in every analyzer until it is handled.
 */
public sealed interface Expr
        permits Expr.Variable,
                Expr.Num,
                Expr.Const,
                Expr.Add,
                Expr.Sub,
                Expr.Mul,
                Expr.Div,
                Expr.Pow,
                Expr.Neg,
                Expr.Call,
                Expr.Log {

    <R> R accept(Visitor<R> visitor);

    /** One method per node kind. */
    interface Visitor<R> {
        R visitVariable(Variable node);

        R visitNum(Num node);

        R visitConst(Const node);

        R visitAdd(Add node);

        R visitSub(Sub node);

        R visitMul(Mul node);

        R visitDiv(Div node);

        R visitPow(Pow node);

        R visitNeg(Neg node);

        R visitCall(Call node);

        R visitLog(Log node);
    }

    // ── Factories ──

    static Num num(long value) {
        return new Num(Rational.of(value));
    }

    static Num num(Rational value) {
        return new Num(value);
    }

    // ── Node kinds ──

    /** The free variable. */
    record Variable(String name) implements Expr {
        public Variable {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    /** Exact rational literal. */
    record Num(Rational value) implements Expr {
        public Num {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNum(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    /** Named irrational constant ({@code π}, {@code e}). */
    record Const(NamedConstant constant) implements Expr {
        public Const {
            Objects.requireNonNull(constant, "constant must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConst(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    record Add(Expr left, Expr right) implements Expr {
        public Add {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAdd(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    record Sub(Expr left, Expr right) implements Expr {
        public Sub {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSub(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    record Mul(Expr left, Expr right) implements Expr {
        public Mul {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMul(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    record Div(Expr numerator, Expr denominator) implements Expr {
        public Div {
            Objects.requireNonNull(numerator, "numerator must not be null");
            Objects.requireNonNull(denominator, "denominator must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDiv(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    record Pow(Expr base, Expr exponent) implements Expr {
        public Pow {
            Objects.requireNonNull(base, "base must not be null");
            Objects.requireNonNull(exponent, "exponent must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPow(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    record Neg(Expr operand) implements Expr {
        public Neg {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNeg(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    /** Single-argument function application. */
    record Call(MathFunction function, Expr argument) implements Expr {
        public Call {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(argument, "argument must not be null");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }

    /**
     * Logarithm of {@code argument}. A {@code null} base means the natural logarithm; otherwise
     * the base is a constant expression validated at parse time.
     */
    record Log(Expr argument, Expr base) implements Expr {
        public Log {
            Objects.requireNonNull(argument, "argument must not be null");
        }

        public boolean isNatural() {
            return base == null;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLog(this);
        }

        @Override
        public String toString() {
            return ExprPrinter.print(this);
        }
    }
}
