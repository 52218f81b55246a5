package io.fnanalyzer.core.expr;

import io.fnanalyzer.core.algebra.Rational;

/**
 * Renders an {@link Expr} in infix notation with the minimum parentheses needed to re-parse it,
 * e.g. {@code (x + 1)/(x - 2)}, {@code -x^2}, {@code log(x, 2)}.
 */
public final class ExprPrinter implements Expr.Visitor<String> {

    private static final int ADDITIVE = 1;
    private static final int MULTIPLICATIVE = 2;
    private static final int UNARY = 3;
    private static final int POWER = 4;
    private static final int ATOM = 5;

    private static final ExprPrinter INSTANCE = new ExprPrinter();

    private ExprPrinter() {}

    public static String print(Expr expr) {
        return expr.accept(INSTANCE);
    }

    @Override
    public String visitVariable(Expr.Variable node) {
        return node.name();
    }

    @Override
    public String visitNum(Expr.Num node) {
        return node.value().toString();
    }

    @Override
    public String visitConst(Expr.Const node) {
        return node.constant().symbol();
    }

    @Override
    public String visitAdd(Expr.Add node) {
        return wrap(node.left(), ADDITIVE) + " + " + wrapSigned(node.right(), ADDITIVE);
    }

    @Override
    public String visitSub(Expr.Sub node) {
        return wrap(node.left(), ADDITIVE) + " - " + wrapSigned(node.right(), MULTIPLICATIVE);
    }

    @Override
    public String visitMul(Expr.Mul node) {
        return wrap(node.left(), MULTIPLICATIVE) + "*" + wrapSigned(node.right(), UNARY);
    }

    @Override
    public String visitDiv(Expr.Div node) {
        return wrap(node.numerator(), MULTIPLICATIVE) + "/" + wrapSigned(node.denominator(), POWER);
    }

    @Override
    public String visitPow(Expr.Pow node) {
        return wrap(node.base(), ATOM) + "^" + wrap(node.exponent(), POWER);
    }

    @Override
    public String visitNeg(Expr.Neg node) {
        return "-" + wrap(node.operand(), POWER);
    }

    @Override
    public String visitCall(Expr.Call node) {
        return node.function().symbol() + "(" + print(node.argument()) + ")";
    }

    @Override
    public String visitLog(Expr.Log node) {
        if (node.isNatural()) {
            return "log(" + print(node.argument()) + ")";
        }
        return "log(" + print(node.argument()) + ", " + print(node.base()) + ")";
    }

    private static String wrap(Expr child, int minimum) {
        String text = print(child);
        return precedence(child) < minimum ? "(" + text + ")" : text;
    }

    /** Like {@link #wrap} but also parenthesizes a leading minus sign. */
    private static String wrapSigned(Expr child, int minimum) {
        if (child instanceof Expr.Neg || (child instanceof Expr.Num num && num.value().signum() < 0)) {
            return "(" + print(child) + ")";
        }
        return wrap(child, minimum);
    }

    private static int precedence(Expr expr) {
        if (expr instanceof Expr.Add || expr instanceof Expr.Sub) {
            return ADDITIVE;
        }
        if (expr instanceof Expr.Mul || expr instanceof Expr.Div) {
            return MULTIPLICATIVE;
        }
        if (expr instanceof Expr.Neg) {
            return UNARY;
        }
        if (expr instanceof Expr.Pow) {
            return POWER;
        }
        if (expr instanceof Expr.Num num) {
            Rational value = num.value();
            if (value.signum() < 0) {
                return UNARY;
            }
            return value.isInteger() ? ATOM : MULTIPLICATIVE;
        }
        return ATOM;
    }
}
