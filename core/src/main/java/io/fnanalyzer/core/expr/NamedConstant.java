package io.fnanalyzer.core.expr;

/** Irrational constants that may appear in expressions and point input. */
public enum NamedConstant {
    PI("π", Math.PI),
    E("e", Math.E);

    private final String symbol;
    private final double value;

    NamedConstant(String symbol, double value) {
        this.symbol = symbol;
        this.value = value;
    }

    public String symbol() {
        return symbol;
    }

    public double value() {
        return value;
    }
}
