package io.fnanalyzer.core.expr;

import java.util.Arrays;
import java.util.Optional;

/** Single-argument functions accepted by the parser. Logarithms are modelled by {@link Expr.Log}. */
public enum MathFunction {
    SIN("sin"),
    COS("cos"),
    TAN("tan"),
    SQRT("sqrt"),
    EXP("exp"),
    ABS("abs");

    private final String symbol;

    MathFunction(String symbol) {
        this.symbol = symbol;
    }

    /** Name used when printing, e.g. {@code "sin"}. */
    public String symbol() {
        return symbol;
    }

    /** {@code true} for sin, cos and tan. */
    public boolean isTrigonometric() {
        return this == SIN || this == COS || this == TAN;
    }

    /** Looks up a function by its printed name. */
    public static Optional<MathFunction> bySymbol(String name) {
        return Arrays.stream(values()).filter(f -> f.symbol.equals(name)).findFirst();
    }
}
