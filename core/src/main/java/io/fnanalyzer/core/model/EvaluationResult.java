package io.fnanalyzer.core.model;

import io.fnanalyzer.core.algebra.RealNumber;
import java.util.Objects;
import java.util.Optional;

/**
 * Value of the expression at a requested point.
 *
 * @param x               the requested input
 * @param y               the value, absent when the substitution is undefined
 * @param outsideDomain   whether x is excluded from the domain (a warning, not a failure)
 * @param undefinedReason why x is outside the domain, or why the substitution failed
 * @param trace           derivation steps
 */
public record EvaluationResult(
        RealNumber x,
        Optional<RealNumber> y,
        boolean outsideDomain,
        Optional<String> undefinedReason,
        StepTrace trace) {

    public EvaluationResult {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        Objects.requireNonNull(undefinedReason, "undefinedReason must not be null");
        Objects.requireNonNull(trace, "trace must not be null");
    }

    /** {@code (x, f(x))} when defined. */
    public Optional<Point> point() {
        return y.map(value -> new Point(x, value));
    }

    /** The value with a fixed number of decimals, e.g. {@code -5.0000}, or {@code undefined}. */
    public String formatted(int decimalPlaces) {
        return y.map(value -> value.decimal(decimalPlaces)).orElse("undefined");
    }
}
