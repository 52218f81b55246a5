package io.fnanalyzer.core.engine;

import io.fnanalyzer.core.algebra.SolveBudget;
import java.util.Objects;

/**
 * Settings shared by all analyzers.
 *
 * <p>Use {@link #builder()} to construct instances; every field has a default.
 *
 * @param variable      name of the free variable (default {@code x})
 * @param windowMin     left end of the visible window used for numeric scans (default -10)
 * @param windowMax     right end of the visible window (default 10)
 * @param sampleCount   samples per numeric scan, window ends included (default 2001)
 * @param decimalPlaces digits after the decimal point in rendered evaluations (default 4)
 * @param solveBudget   limits for each symbolic solve
 */
public record AnalyzerConfig(
        String variable,
        double windowMin,
        double windowMax,
        int sampleCount,
        int decimalPlaces,
        SolveBudget solveBudget) {

    /** All defaults. */
    public static final AnalyzerConfig DEFAULT = builder().build();

    public AnalyzerConfig {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(solveBudget, "solveBudget must not be null");
        if (variable.isBlank()) {
            throw new IllegalArgumentException("variable must not be blank");
        }
        if (!(windowMin < windowMax) || Double.isInfinite(windowMin) || Double.isInfinite(windowMax)) {
            throw new IllegalArgumentException(
                    "window must be finite with min < max, got [" + windowMin + ", " + windowMax + "]");
        }
        if (sampleCount < 11) {
            throw new IllegalArgumentException("sampleCount must be at least 11, got: " + sampleCount);
        }
        if (decimalPlaces < 0 || decimalPlaces > 12) {
            throw new IllegalArgumentException("decimalPlaces must be between 0 and 12, got: " + decimalPlaces);
        }
    }

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link AnalyzerConfig}. */
    public static final class Builder {
        private String variable = "x";
        private double windowMin = -10;
        private double windowMax = 10;
        private int sampleCount = 2001;
        private int decimalPlaces = 4;
        private SolveBudget solveBudget = SolveBudget.DEFAULT;

        Builder() {}

        public Builder variable(String variable) {
            this.variable = variable;
            return this;
        }

        public Builder window(double min, double max) {
            this.windowMin = min;
            this.windowMax = max;
            return this;
        }

        public Builder sampleCount(int sampleCount) {
            this.sampleCount = sampleCount;
            return this;
        }

        public Builder decimalPlaces(int decimalPlaces) {
            this.decimalPlaces = decimalPlaces;
            return this;
        }

        public Builder solveBudget(SolveBudget solveBudget) {
            this.solveBudget = solveBudget;
            return this;
        }

        /** @throws IllegalArgumentException if a value is out of range */
        public AnalyzerConfig build() {
            return new AnalyzerConfig(variable, windowMin, windowMax, sampleCount, decimalPlaces, solveBudget);
        }
    }
}
