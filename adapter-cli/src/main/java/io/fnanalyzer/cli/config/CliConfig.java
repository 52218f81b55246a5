package io.fnanalyzer.cli.config;

import io.fnanalyzer.core.algebra.SolveBudget;
import io.fnanalyzer.core.engine.AnalyzerConfig;
import java.util.Objects;

/**
 * Settings of the command-line front end: the analyzer settings plus logging.
 *
 * @param analyzer      settings handed to the core analyzer
 * @param loggingFormat {@code text} or {@code json} (default {@code text})
 * @param loggingLevel  root log level (default {@code WARN})
 */
public record CliConfig(AnalyzerConfig analyzer, String loggingFormat, String loggingLevel) {

    public CliConfig {
        Objects.requireNonNull(analyzer, "analyzer must not be null");
        Objects.requireNonNull(loggingFormat, "loggingFormat must not be null");
        Objects.requireNonNull(loggingLevel, "loggingLevel must not be null");
    }

    /** Creates a new builder with all defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link CliConfig}. Analyzer fields are collected individually so that YAML and
     * environment overrides can be applied one at a time before validation.
     */
    public static final class Builder {
        private String variable = AnalyzerConfig.DEFAULT.variable();
        private double windowMin = AnalyzerConfig.DEFAULT.windowMin();
        private double windowMax = AnalyzerConfig.DEFAULT.windowMax();
        private int sampleCount = AnalyzerConfig.DEFAULT.sampleCount();
        private int decimalPlaces = AnalyzerConfig.DEFAULT.decimalPlaces();
        private int maxDegree = SolveBudget.DEFAULT.maxDegree();
        private int maxIterations = SolveBudget.DEFAULT.maxIterations();
        private long maxSolveMs = SolveBudget.DEFAULT.maxSolveMs();
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        private Builder() {}

        public Builder variable(String variable) {
            this.variable = variable;
            return this;
        }

        public Builder windowMin(double windowMin) {
            this.windowMin = windowMin;
            return this;
        }

        public Builder windowMax(double windowMax) {
            this.windowMax = windowMax;
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

        public Builder maxDegree(int maxDegree) {
            this.maxDegree = maxDegree;
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder maxSolveMs(long maxSolveMs) {
            this.maxSolveMs = maxSolveMs;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /** @throws IllegalArgumentException if an analyzer setting is out of range */
        public CliConfig build() {
            AnalyzerConfig analyzer = AnalyzerConfig.builder()
                    .variable(variable)
                    .window(windowMin, windowMax)
                    .sampleCount(sampleCount)
                    .decimalPlaces(decimalPlaces)
                    .solveBudget(new SolveBudget(maxDegree, maxIterations, maxSolveMs))
                    .build();
            return new CliConfig(analyzer, loggingFormat, loggingLevel);
        }
    }
}
