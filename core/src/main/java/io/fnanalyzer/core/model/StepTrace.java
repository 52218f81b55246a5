package io.fnanalyzer.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered derivation steps of one analysis, e.g. {@code "Step 1: Denominator x - 2 must not be
 * zero"}. Built once through a {@link Builder} and immutable afterwards.
 */
public final class StepTrace {

    private final TraceCategory category;
    private final List<String> lines;

    private StepTrace(TraceCategory category, List<String> lines) {
        this.category = category;
        this.lines = List.copyOf(lines);
    }

    public static Builder builder(TraceCategory category) {
        return new Builder(category);
    }

    public TraceCategory category() {
        return category;
    }

    /** All lines in order, numbered steps first followed by the conclusion. */
    public List<String> lines() {
        return lines;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepTrace other)) return false;
        return category == other.category && lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, lines);
    }

    @Override
    public String toString() {
        return category.title() + " trace " + lines;
    }

    /** Append-only accumulator. Not thread-safe; one per analysis run. */
    public static final class Builder {

        private final TraceCategory category;
        private final List<String> lines = new ArrayList<>();
        private int steps;
        private boolean built;

        private Builder(TraceCategory category) {
            this.category = Objects.requireNonNull(category, "category must not be null");
        }

        /** Appends a numbered step. */
        public Builder step(String text) {
            append("Step " + (++steps) + ": " + text);
            return this;
        }

        /** Appends an unnumbered closing line such as {@code "Domain: ℝ ∖ {2}"}. */
        public Builder conclusion(String text) {
            append(text);
            return this;
        }

        public int stepCount() {
            return steps;
        }

        public StepTrace build() {
            built = true;
            return new StepTrace(category, lines);
        }

        private void append(String line) {
            if (built) {
                throw new IllegalStateException(category.title() + " trace already built");
            }
            lines.add(Objects.requireNonNull(line, "line must not be null"));
        }
    }
}
