package io.fnanalyzer.core.model;

import java.util.Objects;

/**
 * The values the expression takes over its domain.
 *
 * @param excluded    output values that are never attained
 * @param description rendered range, e.g. {@code [-4, ∞)}
 * @param strategyId  id of the range strategy that produced the answer
 * @param approximate whether the answer comes from numeric sampling
 * @param trace       derivation steps
 */
public record RangeResult(
        ExcludedSet excluded, String description, String strategyId, boolean approximate, StepTrace trace) {

    public RangeResult {
        Objects.requireNonNull(excluded, "excluded must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(strategyId, "strategyId must not be null");
        Objects.requireNonNull(trace, "trace must not be null");
    }
}
