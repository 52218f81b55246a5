package io.fnanalyzer.core.model;

import io.fnanalyzer.core.algebra.RealNumber;
import java.util.List;
import java.util.Objects;

/**
 * Where the expression is defined.
 *
 * @param excluded         real numbers removed from ℝ
 * @param description      rendered domain, e.g. {@code ℝ ∖ {2}} or {@code [1, ∞)}
 * @param removablePoints  excluded points where numerator and denominator vanish together
 * @param approximate      whether some exclusion was located numerically
 * @param trace            derivation steps
 */
public record DomainResult(
        ExcludedSet excluded,
        String description,
        List<RealNumber> removablePoints,
        boolean approximate,
        StepTrace trace) {

    public DomainResult {
        Objects.requireNonNull(excluded, "excluded must not be null");
        Objects.requireNonNull(description, "description must not be null");
        removablePoints = List.copyOf(removablePoints);
        Objects.requireNonNull(trace, "trace must not be null");
    }

    /** Whether {@code x} belongs to the domain. */
    public boolean contains(double x) {
        return !excluded.contains(x);
    }
}
