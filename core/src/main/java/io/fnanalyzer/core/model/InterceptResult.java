package io.fnanalyzer.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Where the curve meets the axes.
 *
 * @param yIntercept  {@code (0, f(0))}, absent when 0 is outside the domain
 * @param xIntercepts zeros of f, ascending and distinct
 * @param approximate whether some zero was located numerically
 * @param trace       derivation steps
 */
public record InterceptResult(
        Optional<Point> yIntercept, List<Point> xIntercepts, boolean approximate, StepTrace trace) {

    public InterceptResult {
        Objects.requireNonNull(yIntercept, "yIntercept must not be null");
        xIntercepts = List.copyOf(xIntercepts);
        Objects.requireNonNull(trace, "trace must not be null");
    }
}
