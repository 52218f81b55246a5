package io.fnanalyzer.core.model;

import io.fnanalyzer.core.algebra.RealNumber;
import java.util.Objects;

/** A point on the curve, e.g. an intercept {@code (-1, 0)}. */
public record Point(RealNumber x, RealNumber y) {

    public Point {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
