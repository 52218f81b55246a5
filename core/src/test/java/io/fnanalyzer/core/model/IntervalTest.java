package io.fnanalyzer.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.algebra.RealNumber;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Interval")
class IntervalTest {

    private static final RealNumber ONE = RealNumber.exact(1);
    private static final RealNumber TWO = RealNumber.exact(2);

    @Test
    @DisplayName("Renders with bracket style and infinities")
    void rendering() {
        assertThat(Interval.atLeast(ONE)).hasToString("[1, ∞)");
        assertThat(Interval.lessThan(TWO)).hasToString("(-∞, 2)");
        assertThat(new Interval(ONE, false, TWO, true)).hasToString("(1, 2]");
        assertThat(Interval.all()).hasToString("(-∞, ∞)");
        assertThat(Interval.point(RealNumber.exact(Rational.of(1, 2)))).hasToString("{1/2}");
    }

    @Test
    @DisplayName("Unbounded ends are never closed")
    void unboundedEndsOpen() {
        Interval iv = new Interval(null, true, ONE, true);

        assertThat(iv.lowerClosed()).isFalse();
        assertThat(iv.lowerValue()).isEqualTo(Double.NEGATIVE_INFINITY);
    }

    @Test
    @DisplayName("Closed ends admit values within tolerance, open ends do not")
    void membership() {
        Interval closed = Interval.closed(ONE, TWO);
        Interval open = Interval.open(ONE, TWO);

        assertThat(closed.contains(1.0)).isTrue();
        assertThat(closed.contains(2.0 + 1e-12)).isTrue();
        assertThat(open.contains(1.0)).isFalse();
        assertThat(open.contains(1.5)).isTrue();
        assertThat(open.contains(2.5)).isFalse();
    }

    @Test
    @DisplayName("Empty intervals are rejected")
    void emptyRejected() {
        assertThatThrownBy(() -> Interval.closed(TWO, ONE)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Interval.open(ONE, ONE)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void degenerate() {
        assertThat(Interval.point(ONE).isDegenerate()).isTrue();
        assertThat(Interval.all().isAll()).isTrue();
    }
}
