package io.fnanalyzer.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import io.fnanalyzer.core.algebra.PiLinear;
import io.fnanalyzer.core.algebra.Rational;
import io.fnanalyzer.core.algebra.RealNumber;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExcludedSet: normal form and rendering")
class ExcludedSetTest {

    private static RealNumber n(long value) {
        return RealNumber.exact(value);
    }

    private static final PeriodicFamily TAN_POLES =
            new PeriodicFamily(PiLinear.piTimes(Rational.of(1, 2)), PiLinear.PI);

    @Nested
    @DisplayName("Rendering")
    class Rendering {

        @Test
        @DisplayName("Nothing excluded → ℝ")
        void none() {
            assertThat(ExcludedSet.NONE.render()).isEqualTo("ℝ");
            assertThat(ExcludedSet.NONE.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Points are listed in ascending order")
        void points() {
            assertThat(ExcludedSet.ofPoints(List.of(n(2), n(-1))).render()).isEqualTo("ℝ ∖ {-1, 2}");
        }

        @Test
        @DisplayName("Families are rendered with k ∈ ℤ")
        void family() {
            assertThat(ExcludedSet.ofFamily(TAN_POLES).render()).isEqualTo("ℝ ∖ {π/2 + kπ : k ∈ ℤ}");
        }

        @Test
        @DisplayName("Points and families form a union")
        void pointsAndFamily() {
            ExcludedSet set = ExcludedSet.of(List.of(n(1)), List.of(), List.of(TAN_POLES));

            assertThat(set.render()).isEqualTo("ℝ ∖ ({1} ∪ {π/2 + kπ : k ∈ ℤ})");
        }

        @Test
        @DisplayName("With intervals the allowed remainder is shown")
        void intervals() {
            assertThat(ExcludedSet.ofInterval(Interval.lessThan(n(1))).render()).isEqualTo("[1, ∞)");

            ExcludedSet mixed = ExcludedSet.of(List.of(n(-2)), List.of(Interval.greaterThan(RealNumber.ZERO)), List.of());
            assertThat(mixed.render()).isEqualTo("(-∞, -2) ∪ (-2, 0]");
        }

        @Test
        @DisplayName("Everything excluded → ∅")
        void everything() {
            assertThat(ExcludedSet.complementOf(List.of()).render()).isEqualTo("∅");
        }
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("Overlapping intervals merge")
        void merge() {
            ExcludedSet set = ExcludedSet.ofIntervals(List.of(Interval.open(n(0), n(2)), Interval.open(n(1), n(3))));

            assertThat(set.intervals()).containsExactly(Interval.open(n(0), n(3)));
        }

        @Test
        @DisplayName("Open intervals sharing an end stay apart")
        void touchingOpenIntervals() {
            ExcludedSet set = ExcludedSet.ofIntervals(List.of(Interval.open(n(0), n(1)), Interval.open(n(1), n(2))));

            assertThat(set.intervals()).hasSize(2);
            assertThat(set.render()).isEqualTo("(-∞, 0] ∪ {1} ∪ [2, ∞)");
        }

        @Test
        @DisplayName("Points inside an interval are absorbed")
        void absorbedPoint() {
            ExcludedSet set = ExcludedSet.of(
                    List.of(RealNumber.exact(Rational.of(1, 2))), List.of(Interval.open(n(0), n(1))), List.of());

            assertThat(set.points()).isEmpty();
        }

        @Test
        @DisplayName("A point on an open end closes that end")
        void pointClosesEnd() {
            ExcludedSet set = ExcludedSet.of(List.of(n(1)), List.of(Interval.lessThan(n(1))), List.of());

            assertThat(set.points()).isEmpty();
            assertThat(set.intervals()).containsExactly(Interval.atMost(n(1)));
            assertThat(set.render()).isEqualTo("(1, ∞)");
        }

        @Test
        @DisplayName("Members of a family are absorbed")
        void familyAbsorbsPoint() {
            RealNumber halfPi = RealNumber.symbolic("π/2", Math.PI / 2);
            ExcludedSet set = ExcludedSet.ofPoint(halfPi).union(ExcludedSet.ofFamily(TAN_POLES));

            assertThat(set.points()).isEmpty();
            assertThat(set.families()).containsExactly(TAN_POLES);
        }

        @Test
        @DisplayName("The same set built in different orders compares equal")
        void equality() {
            assertThat(ExcludedSet.ofPoints(List.of(n(2), n(1)))).isEqualTo(ExcludedSet.ofPoints(List.of(n(1), n(2))));
            assertThat(ExcludedSet.complementOf(List.of(Interval.all())).isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("Membership covers points, intervals and families")
    void contains() {
        ExcludedSet set = ExcludedSet.of(List.of(n(5)), List.of(Interval.lessThan(n(0))), List.of(TAN_POLES));

        assertThat(set.contains(5.0)).isTrue();
        assertThat(set.contains(-3.0)).isTrue();
        assertThat(set.contains(Math.PI / 2 + 2 * Math.PI)).isTrue();
        assertThat(set.contains(1.0)).isFalse();
    }

    @Test
    @DisplayName("Allowed intervals split at excluded points")
    void allowedIntervals() {
        ExcludedSet set = ExcludedSet.ofPoint(n(2));

        assertThat(set.allowedIntervals()).containsExactly(Interval.lessThan(n(2)), Interval.greaterThan(n(2)));
    }
}
