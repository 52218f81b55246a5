package io.fnanalyzer.core.algebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fnanalyzer.core.error.SolveBudgetExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SolveBudget: degree, iteration and time limits")
class SolveBudgetTest {

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void defaults() {
            assertThat(SolveBudget.DEFAULT.maxDegree()).isEqualTo(32);
            assertThat(SolveBudget.DEFAULT.maxIterations()).isEqualTo(100_000);
            assertThat(SolveBudget.DEFAULT.maxSolveMs()).isEqualTo(250);
        }

        @Test
        void nonPositiveLimits_rejected() {
            assertThatThrownBy(() -> new SolveBudget(0, 1, 1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maxDegree");
            assertThatThrownBy(() -> new SolveBudget(1, 0, 1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maxIterations");
            assertThatThrownBy(() -> new SolveBudget(1, 1, 0))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("maxSolveMs");
        }
    }

    @Nested
    @DisplayName("Tracker")
    class TrackerLimits {

        @Test
        @DisplayName("Iterations within budget are counted")
        void withinBudget() {
            SolveBudget.Tracker tracker = new SolveBudget(4, 10, 1000).start("test");
            for (int i = 0; i < 10; i++) {
                tracker.tick();
            }
            tracker.requireDegree(4);

            assertThat(tracker.iterations()).isEqualTo(10);
        }

        @Test
        @DisplayName("One iteration too many → SolveBudgetExceededException naming the operation")
        void iterationLimit() {
            SolveBudget.Tracker tracker = new SolveBudget(4, 3, 1000).start("roots of x^5");
            tracker.tick();
            tracker.tick();
            tracker.tick();

            assertThatThrownBy(tracker::tick)
                    .isInstanceOf(SolveBudgetExceededException.class)
                    .hasMessage("roots of x^5: exceeded 3 iterations");
        }

        @Test
        void degreeLimit() {
            SolveBudget.Tracker tracker = new SolveBudget(4, 10, 1000).start("op");

            assertThatThrownBy(() -> tracker.requireDegree(5))
                    .isInstanceOf(SolveBudgetExceededException.class)
                    .hasMessage("op: degree 5 exceeds the limit of 4");
        }
    }
}
