package io.fnanalyzer.core.algebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.fnanalyzer.core.error.SolveBudgetExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PolynomialSolver")
class PolynomialSolverTest {

    private final PolynomialSolver solver = new PolynomialSolver(SolveBudget.DEFAULT);

    @Nested
    @DisplayName("Exact roots")
    class ExactRoots {

        @Test
        @DisplayName("x^2 - 4 → -2, 2")
        void rationalRoots() {
            PolynomialSolver.RootSet roots = solver.realRoots(Polynomial.ofIntegers(-4, 0, 1));

            assertThat(roots.approximate()).isFalse();
            assertThat(roots.roots()).extracting(RealNumber::toString).containsExactly("-2", "2");
            assertThat(roots.roots()).allMatch(RealNumber::isExact);
        }

        @Test
        @DisplayName("Repeated roots are reported once")
        void repeatedRoots() {
            Polynomial p = Polynomial.ofIntegers(-1, 1).pow(2).multiply(Polynomial.X);

            assertThat(solver.realRoots(p).roots()).extracting(RealNumber::toString).containsExactly("0", "1");
        }

        @Test
        @DisplayName("Fractional roots via the rational root theorem")
        void fractionalRoot() {
            Polynomial p = Polynomial.ofIntegers(-1, 2).multiply(Polynomial.ofIntegers(3, 1));

            assertThat(solver.realRoots(p).roots()).extracting(RealNumber::toString).containsExactly("-3", "1/2");
        }

        @Test
        @DisplayName("x^2 - 2 → ±√2 in closed form")
        void surds() {
            PolynomialSolver.RootSet roots = solver.realRoots(Polynomial.ofIntegers(-2, 0, 1));

            assertThat(roots.approximate()).isFalse();
            assertThat(roots.roots()).extracting(RealNumber::toString).containsExactly("-√2", "√2");
            assertThat(roots.roots().get(1).doubleValue()).isCloseTo(Math.sqrt(2), within(1e-12));
        }

        @Test
        @DisplayName("No real roots for x^2 + 1")
        void noRealRoots() {
            assertThat(solver.realRoots(Polynomial.ofIntegers(1, 0, 1)).roots()).isEmpty();
        }

        @Test
        @DisplayName("A non-zero constant has no roots")
        void constant() {
            assertThat(solver.realRoots(Polynomial.ONE).roots()).isEmpty();
        }
    }

    @Test
    @DisplayName("x^3 - 2 has no closed form here → approximate root")
    void numericRoot() {
        PolynomialSolver.RootSet roots = solver.realRoots(Polynomial.ofIntegers(-2, 0, 0, 1));

        assertThat(roots.approximate()).isTrue();
        assertThat(roots.roots()).hasSize(1);
        assertThat(roots.roots().get(0).doubleValue()).isCloseTo(Math.cbrt(2), within(1e-9));
        assertThat(roots.roots().get(0)).hasToString("1.2599");
    }

    @Test
    @DisplayName("The zero polynomial → IllegalArgumentException")
    void zeroPolynomial_throws() {
        assertThatThrownBy(() -> solver.realRoots(Polynomial.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Degree above the budget → SolveBudgetExceededException")
    void degreeBudget() {
        PolynomialSolver small = new PolynomialSolver(new SolveBudget(2, 1000, 1000));

        assertThatThrownBy(() -> small.realRoots(Polynomial.ofIntegers(-2, 0, 0, 1)))
                .isInstanceOf(SolveBudgetExceededException.class)
                .hasMessageContaining("degree 3 exceeds the limit of 2");
    }

    @Test
    @DisplayName("squareFree drops repeated factors")
    void squareFree() {
        Polynomial p = Polynomial.ofIntegers(-1, 1).pow(3);

        assertThat(PolynomialSolver.squareFree(p)).isEqualTo(Polynomial.ofIntegers(-1, 1));
    }
}
