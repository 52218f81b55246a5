package io.fnanalyzer.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.fnanalyzer.core.engine.range.PolynomialRangeStrategy;
import io.fnanalyzer.core.error.SolveBudgetExceededException;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.expr.ExpressionParser;
import io.fnanalyzer.core.model.RangeResult;
import io.fnanalyzer.core.spi.RangeStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("RangeAnalyzer with the built-in strategies")
class RangeAnalyzerTest {

    private final ExpressionParser parser = new ExpressionParser();

    private RangeResult rangeOf(String text) {
        return rangeOf(text, StrategyRegistry.defaults());
    }

    private RangeResult rangeOf(String text, StrategyRegistry registry) {
        Expr expr = parser.parse(text);
        return new RangeAnalyzer(AnalyzerConfig.DEFAULT, registry)
                .analyze(expr, new DomainAnalyzer(AnalyzerConfig.DEFAULT).analyze(expr));
    }

    @ParameterizedTest(name = "{0} → {1} via {2}")
    @CsvSource(
            delimiter = '|',
            value = {
                "x**2 - 4          | [-4, ∞)             | polynomial",
                "-x^2 + 2*x        | (-∞, 1]             | polynomial",
                "x^4 - 2*x^2       | [-1, ∞)             | polynomial",
                "x^3 - x           | ℝ                   | polynomial",
                "(x+1)/(x-2)       | ℝ ∖ {1}             | rational",
                "1/x^2             | (0, ∞)              | rational",
                "x/(x^2 + 1)       | [-1/2, 1/2]         | rational",
                "(x^2-4)/(x-2)     | ℝ ∖ {4}             | rational",
                "1/(1/x)           | ℝ ∖ {0}             | rational",
                "sin(x)            | [-1, 1]             | trig",
                "2*sin(x) + 1      | [-1, 3]             | trig",
                "sin(x) + cos(x)   | [-√2, √2]           | trig",
                "3 - cos(2*x)/2    | [5/2, 7/2]          | trig",
                "tan(x)            | ℝ                   | trig"
            })
    @DisplayName("Exact ranges")
    void exactRanges(String expression, String expected, String strategy) {
        RangeResult range = rangeOf(expression);

        assertThat(range.description()).isEqualTo(expected);
        assertThat(range.strategyId()).isEqualTo(strategy);
        assertThat(range.approximate()).isFalse();
    }

    @Nested
    @DisplayName("Rational strategy")
    class Rational {

        @Test
        @DisplayName("A Möbius function is inverted explicitly")
        void mobiusInverse() {
            RangeResult range = rangeOf("(x+1)/(x-2)");

            assertThat(range.trace().lines())
                    .anyMatch(line -> line.endsWith(
                            "Solve for x: x = (2y + 1)/(y - 1), which has a solution for every y except y = 1"))
                    .anyMatch(line -> line.contains("y = 1 is never attained"))
                    .last()
                    .isEqualTo("Range: ℝ ∖ {1}");
        }

        @Test
        @DisplayName("Each branch between poles is described")
        void branches() {
            RangeResult range = rangeOf("1/x^2");

            assertThat(range.trace().lines())
                    .anyMatch(line -> line.endsWith("On the branch (-∞, 0) f takes the values (0, ∞)"))
                    .anyMatch(line -> line.endsWith("On the branch (0, ∞) f takes the values (0, ∞)"));
        }

        @Test
        @DisplayName("The image of a hole is excluded when nothing else reaches it")
        void holeImage() {
            assertThat(rangeOf("(x^2-4)/(x-2)").trace().lines())
                    .anyMatch(line -> line.endsWith("The hole at x = 2 would give y = 4, which no other input reaches, so it is excluded"));
        }
    }

    @Test
    @DisplayName("Polynomial strategy reports the global extremum")
    void polynomialExtremum() {
        assertThat(rangeOf("x**2 - 4").trace().lines())
                .anyMatch(line -> line.endsWith("Critical points solve f'(x) = 2x = 0: x = 0"))
                .anyMatch(line -> line.endsWith("Global minimum: f(0) = -4"));
    }

    @Test
    @DisplayName("Trigonometric strategy rewrites f as A·sin(u) + B·cos(u) + D")
    void trigDecomposition() {
        assertThat(rangeOf("sin(x)").trace().lines())
                .anyMatch(line -> line.endsWith("Write f as A·sin(u) + B·cos(u) + D with u = x, A = 1, B = 0, D = 0"));
    }

    @Nested
    @DisplayName("Sampled fallback")
    class Sampled {

        @Test
        @DisplayName("exp(x) → (0, ∞), approximate")
        void exponential() {
            RangeResult range = rangeOf("exp(x)");

            assertThat(range.strategyId()).isEqualTo("sampled");
            assertThat(range.approximate()).isTrue();
            assertThat(range.description()).isEqualTo("(0, ∞)");
            assertThat(range.trace().lines()).last().isEqualTo("Range: (0, ∞) (approximate)");
        }

        @Test
        @DisplayName("sqrt(x-1) → [0, ∞), approximate")
        void squareRoot() {
            RangeResult range = rangeOf("sqrt(x-1)");

            assertThat(range.strategyId()).isEqualTo("sampled");
            assertThat(range.description()).isEqualTo("[0, ∞)");
            assertThat(range.approximate()).isTrue();
        }

        @Test
        @DisplayName("Bounded oscillation without closed form keeps finite bounds")
        void boundedOscillation() {
            RangeResult range = rangeOf("sin(x)^2");

            assertThat(range.strategyId()).isEqualTo("sampled");
            assertThat(range.excluded().contains(-0.5)).isTrue();
            assertThat(range.excluded().contains(0.5)).isFalse();
            assertThat(range.excluded().contains(1.5)).isTrue();
        }

        @Test
        @DisplayName("A single-point domain is evaluated once: sqrt(-x^2) → {0}")
        void singlePointDomain() {
            RangeResult range = rangeOf("sqrt(-x^2)");

            assertThat(range.strategyId()).isEqualTo("sampled");
            assertThat(range.description()).isEqualTo("{0}");
            assertThat(range.trace().lines()).contains("On {0} f takes approximately {0}");
        }

        @Test
        @DisplayName("A numerically constant function collapses to a single value")
        void constantCollapses() {
            RangeResult range = rangeOf("sin(x)^2 + cos(x)^2");

            assertThat(range.strategyId()).isEqualTo("sampled");
            assertThat(range.description()).isEqualTo("{1}");
        }
    }

    @Nested
    @DisplayName("Strategy chain")
    class Chain {

        @Test
        @DisplayName("A strategy that exceeds its budget is skipped")
        void budgetExceededFallsThrough() {
            RangeStrategy slow = mock(RangeStrategy.class);
            when(slow.id()).thenReturn("slow");
            when(slow.attempt(any())).thenThrow(new SolveBudgetExceededException("roots of p: exceeded 3 iterations"));
            StrategyRegistry registry = new StrategyRegistry();
            registry.register(slow);
            registry.register(new PolynomialRangeStrategy());

            RangeResult range = rangeOf("x**2 - 4", registry);

            assertThat(range.strategyId()).isEqualTo("polynomial");
            assertThat(range.description()).isEqualTo("[-4, ∞)");
            assertThat(range.trace().lines().get(0))
                    .isEqualTo("Step 1: The slow strategy gave up (roots of p: exceeded 3 iterations), trying the next one");
        }

        @Test
        @DisplayName("Inapplicable strategies explain why")
        void notApplicableExplained() {
            assertThat(rangeOf("x**2 - 4").trace().lines().get(0))
                    .isEqualTo("Step 1: The rational strategy does not apply: no variable in a denominator and no removed points");
        }

        @Test
        @DisplayName("No applicable strategy → undetermined, approximate")
        void undetermined() {
            StrategyRegistry registry = new StrategyRegistry();
            registry.register(new PolynomialRangeStrategy());

            RangeResult range = rangeOf("exp(x)", registry);

            assertThat(range.strategyId()).isEqualTo(RangeAnalyzer.UNDETERMINED);
            assertThat(range.description()).isEqualTo("undetermined");
            assertThat(range.approximate()).isTrue();
            assertThat(range.trace().lines()).last().isEqualTo("Range: undetermined");
        }
    }
}
