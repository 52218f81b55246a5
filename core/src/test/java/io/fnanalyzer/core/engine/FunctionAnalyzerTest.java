package io.fnanalyzer.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.error.AnalysisException;
import io.fnanalyzer.core.error.ExpressionParseException;
import io.fnanalyzer.core.model.AnalysisResult;
import io.fnanalyzer.core.model.EvaluationResult;
import io.fnanalyzer.core.model.Point;
import io.fnanalyzer.core.model.StepTrace;
import io.fnanalyzer.core.model.TraceCategory;
import io.fnanalyzer.core.spi.AnalysisListener;
import io.fnanalyzer.core.spi.AnalysisListener.AnalysisCompletedEvent;
import io.fnanalyzer.core.spi.AnalysisListener.AnalysisRejectedEvent;
import io.fnanalyzer.core.spi.AnalysisListener.AnalysisStartedEvent;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * End-to-end analysis scenarios: parse, domain, range, intercepts and point evaluation through
 * the public entry point.
 */
@DisplayName("FunctionAnalyzer")
class FunctionAnalyzerTest {

    private CapturingAnalysisListener listener;
    private FunctionAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        listener = new CapturingAnalysisListener();
        analyzer = new FunctionAnalyzer(AnalyzerConfig.DEFAULT, StrategyRegistry.defaults(), listener);
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("Quadratic x^2 - 4")
        void quadratic() {
            AnalysisResult result = analyzer.analyze("x^2 - 4");

            assertThat(result.domain().description()).isEqualTo("ℝ");
            assertThat(result.range().description()).isEqualTo("[-4, ∞)");
            assertThat(result.range().strategyId()).isEqualTo("polynomial");
            assertThat(result.intercepts().xIntercepts()).extracting(Point::toString)
                    .containsExactly("(-2, 0)", "(2, 0)");
            assertThat(result.evaluation()).isEmpty();
            assertThat(result.traces()).extracting(StepTrace::category)
                    .containsExactly(TraceCategory.DOMAIN, TraceCategory.RANGE, TraceCategory.INTERCEPTS);
        }

        @Test
        @DisplayName("Möbius function (x+1)/(x-2) evaluated at 1.5")
        void mobius() {
            AnalysisResult result = analyzer.analyze("(x+1)/(x-2)", "1.5");

            assertThat(result.domain().description()).isEqualTo("ℝ ∖ {2}");
            assertThat(result.range().description()).isEqualTo("ℝ ∖ {1}");
            assertThat(result.intercepts().yIntercept()).map(Point::toString).contains("(0, -1/2)");
            assertThat(result.intercepts().xIntercepts()).extracting(Point::toString).containsExactly("(-1, 0)");

            EvaluationResult evaluation = result.evaluation().orElseThrow();
            assertThat(evaluation.outsideDomain()).isFalse();
            assertThat(evaluation.formatted(4)).isEqualTo("-5.0000");
            assertThat(result.traces()).hasSize(4);
        }

        @Test
        @DisplayName("sin(x): bounded range, periodic zeros")
        void sine() {
            AnalysisResult result = analyzer.analyze("sin(x)");

            assertThat(result.domain().description()).isEqualTo("ℝ");
            assertThat(result.range().description()).isEqualTo("[-1, 1]");
            assertThat(result.range().approximate()).isFalse();
            assertThat(result.intercepts().xIntercepts()).hasSize(7);
        }

        @Test
        @DisplayName("sqrt(x-1) at 0: outside the domain is a warning, not an error")
        void squareRootOutsideDomain() {
            AnalysisResult result = analyzer.analyze("sqrt(x-1)", "0");

            assertThat(result.domain().description()).isEqualTo("[1, ∞)");
            assertThat(result.range().description()).isEqualTo("[0, ∞)");
            assertThat(result.range().approximate()).isTrue();
            EvaluationResult evaluation = result.evaluation().orElseThrow();
            assertThat(evaluation.outsideDomain()).isTrue();
            assertThat(evaluation.undefinedReason()).contains("x = 0 is outside the domain [1, ∞)");
            assertThat(evaluation.trace().lines()).last().isEqualTo("f(0) is undefined");
        }

        @Test
        @DisplayName("Removable discontinuity (x^2-4)/(x-2)")
        void hole() {
            AnalysisResult result = analyzer.analyze("(x^2-4)/(x-2)");

            assertThat(result.domain().description()).isEqualTo("ℝ ∖ {2}");
            assertThat(result.domain().removablePoints()).extracting(RealNumber::toString).containsExactly("2");
            assertThat(result.range().description()).isEqualTo("ℝ ∖ {4}");
        }

        @Test
        @DisplayName("Custom variable name")
        void customVariable() {
            FunctionAnalyzer inT = new FunctionAnalyzer(AnalyzerConfig.builder().variable("t").build());

            AnalysisResult result = inT.analyze("1/t", "2");

            assertThat(result.domain().description()).isEqualTo("ℝ ∖ {0}");
            assertThat(result.evaluation().orElseThrow().formatted(2)).isEqualTo("0.50");
        }
    }

    @Nested
    @DisplayName("Degenerate domains")
    class Degenerate {

        @Test
        @DisplayName("sqrt(-x^2) is defined only at 0 and still analyzes fully")
        void singlePoint() {
            AnalysisResult result = analyzer.analyze("sqrt(-x^2)", "0");

            assertThat(result.domain().description()).isEqualTo("{0}");
            assertThat(result.range().description()).isEqualTo("{0}");
            assertThat(result.evaluation().orElseThrow().outsideDomain()).isFalse();
        }
    }

    @Nested
    @DisplayName("Consistency")
    class Consistency {

        @Test
        @DisplayName("Analyzing the same input twice gives equal results")
        void idempotent() {
            assertThat(analyzer.analyze("x/(x^2+1)", "3")).isEqualTo(analyzer.analyze("x/(x^2+1)", "3"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"(x+1)/(x-2)", "x^2 - 4", "2*sin(x) + 1", "exp(x)", "x^3 - x"})
        @DisplayName("The y-intercept equals f(0)")
        void yInterceptIsValueAtZero(String expression) {
            AnalysisResult result = analyzer.analyze(expression, "0");

            assertThat(result.intercepts().yIntercept().map(Point::y))
                    .isEqualTo(result.evaluation().orElseThrow().y());
        }

        @Test
        @DisplayName("f vanishes at every exact x-intercept")
        void zeroAtIntercepts() {
            AnalysisResult result = analyzer.analyze("x^3 - x");

            assertThat(result.intercepts().xIntercepts()).hasSize(3);
            for (Point p : result.intercepts().xIntercepts()) {
                AnalysisResult at = analyzer.analyze("x^3 - x", p.x().toString());
                assertThat(at.evaluation().orElseThrow().y()).contains(RealNumber.ZERO);
            }
        }
    }

    @Nested
    @DisplayName("Rejected input")
    class Rejected {

        @ParameterizedTest
        @ValueSource(strings = {"x +", "(x", "foo(x)", "y + 1", "2 + 3", ""})
        @DisplayName("Malformed expressions → ExpressionParseException")
        void malformed(String text) {
            assertThatThrownBy(() -> analyzer.analyze(text))
                    .isInstanceOf(ExpressionParseException.class)
                    .satisfies(e -> assertThat(((AnalysisException) e).phase()).isEqualTo(AnalysisException.Phase.PARSE));

            assertThat(listener.rejected).hasSize(1);
            assertThat(listener.completed).isEmpty();
        }

        @Test
        @DisplayName("A point that is not a real number is rejected")
        void badPoint() {
            assertThatThrownBy(() -> analyzer.analyze("x + 1", "1/0"))
                    .isInstanceOf(ExpressionParseException.class)
                    .hasMessageStartingWith("Point '1/0' is not a real number");
        }

        @Test
        @DisplayName("A point mentioning the variable is rejected")
        void variableInPoint() {
            assertThatThrownBy(() -> analyzer.analyze("x + 1", "x"))
                    .isInstanceOf(ExpressionParseException.class);
        }
    }

    @Nested
    @DisplayName("Listener")
    class Listener {

        @Test
        @DisplayName("Successful analysis → started + completed")
        void lifecycle() {
            analyzer.analyze("exp(x)", "1");

            assertThat(listener.started).containsExactly(new AnalysisStartedEvent("exp(x)", "1"));
            assertThat(listener.completed).hasSize(1);
            AnalysisCompletedEvent completed = listener.completed.get(0);
            assertThat(completed.expressionText()).isEqualTo("exp(x)");
            assertThat(completed.rangeStrategy()).isEqualTo("sampled");
            assertThat(completed.approximate()).isTrue();
            assertThat(completed.durationMs()).isGreaterThanOrEqualTo(0);
            assertThat(listener.rejected).isEmpty();
        }

        @Test
        @DisplayName("Rejected expression → started + rejected with the parse detail")
        void rejection() {
            assertThatThrownBy(() -> analyzer.analyze("2 + 3")).isInstanceOf(ExpressionParseException.class);

            assertThat(listener.started).hasSize(1);
            assertThat(listener.rejected).hasSize(1);
            assertThat(listener.rejected.get(0).errorDetail()).isEqualTo("Expression must be a function of x: '2 + 3'");
        }

        @Test
        @DisplayName("A throwing listener does not affect the analysis")
        void throwingListener() {
            AnalysisListener broken = mock(AnalysisListener.class);
            doThrow(new IllegalStateException("boom")).when(broken).onAnalysisStarted(any());
            doThrow(new IllegalStateException("boom")).when(broken).onAnalysisCompleted(any());
            FunctionAnalyzer guarded = new FunctionAnalyzer(AnalyzerConfig.DEFAULT, StrategyRegistry.defaults(), broken);

            AnalysisResult result = guarded.analyze("x^2 - 4");

            assertThat(result.range().description()).isEqualTo("[-4, ∞)");
            verify(broken).onAnalysisCompleted(any());
        }
    }

    private static final class CapturingAnalysisListener implements AnalysisListener {
        final List<AnalysisStartedEvent> started = new ArrayList<>();
        final List<AnalysisCompletedEvent> completed = new ArrayList<>();
        final List<AnalysisRejectedEvent> rejected = new ArrayList<>();

        @Override
        public void onAnalysisStarted(AnalysisStartedEvent event) {
            started.add(event);
        }

        @Override
        public void onAnalysisCompleted(AnalysisCompletedEvent event) {
            completed.add(event);
        }

        @Override
        public void onAnalysisRejected(AnalysisRejectedEvent event) {
            rejected.add(event);
        }
    }
}
