package io.fnanalyzer.core.engine.range;

import static org.assertj.core.api.Assertions.assertThat;

import io.fnanalyzer.core.engine.AnalyzerConfig;
import io.fnanalyzer.core.engine.DomainAnalyzer;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.expr.ExpressionParser;
import io.fnanalyzer.core.model.StepTrace;
import io.fnanalyzer.core.model.TraceCategory;
import io.fnanalyzer.core.spi.RangeContext;
import io.fnanalyzer.core.spi.RangeOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("TrigRangeStrategy")
class TrigRangeStrategyTest {

    private final ExpressionParser parser = new ExpressionParser();
    private final TrigRangeStrategy strategy = new TrigRangeStrategy();

    private RangeOutcome attempt(String text) {
        Expr expr = parser.parse(text);
        return strategy.attempt(new RangeContext(
                expr,
                new DomainAnalyzer(AnalyzerConfig.DEFAULT).analyze(expr),
                AnalyzerConfig.DEFAULT,
                StepTrace.builder(TraceCategory.RANGE)));
    }

    @Test
    @DisplayName("A polynomial argument sweeps a full period")
    void polynomialArgument() {
        RangeOutcome outcome = attempt("sin(x^2)");

        assertThat(outcome).isInstanceOf(RangeOutcome.Solved.class);
        assertThat(((RangeOutcome.Solved) outcome).excluded().render()).isEqualTo("[-1, 1]");
    }

    @ParameterizedTest(name = "{0}: {1}")
    @CsvSource(
            delimiter = '|',
            value = {
                "sin(x) + cos(2*x) | not a linear combination of sin, cos or tan of one argument",
                "x*sin(x)          | not a linear combination of sin, cos or tan of one argument",
                "sin(exp(x))       | the argument exp(x) is not a non-constant polynomial",
                "tan(x) + sin(x)   | tan is mixed with sin or cos",
                "sin(x) - sin(x)   | the trigonometric terms cancel"
            })
    @DisplayName("Outside the family → not applicable with the reason")
    void notApplicable(String expression, String reason) {
        assertThat(attempt(expression)).isEqualTo(RangeOutcome.notApplicable(reason));
    }
}
