package io.fnanalyzer.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: one abstract root, parse errors versus analysis-phase errors. */
class ExceptionHierarchyTest {

    @Test
    void analysisExceptionIsAbstractAndRoot() {
        assertThat(AnalysisException.class).isAbstract();
        assertThat(AnalysisException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    // --- Parse phase ---

    @Test
    void expressionParseExceptionCarriesInputAndPosition() {
        var ex = new ExpressionParseException("Unexpected token ')'", "x + )", 4);

        assertThat(ex).isInstanceOf(AnalysisException.class);
        assertThat(ex.detail()).isEqualTo("Unexpected token ')'");
        assertThat(ex.input()).isEqualTo("x + )");
        assertThat(ex.position()).isEqualTo(4);
        assertThat(ex.phase()).isEqualTo(AnalysisException.Phase.PARSE);
    }

    @Test
    void expressionParseExceptionKeepsCause() {
        var cause = new UndefinedEvaluationException("division by zero in 1/0");
        var ex = new ExpressionParseException("Point '1/0' is not a real number", cause, "1/0", -1);

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.position()).isEqualTo(-1);
    }

    // --- Analysis phase ---

    @Test
    void undefinedEvaluationIsAnalysisPhase() {
        var ex = new UndefinedEvaluationException("log of a non-positive number");

        assertThat(ex.phase()).isEqualTo(AnalysisException.Phase.ANALYSIS);
        assertThat(ex.input()).isNull();
    }

    @Test
    void solveBudgetExceededIsAnalysisPhase() {
        var ex = new SolveBudgetExceededException("degree 40 exceeds the limit of 32");

        assertThat(ex).isInstanceOf(AnalysisException.class);
        assertThat(ex.phase()).isEqualTo(AnalysisException.Phase.ANALYSIS);
        assertThat(ex.detail()).isEqualTo("degree 40 exceeds the limit of 32");
    }
}
