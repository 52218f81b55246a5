package io.fnanalyzer.cli.report;

import static org.assertj.core.api.Assertions.assertThat;

import io.fnanalyzer.core.engine.AnalyzerConfig;
import io.fnanalyzer.core.engine.FunctionAnalyzer;
import io.fnanalyzer.core.model.AnalysisResult;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextReportRenderer")
class TextReportRendererTest {

    private final FunctionAnalyzer analyzer = new FunctionAnalyzer(AnalyzerConfig.DEFAULT);
    private final TextReportRenderer renderer = new TextReportRenderer();

    private List<String> render(String expression, String point) {
        AnalysisResult result = analyzer.analyze(expression, point);
        return renderer.render(result, 4).lines().toList();
    }

    @Test
    @DisplayName("Sections appear in order: domain, range, intercepts")
    void sectionOrder() {
        List<String> lines = render("(x+1)/(x-2)", null);

        assertThat(lines.get(0)).isEqualTo("f(x) = (x + 1)/(x - 2)");
        assertThat(lines).containsSubsequence(
                "DOMAIN (summary):", "ℝ ∖ {2}",
                "DOMAIN (steps):",
                "RANGE (summary):", "ℝ ∖ {1}",
                "RANGE (steps):",
                "INTERCEPTS (summary):", "x-intercepts: (-1, 0)", "y-intercept: (0, -1/2)",
                "INTERCEPTS (steps):");
        assertThat(lines).doesNotContain("EVALUATION STEP BY STEP");
    }

    @Test
    @DisplayName("Approximate answers are marked")
    void approximateNote() {
        assertThat(render("exp(x)", null)).contains("(0, ∞) (approximate)");
    }

    @Test
    @DisplayName("Evaluation block ends with the formatted value")
    void evaluationBlock() {
        List<String> lines = render("(x+1)/(x-2)", "1.5");

        assertThat(lines).containsSubsequence("EVALUATION STEP BY STEP", "Step 1: Substitute x = 3/2 into f(x) = (x + 1)/(x - 2)");
        assertThat(lines.get(lines.size() - 1)).isEqualTo("f(3/2) = -5.0000");
    }
}
