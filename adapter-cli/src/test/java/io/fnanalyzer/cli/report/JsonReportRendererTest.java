package io.fnanalyzer.cli.report;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fnanalyzer.core.engine.AnalyzerConfig;
import io.fnanalyzer.core.engine.FunctionAnalyzer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JsonReportRenderer")
class JsonReportRendererTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final FunctionAnalyzer analyzer = new FunctionAnalyzer(AnalyzerConfig.DEFAULT);
    private final JsonReportRenderer renderer = new JsonReportRenderer();

    private JsonNode render(String expression, String point) throws Exception {
        return JSON.readTree(renderer.render(analyzer.analyze(expression, point), 4));
    }

    @Test
    @DisplayName("Report carries every section with its steps")
    void sections() throws Exception {
        JsonNode report = render("(x^2-4)/(x-2)", null);

        assertThat(report.path("input").asText()).isEqualTo("(x^2-4)/(x-2)");
        assertThat(report.path("variable").asText()).isEqualTo("x");
        assertThat(report.path("domain").path("description").asText()).isEqualTo("ℝ ∖ {2}");
        assertThat(report.path("domain").path("removablePoints").get(0).path("text").asText()).isEqualTo("2");
        assertThat(report.path("range").path("strategy").asText()).isEqualTo("rational");
        assertThat(report.path("range").path("steps").isArray()).isTrue();
        assertThat(report.path("range").path("steps").size()).isGreaterThan(1);
        assertThat(report.has("evaluation")).isFalse();
    }

    @Test
    @DisplayName("Real numbers carry text, value and kind")
    void numbers() throws Exception {
        JsonNode y = render("(x+1)/(x-2)", null).path("intercepts").path("y");

        assertThat(y.path("x").path("text").asText()).isEqualTo("0");
        assertThat(y.path("y").path("text").asText()).isEqualTo("-1/2");
        assertThat(y.path("y").path("value").asDouble()).isEqualTo(-0.5);
        assertThat(y.path("y").path("kind").asText()).isEqualTo("EXACT");
    }

    @Test
    @DisplayName("No y-intercept → null; outside the domain → flagged evaluation")
    void undefinedValues() throws Exception {
        JsonNode report = render("sqrt(x-1)", "0");

        assertThat(report.path("intercepts").path("y").isNull()).isTrue();
        JsonNode evaluation = report.path("evaluation");
        assertThat(evaluation.path("outsideDomain").asBoolean()).isTrue();
        assertThat(evaluation.path("y").isNull()).isTrue();
        assertThat(evaluation.path("formatted").asText()).isEqualTo("undefined");
        assertThat(evaluation.path("undefinedReason").asText()).isEqualTo("x = 0 is outside the domain [1, ∞)");
    }
}
