package io.fnanalyzer.cli.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.model.AnalysisResult;
import io.fnanalyzer.core.model.EvaluationResult;
import io.fnanalyzer.core.model.InterceptResult;
import io.fnanalyzer.core.model.Point;
import io.fnanalyzer.core.model.StepTrace;
import java.io.UncheckedIOException;

/**
 * JSON report built as a Jackson tree:
 *
 * <pre>
 * { "expression", "domain": {...}, "range": {...}, "intercepts": {...}, "evaluation": {...} }
 * </pre>
 *
 * Each section carries its summary, an {@code approximate} flag where relevant, and its
 * {@code steps}. Real numbers are written as {@code {"text": "-1/2", "value": -0.5, "kind": "EXACT"}}.
 */
public final class JsonReportRenderer implements ReportRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public String render(AnalysisResult result, int decimalPlaces) {
        ObjectNode root = toJson(result, decimalPlaces);
        try {
            return MAPPER.writeValueAsString(root) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize analysis report", e);
        }
    }

    /** The report tree, exposed for callers that embed it in a larger document. */
    public ObjectNode toJson(AnalysisResult result, int decimalPlaces) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("input", result.expressionText());
        root.put("variable", result.variable());
        root.put("expression", result.expression().toString());

        ObjectNode domain = root.putObject("domain");
        domain.put("description", result.domain().description());
        domain.put("approximate", result.domain().approximate());
        ArrayNode removable = domain.putArray("removablePoints");
        result.domain().removablePoints().forEach(p -> removable.add(number(p)));
        domain.set("steps", steps(result.domain().trace()));

        ObjectNode range = root.putObject("range");
        range.put("description", result.range().description());
        range.put("strategy", result.range().strategyId());
        range.put("approximate", result.range().approximate());
        range.set("steps", steps(result.range().trace()));

        root.set("intercepts", intercepts(result.intercepts()));
        result.evaluation().ifPresent(e -> root.set("evaluation", evaluation(e, decimalPlaces)));
        return root;
    }

    private ObjectNode intercepts(InterceptResult intercepts) {
        ObjectNode node = MAPPER.createObjectNode();
        ArrayNode xs = node.putArray("x");
        intercepts.xIntercepts().forEach(p -> xs.add(point(p)));
        if (intercepts.yIntercept().isPresent()) {
            node.set("y", point(intercepts.yIntercept().get()));
        } else {
            node.putNull("y");
        }
        node.put("approximate", intercepts.approximate());
        node.set("steps", steps(intercepts.trace()));
        return node;
    }

    private ObjectNode evaluation(EvaluationResult evaluation, int decimalPlaces) {
        ObjectNode node = MAPPER.createObjectNode();
        node.set("x", number(evaluation.x()));
        if (evaluation.y().isPresent()) {
            node.set("y", number(evaluation.y().get()));
        } else {
            node.putNull("y");
        }
        node.put("formatted", evaluation.formatted(decimalPlaces));
        node.put("outsideDomain", evaluation.outsideDomain());
        evaluation.undefinedReason().ifPresent(reason -> node.put("undefinedReason", reason));
        node.set("steps", steps(evaluation.trace()));
        return node;
    }

    private ObjectNode point(Point point) {
        ObjectNode node = MAPPER.createObjectNode();
        node.set("x", number(point.x()));
        node.set("y", number(point.y()));
        return node;
    }

    private ObjectNode number(RealNumber value) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("text", value.toString());
        node.put("value", value.doubleValue());
        node.put("kind", value.kind().name());
        return node;
    }

    private ArrayNode steps(StepTrace trace) {
        ArrayNode array = MAPPER.createArrayNode();
        trace.lines().forEach(array::add);
        return array;
    }
}
