package io.fnanalyzer.cli.report;

import io.fnanalyzer.core.model.AnalysisResult;
import io.fnanalyzer.core.model.EvaluationResult;
import io.fnanalyzer.core.model.InterceptResult;
import io.fnanalyzer.core.model.Point;
import io.fnanalyzer.core.model.StepTrace;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain-text report: a summary and the steps for each of domain, range and intercepts, then the
 * step-by-step evaluation under a banner when a point was given.
 */
public final class TextReportRenderer implements ReportRenderer {

    private static final String BANNER = "=".repeat(60);

    @Override
    public String render(AnalysisResult result, int decimalPlaces) {
        List<String> lines = new ArrayList<>();
        lines.add("f(" + result.variable() + ") = " + result.expression());
        lines.add("");
        section(lines, "DOMAIN", result.domain().description() + approximateNote(result.domain().approximate()),
                result.domain().trace());
        section(lines, "RANGE", result.range().description() + approximateNote(result.range().approximate()),
                result.range().trace());
        section(lines, "INTERCEPTS", interceptSummary(result.intercepts()), result.intercepts().trace());
        result.evaluation().ifPresent(evaluation -> evaluation(lines, result.variable(), evaluation, decimalPlaces));
        return String.join(System.lineSeparator(), lines) + System.lineSeparator();
    }

    private static void section(List<String> lines, String title, String summary, StepTrace trace) {
        lines.add(title + " (summary):");
        lines.add(summary);
        lines.add("");
        lines.add(title + " (steps):");
        lines.addAll(trace.lines());
        lines.add("");
    }

    private static String interceptSummary(InterceptResult intercepts) {
        String xs = intercepts.xIntercepts().isEmpty()
                ? "none"
                : intercepts.xIntercepts().stream().map(Point::toString).collect(Collectors.joining(", "));
        String y = intercepts.yIntercept().map(Point::toString).orElse("none");
        return "x-intercepts: " + xs + System.lineSeparator() + "y-intercept: " + y
                + approximateNote(intercepts.approximate());
    }

    private static void evaluation(
            List<String> lines, String variable, EvaluationResult evaluation, int decimalPlaces) {
        if (evaluation.outsideDomain()) {
            lines.add("WARNING: " + variable + " = " + evaluation.x() + " is outside the domain of the function.");
            evaluation.undefinedReason().ifPresent(reason -> lines.add("Details: " + reason));
            lines.add("");
        }
        lines.add(BANNER);
        lines.add("EVALUATION STEP BY STEP");
        lines.add(BANNER);
        lines.addAll(evaluation.trace().lines());
        lines.add("");
        lines.add("f(" + evaluation.x() + ") = " + evaluation.formatted(decimalPlaces));
    }

    private static String approximateNote(boolean approximate) {
        return approximate ? " (approximate)" : "";
    }
}
