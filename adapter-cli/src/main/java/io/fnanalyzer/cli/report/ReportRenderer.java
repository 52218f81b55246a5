package io.fnanalyzer.cli.report;

import io.fnanalyzer.core.model.AnalysisResult;

/** Turns an analysis result into the text printed on standard output. */
public interface ReportRenderer {

    /**
     * @param result        the analysis to render
     * @param decimalPlaces digits after the decimal point for the evaluated value
     */
    String render(AnalysisResult result, int decimalPlaces);

    /** Renderer for {@code text} or {@code json}. */
    static ReportRenderer forFormat(String format) {
        return "json".equalsIgnoreCase(format) ? new JsonReportRenderer() : new TextReportRenderer();
    }
}
