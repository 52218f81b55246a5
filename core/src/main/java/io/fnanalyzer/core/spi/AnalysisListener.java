package io.fnanalyzer.core.spi;

/**
 * Observability hook for analysis runs. Front ends bridge it to logging, metrics or UI status.
 *
 * <p>All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught and logged by the analyzer; they do
 * NOT affect the analysis.
 */
public interface AnalysisListener {

    /**
     * Called before parsing starts.
     *
     * @param event contains the expression text and the optional point text
     */
    void onAnalysisStarted(AnalysisStartedEvent event);

    /**
     * Called when an analysis produced a result.
     *
     * @param event contains the expression text, duration, range strategy and approximation flag
     */
    void onAnalysisCompleted(AnalysisCompletedEvent event);

    /**
     * Called when the expression or point text was rejected by the parser.
     *
     * @param event contains the expression text, duration and error detail
     */
    void onAnalysisRejected(AnalysisRejectedEvent event);

    // --- Event records ---

    /** Event emitted when an analysis starts. */
    record AnalysisStartedEvent(String expressionText, String pointText) {}

    /** Event emitted when an analysis completes. */
    record AnalysisCompletedEvent(String expressionText, long durationMs, String rangeStrategy, boolean approximate) {}

    /** Event emitted when parsing fails. */
    record AnalysisRejectedEvent(String expressionText, long durationMs, String errorDetail) {}
}
