package io.fnanalyzer.core.error;

/**
 * Thrown when a symbolic solve exceeds its {@code SolveBudget} (polynomial degree, iteration count
 * or wall-clock time). Analyzers catch it and switch to their numeric fallback.
 */
public final class SolveBudgetExceededException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public SolveBudgetExceededException(String message) {
        super(message, null, Phase.ANALYSIS);
    }
}
