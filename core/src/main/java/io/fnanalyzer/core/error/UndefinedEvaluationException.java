package io.fnanalyzer.core.error;

/**
 * Thrown when substituting a value produces an undefined or indeterminate result, e.g. division
 * by exactly zero, the logarithm of a non-positive number or an even root of a negative number.
 *
 * <p>Analyzers catch this internally and record it in the evaluation trace; it never reaches the
 * caller of {@code FunctionAnalyzer.analyze()}.
 */
public final class UndefinedEvaluationException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public UndefinedEvaluationException(String message) {
        super(message, null, Phase.ANALYSIS);
    }
}
