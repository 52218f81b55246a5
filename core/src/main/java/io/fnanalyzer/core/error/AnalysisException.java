package io.fnanalyzer.core.error;

/**
 * Abstract base for all fn-analyzer exceptions. Never thrown directly; use {@link
 * ExpressionParseException} for rejected input or one of the analysis-phase subclasses.
 */
public abstract class AnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        ANALYSIS
    }

    private final String input;
    private final Phase phase;

    protected AnalysisException(String message, String input, Phase phase) {
        super(message);
        this.input = input;
        this.phase = phase;
    }

    protected AnalysisException(String message, Throwable cause, String input, Phase phase) {
        super(message, cause);
        this.input = input;
        this.phase = phase;
    }

    /** The expression or point text that triggered the error, or {@code null} if not known. */
    public String input() {
        return input;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
