package io.fnanalyzer.core.error;

/**
 * Thrown when expression or point text cannot be parsed: syntax errors, unknown identifiers,
 * a variable other than the designated one, or an expression that does not depend on the
 * variable. This is the only error that aborts an analysis.
 */
public final class ExpressionParseException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public ExpressionParseException(String message, String input, int position) {
        super(message, input, Phase.PARSE);
        this.position = position;
    }

    public ExpressionParseException(String message, Throwable cause, String input, int position) {
        super(message, cause, input, Phase.PARSE);
        this.position = position;
    }

    /** Zero-based character offset of the offending token, or {@code -1} if not applicable. */
    public int position() {
        return position;
    }
}
