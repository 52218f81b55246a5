package io.fnanalyzer.core.model;

import io.fnanalyzer.core.expr.Expr;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete analysis of one expression: domain, range, intercepts and the optional point
 * evaluation, each with its step trace.
 *
 * <p>Immutable. Equal inputs produce equal results.
 */
public final class AnalysisResult {

    private final String expressionText;
    private final String variable;
    private final Expr expression;
    private final DomainResult domain;
    private final RangeResult range;
    private final InterceptResult intercepts;
    private final EvaluationResult evaluation;

    public AnalysisResult(
            String expressionText,
            String variable,
            Expr expression,
            DomainResult domain,
            RangeResult range,
            InterceptResult intercepts,
            EvaluationResult evaluation) {
        this.expressionText = Objects.requireNonNull(expressionText, "expressionText must not be null");
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.domain = Objects.requireNonNull(domain, "domain must not be null");
        this.range = Objects.requireNonNull(range, "range must not be null");
        this.intercepts = Objects.requireNonNull(intercepts, "intercepts must not be null");
        this.evaluation = evaluation;
    }

    /** The input as typed. */
    public String expressionText() {
        return expressionText;
    }

    /** Name of the free variable, e.g. {@code x}. */
    public String variable() {
        return variable;
    }

    public Expr expression() {
        return expression;
    }

    public DomainResult domain() {
        return domain;
    }

    public RangeResult range() {
        return range;
    }

    public InterceptResult intercepts() {
        return intercepts;
    }

    /** Present only when a point was requested. */
    public Optional<EvaluationResult> evaluation() {
        return Optional.ofNullable(evaluation);
    }

    /** The step traces in report order: domain, range, intercepts, evaluation (if any). */
    public List<StepTrace> traces() {
        return evaluation == null
                ? List.of(domain.trace(), range.trace(), intercepts.trace())
                : List.of(domain.trace(), range.trace(), intercepts.trace(), evaluation.trace());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisResult other)) return false;
        return expressionText.equals(other.expressionText)
                && variable.equals(other.variable)
                && expression.equals(other.expression)
                && domain.equals(other.domain)
                && range.equals(other.range)
                && intercepts.equals(other.intercepts)
                && Objects.equals(evaluation, other.evaluation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expressionText, variable, expression, domain, range, intercepts, evaluation);
    }

    @Override
    public String toString() {
        return "AnalysisResult{f(" + variable + ") = " + expression + ", domain=" + domain.description() + ", range="
                + range.description() + ", xIntercepts=" + intercepts.xIntercepts() + "}";
    }
}
