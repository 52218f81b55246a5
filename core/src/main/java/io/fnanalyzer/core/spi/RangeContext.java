package io.fnanalyzer.core.spi;

import io.fnanalyzer.core.engine.AnalyzerConfig;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.model.DomainResult;
import io.fnanalyzer.core.model.StepTrace;
import java.util.Objects;

/**
 * Input handed to each {@link RangeStrategy}.
 *
 * @param expression the parsed expression
 * @param domain     the domain computed before the range, used to skip excluded inputs
 * @param config     sampling window, sample count and solve budget
 * @param trace      range trace being built; strategies append their derivation steps
 */
public record RangeContext(Expr expression, DomainResult domain, AnalyzerConfig config, StepTrace.Builder trace) {

    public RangeContext {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(domain, "domain must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(trace, "trace must not be null");
    }

    /** Name of the free variable. */
    public String variable() {
        return config.variable();
    }
}
