package io.fnanalyzer.core.engine;

import io.fnanalyzer.core.error.SolveBudgetExceededException;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.model.DomainResult;
import io.fnanalyzer.core.model.ExcludedSet;
import io.fnanalyzer.core.model.RangeResult;
import io.fnanalyzer.core.model.StepTrace;
import io.fnanalyzer.core.model.TraceCategory;
import io.fnanalyzer.core.spi.RangeContext;
import io.fnanalyzer.core.spi.RangeOutcome;
import io.fnanalyzer.core.spi.RangeStrategy;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the range by trying the registered {@link RangeStrategy}s in order; the first one
 * that applies wins. Strategies that do not apply, or exceed the solve budget, are recorded in
 * the trace with the reason.
 */
public final class RangeAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(RangeAnalyzer.class);

    /** Strategy id reported when no registered strategy produced an answer. */
    public static final String UNDETERMINED = "undetermined";

    private final AnalyzerConfig config;
    private final StrategyRegistry registry;

    public RangeAnalyzer(AnalyzerConfig config, StrategyRegistry registry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public RangeResult analyze(Expr expr, DomainResult domain) {
        StepTrace.Builder trace = StepTrace.builder(TraceCategory.RANGE);
        RangeContext context = new RangeContext(expr, domain, config, trace);
        for (RangeStrategy strategy : registry.strategies()) {
            RangeOutcome outcome;
            try {
                outcome = strategy.attempt(context);
            } catch (SolveBudgetExceededException e) {
                LOG.debug("Range strategy '{}' exceeded its budget for {}: {}", strategy.id(), expr, e.getMessage());
                trace.step("The " + strategy.id() + " strategy gave up (" + e.getMessage() + "), trying the next one");
                continue;
            }
            if (outcome instanceof RangeOutcome.Solved solved) {
                String description = solved.excluded().render();
                if (solved.approximate()) {
                    trace.step("The result is approximate: bounds were estimated numerically");
                }
                trace.conclusion("Range: " + description + (solved.approximate() ? " (approximate)" : ""));
                LOG.debug("Range of {} is {} via '{}'", expr, description, strategy.id());
                return new RangeResult(solved.excluded(), description, strategy.id(), solved.approximate(), trace.build());
            }
            RangeOutcome.NotApplicable skipped = (RangeOutcome.NotApplicable) outcome;
            trace.step("The " + strategy.id() + " strategy does not apply: " + skipped.reason());
        }
        LOG.warn("No range strategy applied to {}", expr);
        trace.conclusion("Range: undetermined");
        return new RangeResult(ExcludedSet.NONE, "undetermined", UNDETERMINED, true, trace.build());
    }
}
