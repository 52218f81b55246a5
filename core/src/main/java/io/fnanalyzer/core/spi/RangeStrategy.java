package io.fnanalyzer.core.spi;

/**
 * Pluggable range computation for one family of functions (rational, polynomial, trigonometric,
 * sampled). The range analyzer tries registered strategies in order and keeps the first answer.
 *
 * <p>Implementations MUST be stateless and thread-safe. They may throw {@link
 * io.fnanalyzer.core.error.SolveBudgetExceededException}; the analyzer then moves on to the next
 * strategy.
 */
public interface RangeStrategy {

    /**
     * Returns the strategy identifier, e.g. {@code "rational"}. Reported in {@code
     * RangeResult.strategyId()}.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Attempts to compute the range. Steps explaining the derivation go to {@link
     * RangeContext#trace()}.
     *
     * @param context the expression, its domain and the analyzer configuration
     * @return the attained values, or the reason this strategy does not apply
     */
    RangeOutcome attempt(RangeContext context);
}
