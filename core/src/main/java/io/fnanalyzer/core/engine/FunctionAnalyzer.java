package io.fnanalyzer.core.engine;

import io.fnanalyzer.core.algebra.RealNumber;
import io.fnanalyzer.core.error.ExpressionParseException;
import io.fnanalyzer.core.error.UndefinedEvaluationException;
import io.fnanalyzer.core.expr.Expr;
import io.fnanalyzer.core.expr.ExpressionParser;
import io.fnanalyzer.core.model.AnalysisResult;
import io.fnanalyzer.core.model.DomainResult;
import io.fnanalyzer.core.model.EvaluationResult;
import io.fnanalyzer.core.model.InterceptResult;
import io.fnanalyzer.core.model.RangeResult;
import io.fnanalyzer.core.spi.AnalysisListener;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the analysis pipeline: parse, then domain, range, intercepts and the optional
 * point evaluation, each with its own trace.
 *
 * <p>Parse failures propagate as {@link ExpressionParseException}; everything after parsing
 * degrades to approximate or undefined results instead of failing. Instances hold no per-call
 * state and may be shared between threads.
 */
public final class FunctionAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(FunctionAnalyzer.class);

    private final AnalyzerConfig config;
    private final ExpressionParser parser;
    private final DomainAnalyzer domainAnalyzer;
    private final RangeAnalyzer rangeAnalyzer;
    private final InterceptSolver interceptSolver;
    private final PointEvaluator pointEvaluator;
    private final AnalysisListener listener;

    /** Analyzer with the default strategies and no listener. */
    public FunctionAnalyzer(AnalyzerConfig config) {
        this(config, StrategyRegistry.defaults(), null);
    }

    /**
     * Creates an analyzer with a custom strategy registry and an optional listener.
     *
     * @param config     analysis settings
     * @param strategies range strategies, tried in registration order
     * @param listener   optional listener for analysis lifecycle events, may be null
     */
    public FunctionAnalyzer(AnalyzerConfig config, StrategyRegistry strategies, AnalysisListener listener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(strategies, "strategies must not be null");
        this.parser = new ExpressionParser(config.variable());
        this.domainAnalyzer = new DomainAnalyzer(config);
        this.rangeAnalyzer = new RangeAnalyzer(config, strategies);
        this.interceptSolver = new InterceptSolver(config);
        this.pointEvaluator = new PointEvaluator(config);
        this.listener = listener; // nullable
    }

    public AnalysisResult analyze(String expressionText) {
        return analyze(expressionText, null);
    }

    /**
     * Analyzes an expression and, when {@code pointText} is not blank, evaluates it there.
     *
     * @throws ExpressionParseException if the expression or the point is rejected
     */
    public AnalysisResult analyze(String expressionText, String pointText) {
        long start = System.nanoTime();
        notifyStarted(expressionText, pointText);
        Expr expr;
        RealNumber point = null;
        try {
            expr = parser.parse(expressionText);
            if (pointText != null && !pointText.isBlank()) {
                point = parsePoint(pointText);
            }
        } catch (ExpressionParseException e) {
            long durationMs = elapsedMs(start);
            LOG.info("Rejected expression '{}': {}", expressionText, e.getMessage());
            notifyRejected(expressionText, durationMs, e.getMessage());
            throw e;
        }

        DomainResult domain = domainAnalyzer.analyze(expr);
        RangeResult range = rangeAnalyzer.analyze(expr, domain);
        InterceptResult intercepts = interceptSolver.solve(expr, domain);
        EvaluationResult evaluation = point == null ? null : pointEvaluator.evaluate(expr, domain, point);
        AnalysisResult result =
                new AnalysisResult(expressionText, config.variable(), expr, domain, range, intercepts, evaluation);

        long durationMs = elapsedMs(start);
        boolean approximate = domain.approximate() || range.approximate() || intercepts.approximate();
        LOG.info(
                "Analyzed '{}': domain={}, range={} (strategy={}), approximate={}, {}ms",
                expressionText,
                domain.description(),
                range.description(),
                range.strategyId(),
                approximate,
                durationMs);
        notifyCompleted(expressionText, durationMs, range.strategyId(), approximate);
        return result;
    }

    public AnalyzerConfig config() {
        return config;
    }

    private RealNumber parsePoint(String pointText) {
        Expr value = parser.parseValue(pointText);
        try {
            return PointEvaluator.pointValue(value);
        } catch (UndefinedEvaluationException e) {
            throw new ExpressionParseException(
                    "Point '" + pointText.strip() + "' is not a real number: " + e.getMessage(), e, pointText, -1);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Listener notification helpers ---
    // Listener exceptions are caught and logged; they never affect the analysis.

    private void notifyStarted(String expressionText, String pointText) {
        if (listener == null) return;
        try {
            listener.onAnalysisStarted(new AnalysisListener.AnalysisStartedEvent(expressionText, pointText));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onAnalysisStarted failed", e);
        }
    }

    private void notifyCompleted(String expressionText, long durationMs, String strategy, boolean approximate) {
        if (listener == null) return;
        try {
            listener.onAnalysisCompleted(
                    new AnalysisListener.AnalysisCompletedEvent(expressionText, durationMs, strategy, approximate));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onAnalysisCompleted failed", e);
        }
    }

    private void notifyRejected(String expressionText, long durationMs, String detail) {
        if (listener == null) return;
        try {
            listener.onAnalysisRejected(new AnalysisListener.AnalysisRejectedEvent(expressionText, durationMs, detail));
        } catch (Exception e) {
            LOG.warn("AnalysisListener.onAnalysisRejected failed", e);
        }
    }
}
