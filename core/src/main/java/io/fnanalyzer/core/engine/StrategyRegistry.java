package io.fnanalyzer.core.engine;

import io.fnanalyzer.core.engine.range.PolynomialRangeStrategy;
import io.fnanalyzer.core.engine.range.RationalRangeStrategy;
import io.fnanalyzer.core.engine.range.SampledRangeStrategy;
import io.fnanalyzer.core.engine.range.TrigRangeStrategy;
import io.fnanalyzer.core.spi.RangeStrategy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered registry of range strategies. The range analyzer tries them in registration order.
 * Thread-safe: registration and lookup are synchronized.
 */
public final class StrategyRegistry {

    private final Map<String, RangeStrategy> strategies = new LinkedHashMap<>();

    /** Registry with the built-in strategies: rational, polynomial, trig, sampled. */
    public static StrategyRegistry defaults() {
        StrategyRegistry registry = new StrategyRegistry();
        registry.register(new RationalRangeStrategy());
        registry.register(new PolynomialRangeStrategy());
        registry.register(new TrigRangeStrategy());
        registry.register(new SampledRangeStrategy());
        return registry;
    }

    /**
     * Registers a strategy. A strategy with the same id is replaced in place, keeping its
     * position in the order.
     *
     * @throws NullPointerException if strategy is null
     * @throws IllegalArgumentException if strategy.id() is null or empty
     */
    public synchronized void register(RangeStrategy strategy) {
        if (strategy == null) {
            throw new NullPointerException("strategy must not be null");
        }
        String id = strategy.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("strategy id must not be null or empty");
        }
        strategies.put(id, strategy);
    }

    /** Looks up a strategy by id. */
    public synchronized Optional<RangeStrategy> getStrategy(String id) {
        return Optional.ofNullable(strategies.get(id));
    }

    /** @throws IllegalArgumentException if no strategy is registered with the given id */
    public RangeStrategy requireStrategy(String id) {
        return getStrategy(id)
                .orElseThrow(() -> new IllegalArgumentException("No range strategy registered for id: '" + id + "'"));
    }

    /** Snapshot of the strategies in trial order. */
    public synchronized List<RangeStrategy> strategies() {
        return List.copyOf(new ArrayList<>(strategies.values()));
    }

    public synchronized int size() {
        return strategies.size();
    }

    public synchronized boolean hasStrategy(String id) {
        return strategies.containsKey(id);
    }
}
