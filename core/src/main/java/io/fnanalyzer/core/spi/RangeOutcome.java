package io.fnanalyzer.core.spi;

import io.fnanalyzer.core.model.ExcludedSet;
import io.fnanalyzer.core.model.Interval;
import java.util.Collection;
import java.util.Objects;

/** Answer of a {@link RangeStrategy}: either the excluded output values or why it passed. */
public sealed interface RangeOutcome {

    /** Builds a result from the intervals of attained values. */
    static RangeOutcome attained(Collection<Interval> values, boolean approximate) {
        return new Solved(ExcludedSet.complementOf(values), approximate);
    }

    static RangeOutcome notApplicable(String reason) {
        return new NotApplicable(reason);
    }

    /**
     * The range was computed.
     *
     * @param excluded    output values never attained
     * @param approximate whether the answer relies on numeric sampling
     */
    record Solved(ExcludedSet excluded, boolean approximate) implements RangeOutcome {
        public Solved {
            Objects.requireNonNull(excluded, "excluded must not be null");
        }
    }

    /** The expression is outside this strategy's family. */
    record NotApplicable(String reason) implements RangeOutcome {
        public NotApplicable {
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }
}
