package com.openstable.sync.view;

import java.time.Duration;
import java.util.Objects;

/**
 * How a view stays current after its initial load.
 */
public sealed interface RefreshPolicy {

    static RefreshPolicy eventDriven() {
        return new EventDriven();
    }

    static RefreshPolicy poll(Duration interval) {
        return new PeriodicPoll(interval);
    }

    /**
     * Apply change feed events as they arrive.
     */
    record EventDriven() implements RefreshPolicy {
    }

    /**
     * No feed subscription; reload the whole collection on a fixed interval.
     */
    record PeriodicPoll(Duration interval) implements RefreshPolicy {
        public PeriodicPoll {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("Poll interval must be positive: " + interval);
            }
        }
    }
}
