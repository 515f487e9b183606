package com.openstable.sync.subscription;

import com.openstable.sync.exception.InvalidSubscriptionOptionsException;
import com.openstable.sync.model.ChangeType;
import com.openstable.sync.support.BackoffPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Per-subscription settings. The retry policy applies to the shared channel and is taken
 * from the subscription that opens it.
 */
@Value
@Builder(toBuilder = true)
public class SubscriptionOptions {

    /** Change types delivered to handlers; matched on the type reported by the feed. */
    @Builder.Default
    Set<ChangeType> events = EnumSet.allOf(ChangeType.class);

    @Builder.Default
    BackoffPolicy retry = BackoffPolicy.DEFAULT;

    /** When set, views apply events in batches instead of one by one. */
    @Builder.Default
    boolean batchUpdates = false;

    @Builder.Default
    Duration batchDelay = Duration.ofMillis(100);

    @Builder.Default
    int maxBatchSize = 50;

    public static SubscriptionOptions defaults() {
        return SubscriptionOptions.builder().build();
    }

    public void validate() {
        List<String> violations = new ArrayList<>();
        if (events == null || events.isEmpty()) {
            violations.add("at least one event type must be delivered");
        }
        if (retry == null) {
            violations.add("retry policy is required");
        } else {
            violations.addAll(retry.violations());
        }
        if (batchUpdates) {
            if (batchDelay == null || batchDelay.isNegative() || batchDelay.isZero()) {
                violations.add("batchDelay must be positive");
            }
            if (maxBatchSize < 1) {
                violations.add("maxBatchSize must be positive");
            }
        }
        if (!violations.isEmpty()) {
            throw new InvalidSubscriptionOptionsException(violations);
        }
    }
}
