package com.openstable.sync.support;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Exponential backoff settings. Attempt n (starting at 1) waits
 * {@code min(initialDelay * multiplier^(n-1), maxDelay)} before the next try.
 */
public record BackoffPolicy(int maxRetries, Duration initialDelay, double multiplier, Duration maxDelay) {

    public static final BackoffPolicy DEFAULT =
            new BackoffPolicy(10, Duration.ofSeconds(1), 1.5, Duration.ofSeconds(30));

    public static BackoffPolicy of(int maxRetries, Duration initialDelay, double multiplier) {
        return new BackoffPolicy(maxRetries, initialDelay, multiplier, DEFAULT.maxDelay());
    }

    public List<String> violations() {
        List<String> violations = new ArrayList<>();
        if (maxRetries < 0) {
            violations.add("maxRetries must not be negative");
        }
        if (initialDelay == null || initialDelay.toMillis() < 1) {
            violations.add("initialDelay must be at least 1 ms");
        }
        if (multiplier < 1.0) {
            violations.add("multiplier must be at least 1.0");
        }
        if (maxDelay == null || (initialDelay != null && maxDelay.compareTo(initialDelay) < 0)) {
            violations.add("maxDelay must not be shorter than initialDelay");
        }
        return violations;
    }
}
