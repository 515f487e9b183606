package com.openstable.sync.exception;

import lombok.Getter;

/**
 * Thrown when an operation retried with backoff still fails on its last attempt.
 * The cause is the error of that last attempt.
 */
@Getter
public class RetryExhaustedException extends SyncException {
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastError) {
        super(String.format("Operation %s failed after %d attempts: %s",
                operation, attempts, lastError == null ? "unknown error" : lastError.getMessage()),
                lastError, "RETRY_EXHAUSTED");
        this.attempts = attempts;
    }
}
