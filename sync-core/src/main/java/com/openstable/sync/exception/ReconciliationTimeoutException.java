package com.openstable.sync.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * No confirming change event and no explicit error arrived for an optimistic mutation in time.
 */
@Getter
public class ReconciliationTimeoutException extends SyncException {
    private final String localId;

    public ReconciliationTimeoutException(String collection, String localId, Duration timeout) {
        super(String.format("Optimistic change %s on %s not confirmed within %d ms",
                localId, collection, timeout.toMillis()), "RECONCILIATION_TIMEOUT");
        this.localId = localId;
    }
}
