package com.openstable.sync.subscription;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of one subscription. Updated from the dispatching thread, read from anywhere.
 */
public class SubscriptionMetrics {

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong filtered = new AtomicLong();
    private final AtomicLong decodeFailures = new AtomicLong();
    private final AtomicLong handlerErrors = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private volatile Instant lastEventAt;
    private volatile Instant connectedAt;

    void recordReceived() {
        received.incrementAndGet();
    }

    void recordDelivered(Instant at) {
        delivered.incrementAndGet();
        lastEventAt = at;
    }

    void recordFiltered() {
        filtered.incrementAndGet();
    }

    void recordDecodeFailure() {
        decodeFailures.incrementAndGet();
    }

    void recordHandlerError() {
        handlerErrors.incrementAndGet();
    }

    void recordReconnect() {
        reconnects.incrementAndGet();
    }

    void recordConnected(Instant at) {
        connectedAt = at;
    }

    public long getReceived() {
        return received.get();
    }

    public long getDelivered() {
        return delivered.get();
    }

    public long getFiltered() {
        return filtered.get();
    }

    public long getDecodeFailures() {
        return decodeFailures.get();
    }

    public long getHandlerErrors() {
        return handlerErrors.get();
    }

    public long getReconnects() {
        return reconnects.get();
    }

    public Instant getLastEventAt() {
        return lastEventAt;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }
}
