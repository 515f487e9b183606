package com.openstable.sync.subscription;

import com.openstable.sync.exception.TransportException;
import com.openstable.sync.filter.FilterDescriptor;
import com.openstable.sync.model.RawChangeEvent;
import com.openstable.sync.support.BackoffPolicy;
import com.openstable.sync.support.BackoffRetrier;
import com.openstable.sync.transport.ChangeFeedTransport;
import com.openstable.sync.transport.ChannelListener;
import com.openstable.sync.transport.TransportChannel;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One transport channel shared by every subscription with the same collection and filter.
 * Owns the connection state machine:
 * DISCONNECTED -> CONNECTING -> CONNECTED -> RECONNECTING -> CONNECTED ..., CLOSED is terminal.
 * Events are dispatched to the attached subscriptions one at a time.
 */
@Slf4j
class ManagedChannel implements ChannelListener {

    private final FilterDescriptor filter;
    private final ChangeFeedTransport transport;
    private final BackoffRetrier retrier;
    private final BackoffPolicy policy;
    private final Clock clock;
    private final List<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private TransportChannel channel;
    private CompletableFuture<TransportChannel> pendingOpen;
    private CompletableFuture<ConnectionStatus> settling;
    private Instant lastActivity;
    private int reconnects;

    ManagedChannel(FilterDescriptor filter, ChangeFeedTransport transport, BackoffRetrier retrier,
                   BackoffPolicy policy, Clock clock) {
        this.filter = filter;
        this.transport = transport;
        this.retrier = retrier;
        this.policy = policy;
        this.clock = clock;
        this.lastActivity = clock.instant();
    }

    String key() {
        return filter.channelKey();
    }

    ConnectionStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    void attach(Subscription<?> subscription) {
        subscriptions.add(subscription);
    }

    int detach(Subscription<?> subscription) {
        subscriptions.remove(subscription);
        return subscriptions.size();
    }

    int subscriberCount() {
        return subscriptions.size();
    }

    /**
     * Opens the channel unless it is already open or opening.
     * The future completes with the status reached once the attempt settles.
     */
    CompletableFuture<ConnectionStatus> connect() {
        synchronized (lock) {
            if (status == ConnectionStatus.CONNECTED || status == ConnectionStatus.CLOSED) {
                return CompletableFuture.completedFuture(status);
            }
            if (settling != null && !settling.isDone()) {
                return settling;
            }
            transition(ConnectionStatus.CONNECTING);
            return establish();
        }
    }

    /**
     * Drops the current channel, if any, and opens a fresh one with a new retry budget.
     */
    CompletableFuture<ConnectionStatus> reconnect() {
        synchronized (lock) {
            if (status == ConnectionStatus.CLOSED) {
                return CompletableFuture.completedFuture(status);
            }
            if (settling != null && !settling.isDone()) {
                return settling;
            }
            if (channel != null) {
                release(channel);
                channel = null;
            }
            reconnects++;
            log.info("Reconnecting channel {}", key());
            transition(ConnectionStatus.RECONNECTING);
            return establish();
        }
    }

    @Override
    public void onEvent(RawChangeEvent event) {
        synchronized (lock) {
            if (status == ConnectionStatus.CLOSED) {
                return;
            }
            lastActivity = clock.instant();
            for (Subscription<?> subscription : subscriptions) {
                subscription.deliver(event);
            }
        }
    }

    @Override
    public void onDisconnect(Throwable cause) {
        synchronized (lock) {
            if (status != ConnectionStatus.CONNECTED) {
                return;
            }
            log.warn("Channel {} lost: {}. Reconnecting", key(), cause == null ? "no cause" : cause.getMessage());
            channel = null;
            reconnects++;
            subscriptions.forEach(subscription -> subscription.getMetrics().recordReconnect());
            transition(ConnectionStatus.RECONNECTING);
            establish();
        }
    }

    void close() {
        synchronized (lock) {
            if (status == ConnectionStatus.CLOSED) {
                return;
            }
            status = ConnectionStatus.CLOSED;
            if (pendingOpen != null) {
                pendingOpen.cancel(false);
                pendingOpen = null;
            }
            if (channel != null) {
                release(channel);
                channel = null;
            }
            log.info("Channel {} closed", key());
        }
    }

    ChannelStats.ChannelInfo info() {
        synchronized (lock) {
            return new ChannelStats.ChannelInfo(key(), filter.collection(), status, subscriptions.size(),
                    lastActivity, reconnects);
        }
    }

    // caller holds the lock
    private CompletableFuture<ConnectionStatus> establish() {
        CompletableFuture<TransportChannel> opening = retrier.retryWithBackoff("channel " + key(),
                () -> transport.open(filter.collection(), filter.toQueryString(), this)
                        .whenComplete((opened, error) -> releaseIfClosed(opened)),
                policy);
        pendingOpen = opening;
        CompletableFuture<ConnectionStatus> result = opening.handle((opened, error) -> onOpened(opening, opened, error));
        settling = result;
        return result;
    }

    private ConnectionStatus onOpened(CompletableFuture<TransportChannel> opening, TransportChannel opened,
                                      Throwable error) {
        synchronized (lock) {
            if (pendingOpen == opening) {
                pendingOpen = null;
            }
            if (status == ConnectionStatus.CLOSED) {
                if (opened != null) {
                    release(opened);
                }
                return status;
            }
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                TransportException failure = new TransportException(
                        "Channel " + key() + " could not be established: " + cause.getMessage(), cause);
                log.error("Channel {} disconnected for good: {}", key(), cause.getMessage());
                transition(ConnectionStatus.DISCONNECTED);
                subscriptions.forEach(subscription -> subscription.fail(failure));
                return status;
            }
            channel = opened;
            lastActivity = clock.instant();
            transition(ConnectionStatus.CONNECTED);
            log.info("Channel {} connected", key());
            return status;
        }
    }

    private void releaseIfClosed(TransportChannel opened) {
        if (opened == null) {
            return;
        }
        synchronized (lock) {
            if (status == ConnectionStatus.CLOSED) {
                release(opened);
            }
        }
    }

    private void transition(ConnectionStatus next) {
        if (status == next) {
            return;
        }
        log.debug("Channel {} {} -> {}", key(), status, next);
        status = next;
        subscriptions.forEach(subscription -> subscription.statusChanged(next));
    }

    private void release(TransportChannel released) {
        try {
            transport.close(released);
        } catch (RuntimeException e) {
            log.warn("Failed to release channel {} of {}", released.id(), key(), e);
        }
    }
}
