package com.openstable.sync.subscription;

import com.openstable.sync.codec.EntityCodec;
import com.openstable.sync.exception.EntityDecodingException;
import com.openstable.sync.exception.SyncException;
import com.openstable.sync.filter.FilterDescriptor;
import com.openstable.sync.model.ChangeEvent;
import com.openstable.sync.model.ChangeType;
import com.openstable.sync.model.RawChangeEvent;
import com.openstable.sync.model.SyncEntity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A consumer's registration on a collection. Raw feed events are filtered and decoded here,
 * so handlers only see typed events for entities inside the subscription's filter.
 * An update that moves an entity out of the filter is delivered as a delete.
 */
@Slf4j
public class Subscription<T extends SyncEntity> {

    private final String id;
    private final FilterDescriptor filter;
    private final EntityCodec<T> codec;
    private final Set<ChangeType> events;
    private final ManagedChannel channel;
    private final Clock clock;
    private final Consumer<Subscription<T>> onRelease;
    private final List<ChangeHandler<T>> handlers = new CopyOnWriteArrayList<>();
    private final SubscriptionMetrics metrics = new SubscriptionMetrics();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile CompletableFuture<ConnectionStatus> connection = new CompletableFuture<>();

    Subscription(String id, FilterDescriptor filter, EntityCodec<T> codec, Set<ChangeType> events,
                 ChangeHandler<T> handler, ManagedChannel channel, Clock clock,
                 Consumer<Subscription<T>> onRelease) {
        this.id = id;
        this.filter = filter;
        this.codec = codec;
        this.events = Set.copyOf(events);
        this.channel = channel;
        this.clock = clock;
        this.onRelease = onRelease;
        this.handlers.add(handler);
    }

    public String getId() {
        return id;
    }

    public String getCollection() {
        return filter.collection();
    }

    public FilterDescriptor getFilter() {
        return filter;
    }

    public SubscriptionMetrics getMetrics() {
        return metrics;
    }

    public ConnectionStatus getStatus() {
        return closed.get() ? ConnectionStatus.CLOSED : channel.status();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Completes with the status reached by the most recent connection attempt.
     */
    public CompletableFuture<ConnectionStatus> connection() {
        return connection;
    }

    public void addHandler(ChangeHandler<T> handler) {
        handlers.add(handler);
    }

    /**
     * Manual recovery, typically after retries were exhausted and the subscription went DISCONNECTED.
     */
    public CompletableFuture<ConnectionStatus> reconnect() {
        if (closed.get()) {
            return CompletableFuture.completedFuture(ConnectionStatus.CLOSED);
        }
        connection = channel.reconnect();
        return connection;
    }

    /**
     * Stops delivery and releases the channel share. Safe to call more than once.
     */
    public void unsubscribe() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        onRelease.accept(this);
        log.info("Subscription {} closed", id);
        for (ChangeHandler<T> handler : handlers) {
            handler.onStatusChange(ConnectionStatus.CLOSED);
        }
        handlers.clear();
    }

    void connect() {
        if (channel.status() == ConnectionStatus.CONNECTED) {
            statusChanged(ConnectionStatus.CONNECTED);
        }
        connection = channel.connect();
    }

    void deliver(RawChangeEvent raw) {
        if (closed.get()) {
            return;
        }
        metrics.recordReceived();
        if (raw.eventType() == null || !events.contains(raw.eventType())) {
            metrics.recordFiltered();
            return;
        }
        ChangeEvent<T> event;
        try {
            event = toChangeEvent(raw);
        } catch (EntityDecodingException e) {
            metrics.recordDecodeFailure();
            log.warn("Dropping undecodable {} event on {}: {}", raw.eventType(), id, e.getMessage());
            return;
        }
        if (event == null) {
            metrics.recordFiltered();
            return;
        }
        metrics.recordDelivered(event.timestamp());
        for (ChangeHandler<T> handler : handlers) {
            try {
                handler.onChange(event);
            } catch (RuntimeException e) {
                metrics.recordHandlerError();
                log.error("Handler of subscription {} failed on {} {}", id, event.type(), event.key(), e);
            }
        }
    }

    void statusChanged(ConnectionStatus status) {
        if (closed.get()) {
            return;
        }
        if (status == ConnectionStatus.CONNECTED) {
            metrics.recordConnected(clock.instant());
        }
        handlers.forEach(handler -> handler.onStatusChange(status));
    }

    void fail(SyncException error) {
        if (closed.get()) {
            return;
        }
        handlers.forEach(handler -> handler.onError(error));
    }

    private ChangeEvent<T> toChangeEvent(RawChangeEvent raw) {
        Instant timestamp = raw.timestamp() != null ? raw.timestamp() : clock.instant();
        String collection = filter.collection();
        return switch (raw.eventType()) {
            case INSERT -> filter.matches(raw.newRow())
                    ? ChangeEvent.insert(collection, codec.decode(raw.newRow()), timestamp)
                    : null;
            case UPDATE -> {
                T entity = codec.decode(raw.newRow());
                yield filter.matches(raw.newRow())
                        ? ChangeEvent.update(collection, entity, timestamp)
                        : ChangeEvent.delete(collection, entity.getId(), entity, timestamp);
            }
            case DELETE -> ChangeEvent.delete(collection, EntityCodec.keyOf(raw.oldRow()),
                    decodeQuietly(raw.oldRow()), timestamp);
        };
    }

    // delete payloads often carry only the key
    private T decodeQuietly(Map<String, Object> row) {
        try {
            return codec.decode(row);
        } catch (EntityDecodingException e) {
            return null;
        }
    }
}
