package com.openstable.sync.view;

import com.openstable.common.dto.OperationResult;
import com.openstable.sync.codec.EntityCodec;
import com.openstable.sync.exception.EntityDecodingException;
import com.openstable.sync.exception.LoadException;
import com.openstable.sync.exception.SyncException;
import com.openstable.sync.filter.FilterDescriptor;
import com.openstable.sync.merge.CacheMerge;
import com.openstable.sync.model.ChangeEvent;
import com.openstable.sync.model.SyncEntity;
import com.openstable.sync.subscription.ChangeHandler;
import com.openstable.sync.subscription.ConnectionStatus;
import com.openstable.sync.subscription.Subscription;
import com.openstable.sync.subscription.SubscriptionManager;
import com.openstable.sync.subscription.SubscriptionOptions;
import com.openstable.sync.support.Batcher;
import com.openstable.sync.transport.BackingStore;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Live, locally cached copy of the entities matching a filter.
 *
 * <p>The view loads the collection from the {@link BackingStore} and then keeps it current,
 * either by applying change feed events or by periodic reloads. Events that arrive while a
 * load is in flight are queued and replayed on top of the loaded data, so nothing delivered
 * during a load is lost.
 *
 * <p>Readers get immutable {@link ViewState} snapshots; writers (the feed, loads and local
 * optimistic changes) are serialized on the view's monitor.
 */
@Slf4j
public class EntityView<T extends SyncEntity> implements AutoCloseable {

    private final FilterDescriptor filter;
    private final EntityCodec<T> codec;
    private final BackingStore store;
    private final SubscriptionManager subscriptionManager;
    private final TaskScheduler scheduler;
    private final RefreshPolicy refreshPolicy;
    private final SubscriptionOptions options;

    private final AtomicReference<ViewState<T>> state = new AtomicReference<>(ViewState.initial());
    private final List<Consumer<ViewState<T>>> stateListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<ChangeEvent<T>>> changeListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<List<T>>> loadListeners = new CopyOnWriteArrayList<>();
    private final Object monitor = new Object();

    // guarded by monitor
    private final List<ChangeEvent<T>> queuedDuringLoad = new ArrayList<>();
    private boolean loading;
    private long loadGeneration;
    private boolean started;
    private boolean closed;
    private boolean connectedBefore;
    private Subscription<T> subscription;
    private ScheduledFuture<?> pollTask;
    private Batcher<ChangeEvent<T>> batcher;

    @Builder
    public EntityView(FilterDescriptor filter, EntityCodec<T> codec, BackingStore store,
                      SubscriptionManager subscriptionManager, TaskScheduler scheduler,
                      RefreshPolicy refreshPolicy, SubscriptionOptions options) {
        this.filter = filter;
        this.codec = codec;
        this.store = store;
        this.subscriptionManager = subscriptionManager;
        this.scheduler = scheduler;
        this.refreshPolicy = refreshPolicy != null ? refreshPolicy : RefreshPolicy.eventDriven();
        this.options = options != null ? options : SubscriptionOptions.defaults();
    }

    /**
     * Subscribes (or schedules polling) and performs the initial load.
     */
    public CompletableFuture<OperationResult<List<T>>> start() {
        boolean subscribe = false;
        synchronized (monitor) {
            if (closed) {
                return CompletableFuture.completedFuture(OperationResult.failure(closedError()));
            }
            if (!started) {
                started = true;
                if (refreshPolicy instanceof RefreshPolicy.PeriodicPoll poll) {
                    pollTask = scheduler.scheduleAtFixedRate(this::poll,
                            scheduler.getClock().instant().plus(poll.interval()), poll.interval());
                    log.info("View on {} polling every {}", filter, poll.interval());
                } else {
                    if (options.isBatchUpdates()) {
                        batcher = new Batcher<>(this::applyEvents, options.getBatchDelay(),
                                options.getMaxBatchSize(), scheduler);
                    }
                    subscribe = true;
                }
            }
        }
        if (subscribe) {
            // channel dispatch takes the channel lock before the view monitor, so subscribe outside the monitor
            Subscription<T> created = subscriptionManager.subscribe(filter, codec, new FeedHandler(), options);
            synchronized (monitor) {
                subscription = created;
            }
        }
        return refresh();
    }

    /**
     * Reloads the whole collection and replaces the cache with the result.
     * On failure the previous items are kept and the state becomes {@link LoadState#FAILED}.
     */
    public CompletableFuture<OperationResult<List<T>>> refresh() {
        long generation;
        synchronized (monitor) {
            if (closed) {
                return CompletableFuture.completedFuture(OperationResult.failure(closedError()));
            }
            generation = ++loadGeneration;
            loading = true;
            publish(state.get().loading());
        }
        CompletableFuture<List<Map<String, Object>>> query;
        try {
            query = store.query(filter);
        } catch (RuntimeException e) {
            query = CompletableFuture.failedFuture(e);
        }
        return query
                .thenApply(this::decodeRows)
                .handle((items, error) -> error == null
                        ? onLoaded(generation, items)
                        : onLoadFailed(generation, error));
    }

    public List<T> snapshot() {
        return state.get().items();
    }

    public ViewState<T> getState() {
        return state.get();
    }

    public Optional<T> find(String id) {
        return CacheMerge.findByKey(snapshot(), id, SyncEntity::getId);
    }

    public String getCollection() {
        return filter.collection();
    }

    public FilterDescriptor getFilter() {
        return filter;
    }

    public EntityCodec<T> getCodec() {
        return codec;
    }

    public Optional<Subscription<T>> getSubscription() {
        synchronized (monitor) {
            return Optional.ofNullable(subscription);
        }
    }

    /**
     * Applies a local change to the cached items, used for optimistic updates.
     */
    public void mutate(UnaryOperator<List<T>> change) {
        synchronized (monitor) {
            if (closed) {
                return;
            }
            publish(state.get().withItems(change.apply(state.get().items())));
        }
    }

    public void addStateListener(Consumer<ViewState<T>> listener) {
        stateListeners.add(listener);
    }

    /**
     * Notified with each feed event after it has been applied to the cache.
     */
    public void addChangeListener(Consumer<ChangeEvent<T>> listener) {
        changeListeners.add(listener);
    }

    public void removeChangeListener(Consumer<ChangeEvent<T>> listener) {
        changeListeners.remove(listener);
    }

    /**
     * Notified with the cached items after every successful load, initial, manual, polled or
     * after a reconnect. Polling views deliver no change events, so this is how consumers
     * learn what the store holds.
     */
    public void addLoadListener(Consumer<List<T>> listener) {
        loadListeners.add(listener);
    }

    public void removeLoadListener(Consumer<List<T>> listener) {
        loadListeners.remove(listener);
    }

    @Override
    public void close() {
        Subscription<T> toRelease;
        synchronized (monitor) {
            if (closed) {
                return;
            }
            closed = true;
            toRelease = subscription;
            if (pollTask != null) {
                pollTask.cancel(false);
            }
            if (batcher != null) {
                batcher.clear();
            }
            queuedDuringLoad.clear();
        }
        if (toRelease != null) {
            toRelease.unsubscribe();
        }
        log.info("View on {} closed", filter);
    }

    private void poll() {
        refresh().thenAccept(result -> {
            if (result.isFailure()) {
                log.warn("Periodic reload of {} failed: {}", filter, result.getMessage());
            }
        });
    }

    private void applyEvents(List<ChangeEvent<T>> events) {
        synchronized (monitor) {
            if (closed) {
                return;
            }
            if (loading) {
                queuedDuringLoad.addAll(events);
                return;
            }
            publish(state.get().withItems(applyAll(state.get().items(), events)));
        }
        events.forEach(this::notifyChange);
    }

    private OperationResult<List<T>> onLoaded(long generation, List<T> items) {
        List<ChangeEvent<T>> replayed;
        synchronized (monitor) {
            if (closed || generation != loadGeneration) {
                return OperationResult.success(snapshot());
            }
            replayed = List.copyOf(queuedDuringLoad);
            queuedDuringLoad.clear();
            loading = false;
            List<T> loaded = applyAll(CacheMerge.mergeData(List.of(), items, SyncEntity::getId), replayed);
            publish(state.get().loaded(loaded, scheduler.getClock().instant()));
        }
        log.debug("Loaded {} entities into view on {} ({} queued events replayed)",
                items.size(), filter, replayed.size());
        replayed.forEach(this::notifyChange);
        List<T> current = snapshot();
        for (Consumer<List<T>> listener : loadListeners) {
            try {
                listener.accept(current);
            } catch (RuntimeException e) {
                log.error("Load listener of view on {} failed", filter, e);
            }
        }
        return OperationResult.success(current);
    }

    private OperationResult<List<T>> onLoadFailed(long generation, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        LoadException failure = new LoadException(filter.collection(), cause);
        List<ChangeEvent<T>> replayed;
        synchronized (monitor) {
            if (closed || generation != loadGeneration) {
                return OperationResult.failure(failure);
            }
            replayed = List.copyOf(queuedDuringLoad);
            queuedDuringLoad.clear();
            loading = false;
            publish(state.get().failed(applyAll(state.get().items(), replayed), failure));
        }
        log.error("Load of view on {} failed: {}", filter, cause.getMessage());
        replayed.forEach(this::notifyChange);
        return OperationResult.failure(failure);
    }

    private List<T> decodeRows(List<Map<String, Object>> rows) {
        List<T> items = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            try {
                items.add(codec.decode(row));
            } catch (EntityDecodingException e) {
                log.warn("Skipping undecodable row in {}: {}", filter.collection(), e.getMessage());
            }
        }
        return items;
    }

    private List<T> applyAll(List<T> items, List<ChangeEvent<T>> events) {
        List<T> current = items;
        for (ChangeEvent<T> event : events) {
            current = switch (event.type()) {
                case INSERT, UPDATE -> CacheMerge.mergeData(current, List.of(event.current()), SyncEntity::getId);
                case DELETE -> CacheMerge.removeData(current, List.of(event.key()), SyncEntity::getId);
            };
        }
        return current;
    }

    // caller holds the monitor
    private void publish(ViewState<T> next) {
        state.set(next);
        for (Consumer<ViewState<T>> listener : stateListeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException e) {
                log.error("State listener of view on {} failed", filter, e);
            }
        }
    }

    private void notifyChange(ChangeEvent<T> event) {
        for (Consumer<ChangeEvent<T>> listener : changeListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Change listener of view on {} failed on {}", filter, event.key(), e);
            }
        }
    }

    private LoadException closedError() {
        return new LoadException(filter.collection(), new IllegalStateException("view is closed"));
    }

    private final class FeedHandler implements ChangeHandler<T> {

        @Override
        public void onChange(ChangeEvent<T> event) {
            Batcher<ChangeEvent<T>> activeBatcher;
            synchronized (monitor) {
                activeBatcher = batcher;
            }
            if (activeBatcher != null) {
                activeBatcher.add(event);
            } else {
                applyEvents(List.of(event));
            }
        }

        @Override
        public void onError(SyncException error) {
            log.error("Feed of view on {} failed: {}", filter, error.getMessage());
            synchronized (monitor) {
                if (!closed) {
                    publish(state.get().withTransportError(error));
                }
            }
        }

        @Override
        public void onStatusChange(ConnectionStatus status) {
            if (status != ConnectionStatus.CONNECTED) {
                return;
            }
            boolean reload;
            synchronized (monitor) {
                reload = connectedBefore && !closed;
                connectedBefore = true;
                if (state.get().transportError() != null) {
                    publish(state.get().withTransportError(null));
                }
            }
            if (reload) {
                // events may have been missed while the channel was down
                log.info("Feed of view on {} reconnected, reloading", filter);
                refresh();
            }
        }
    }
}
