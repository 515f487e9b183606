package com.openstable.sync.optimistic;

import com.openstable.common.dto.OperationResult;
import com.openstable.common.exception.ResourceNotFoundException;
import com.openstable.common.util.Constants;
import com.openstable.sync.codec.EntityCodec;
import com.openstable.sync.exception.ReconciliationTimeoutException;
import com.openstable.sync.exception.SyncException;
import com.openstable.sync.exception.WriteRejectedException;
import com.openstable.sync.merge.CacheMerge;
import com.openstable.sync.model.ChangeEvent;
import com.openstable.sync.model.ChangeType;
import com.openstable.sync.model.SyncEntity;
import com.openstable.sync.transport.BackingStore;
import com.openstable.sync.view.EntityView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Applies creates, updates and removals to an {@link EntityView} before the server confirms them,
 * then reconciles with the outcome.
 *
 * <p>Lifecycle of a mutation:
 * <ol>
 *   <li>The change is applied to the view immediately. Creates get a temporary key ({@code tmp-1}, ...).</li>
 *   <li>The write is issued to the {@link BackingStore}. On success a create's temporary key is
 *       swapped for the server id.</li>
 *   <li>A matching change feed event confirms the mutation. So does a reload of the view that
 *       shows the acknowledged write, which is the only confirmation a polling view gets.</li>
 *   <li>A rejected write rolls the view back to its pre-mutation key set and fails the returned future.</li>
 *   <li>Without confirmation or error within the timeout the change is rolled back, failure listeners
 *       are notified and the view reloads from the store.</li>
 * </ol>
 */
@Slf4j
public class OptimisticMutationCoordinator<T extends SyncEntity> implements AutoCloseable {

    public static final Duration DEFAULT_CONFIRMATION_TIMEOUT = Duration.ofSeconds(10);

    private final EntityView<T> view;
    private final BackingStore store;
    private final TaskScheduler scheduler;
    private final Duration confirmationTimeout;
    private final Supplier<String> temporaryIds;
    private final EntityCodec<T> codec;
    private final AtomicLong mutationSequence = new AtomicLong();
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();
    private final List<Consumer<SyncException>> failureListeners = new CopyOnWriteArrayList<>();
    private final Consumer<ChangeEvent<T>> reconciler = this::reconcile;
    private final Consumer<List<T>> reloadReconciler = this::reconcileLoaded;
    private final Object lock = new Object();

    public OptimisticMutationCoordinator(EntityView<T> view, BackingStore store, TaskScheduler scheduler,
                                         Duration confirmationTimeout) {
        this(view, store, scheduler, confirmationTimeout, sequentialTemporaryIds());
    }

    public OptimisticMutationCoordinator(EntityView<T> view, BackingStore store, TaskScheduler scheduler,
                                         Duration confirmationTimeout, Supplier<String> temporaryIds) {
        this.view = view;
        this.store = store;
        this.scheduler = scheduler;
        this.confirmationTimeout = confirmationTimeout;
        this.temporaryIds = temporaryIds;
        this.codec = view.getCodec();
        view.addChangeListener(reconciler);
        view.addLoadListener(reloadReconciler);
    }

    public static Supplier<String> sequentialTemporaryIds() {
        AtomicLong sequence = new AtomicLong();
        return () -> Constants.TEMP_ID_PREFIX + sequence.incrementAndGet();
    }

    /**
     * Shows {@code candidate} under a temporary key and inserts it.
     * Completes with the entity as persisted by the server.
     */
    public CompletableFuture<OperationResult<T>> create(T candidate) {
        String temporaryId = temporaryIds.get();
        T provisional = codec.withId(candidate, temporaryId);
        Pending mutation = begin(OptimisticUpdate.<T>builder()
                        .localId(temporaryId)
                        .type(MutationType.ADD)
                        .entityId(temporaryId)
                        .candidate(provisional)
                        .createdAt(scheduler.getClock().instant())
                        .build(),
                items -> CacheMerge.mergeData(items, List.of(provisional), SyncEntity::getId));
        Map<String, Object> row = codec.encode(candidate);
        row.remove(Constants.DEFAULT_KEY_FIELD);
        submit(mutation, () -> store.insert(view.getCollection(), row).thenApply(codec::decode));
        return mutation.result;
    }

    public CompletableFuture<OperationResult<T>> update(String id, Map<String, Object> changes) {
        Optional<T> current = view.find(id);
        if (current.isEmpty()) {
            return CompletableFuture.completedFuture(
                    OperationResult.failure(new ResourceNotFoundException(view.getCollection(), id)));
        }
        T previous = current.get();
        T candidate = codec.patch(previous, changes);
        Pending mutation = begin(mutation(MutationType.UPDATE, id, candidate, previous),
                items -> CacheMerge.updateData(items, id, existing -> candidate, SyncEntity::getId));
        submit(mutation, () -> store.update(view.getCollection(), id, changes).thenApply(codec::decode));
        return mutation.result;
    }

    /**
     * Completes with the removed entity's last known value.
     */
    public CompletableFuture<OperationResult<T>> remove(String id) {
        Optional<T> current = view.find(id);
        if (current.isEmpty()) {
            return CompletableFuture.completedFuture(
                    OperationResult.failure(new ResourceNotFoundException(view.getCollection(), id)));
        }
        T previous = current.get();
        Pending mutation = begin(mutation(MutationType.REMOVE, id, null, previous),
                items -> CacheMerge.removeData(items, List.of(id), SyncEntity::getId));
        submit(mutation, () -> store.delete(view.getCollection(), id).thenApply(ignored -> previous));
        return mutation.result;
    }

    public List<OptimisticUpdate<T>> pending() {
        synchronized (lock) {
            return pending.values().stream().map(mutation -> mutation.update).toList();
        }
    }

    /**
     * Notified when a mutation is rolled back because it was never confirmed.
     */
    public void addFailureListener(Consumer<SyncException> listener) {
        failureListeners.add(listener);
    }

    @Override
    public void close() {
        view.removeChangeListener(reconciler);
        view.removeLoadListener(reloadReconciler);
        synchronized (lock) {
            pending.values().forEach(mutation -> mutation.timeout.cancel(false));
            pending.clear();
        }
    }

    private OptimisticUpdate<T> mutation(MutationType type, String id, T candidate, T previous) {
        return OptimisticUpdate.<T>builder()
                .localId("mut-" + mutationSequence.incrementAndGet())
                .type(type)
                .entityId(id)
                .candidate(candidate)
                .previous(previous)
                .createdAt(scheduler.getClock().instant())
                .build();
    }

    private Pending begin(OptimisticUpdate<T> update, UnaryOperator<List<T>> change) {
        Pending mutation = new Pending(update);
        synchronized (lock) {
            pending.put(update.getLocalId(), mutation);
            view.mutate(change);
            mutation.timeout = scheduler.schedule(() -> onTimeout(mutation),
                    scheduler.getClock().instant().plus(confirmationTimeout));
        }
        log.info("Optimistic {} of {} applied to {} as {}", update.getType(), update.getEntityId(),
                view.getCollection(), update.getLocalId());
        return mutation;
    }

    private void submit(Pending mutation, Supplier<CompletableFuture<T>> write) {
        CompletableFuture<T> outcome;
        try {
            outcome = write.get();
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }
        outcome.whenComplete((confirmed, error) -> {
            if (error != null) {
                onWriteFailed(mutation, error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error);
            } else {
                onWriteSucceeded(mutation, confirmed);
            }
        });
    }

    private void onWriteSucceeded(Pending mutation, T confirmed) {
        synchronized (lock) {
            if (mutation.outcome == Outcome.ROLLED_BACK) {
                log.warn("Write for {} succeeded after it was rolled back", mutation.update.getLocalId());
                return;
            }
            OptimisticUpdate<T> update = mutation.update;
            mutation.acknowledged = true;
            if (mutation.outcome == Outcome.PENDING) {
                switch (update.getType()) {
                    case ADD -> swapTemporaryKey(mutation, confirmed);
                    case UPDATE -> view.mutate(items ->
                            CacheMerge.updateData(items, update.getEntityId(), existing -> confirmed, SyncEntity::getId));
                    case REMOVE -> log.debug("Removal of {} acknowledged", update.getEntityId());
                }
            }
        }
        mutation.result.complete(OperationResult.success(confirmed));
    }

    // caller holds the lock
    private void swapTemporaryKey(Pending mutation, T confirmed) {
        String temporaryId = mutation.update.getEntityId();
        String confirmedId = confirmed.getId();
        mutation.update = mutation.update.withConfirmedId(confirmedId);
        boolean alreadyDelivered = view.find(confirmedId).isPresent();
        boolean provisionalShown = view.find(temporaryId).isPresent();
        view.mutate(items -> {
            if (alreadyDelivered) {
                return CacheMerge.removeData(items, List.of(temporaryId), SyncEntity::getId);
            }
            // a reload may have replaced the cache while the write was in flight
            return provisionalShown
                    ? CacheMerge.updateData(items, temporaryId, existing -> confirmed, SyncEntity::getId)
                    : CacheMerge.mergeData(items, List.of(confirmed), SyncEntity::getId);
        });
        log.info("Create {} persisted as {} in {}", temporaryId, confirmedId, view.getCollection());
        if (alreadyDelivered) {
            confirm(mutation);
        }
    }

    private void onWriteFailed(Pending mutation, Throwable cause) {
        WriteRejectedException failure = new WriteRejectedException(view.getCollection(),
                mutation.update.getEntityId(), cause);
        synchronized (lock) {
            if (mutation.outcome == Outcome.PENDING) {
                rollback(mutation);
                log.warn("Rolled back optimistic {} of {}: {}", mutation.update.getType(),
                        mutation.update.getEntityId(), cause.getMessage());
            } else if (mutation.outcome == Outcome.CONFIRMED) {
                log.warn("Write for {} failed after the change was confirmed by the feed: {}",
                        mutation.update.getLocalId(), cause.getMessage());
            }
        }
        mutation.result.complete(OperationResult.failure(failure));
    }

    private void onTimeout(Pending mutation) {
        ReconciliationTimeoutException failure;
        synchronized (lock) {
            if (mutation.outcome != Outcome.PENDING) {
                return;
            }
            rollback(mutation);
            failure = new ReconciliationTimeoutException(view.getCollection(), mutation.update.getLocalId(),
                    confirmationTimeout);
        }
        log.warn("{}; rolled back, reloading {}", failure.getMessage(), view.getCollection());
        mutation.result.complete(OperationResult.failure(failure));
        failureListeners.forEach(listener -> listener.accept(failure));
        view.refresh();
    }

    private void reconcile(ChangeEvent<T> event) {
        synchronized (lock) {
            for (Pending mutation : pending.values()) {
                if (mutation.outcome == Outcome.PENDING && confirms(mutation.update, event)) {
                    confirm(mutation);
                }
            }
        }
    }

    private void reconcileLoaded(List<T> items) {
        synchronized (lock) {
            for (Pending mutation : pending.values()) {
                if (mutation.outcome == Outcome.PENDING && mutation.acknowledged
                        && reflectedIn(mutation.update, items)) {
                    confirm(mutation);
                }
            }
        }
    }

    private boolean reflectedIn(OptimisticUpdate<T> update, List<T> items) {
        return switch (update.getType()) {
            case ADD -> CacheMerge.findByKey(items, update.getConfirmedId(), SyncEntity::getId).isPresent();
            case UPDATE -> CacheMerge.findByKey(items, update.getEntityId(), SyncEntity::getId).isPresent();
            case REMOVE -> CacheMerge.findByKey(items, update.getEntityId(), SyncEntity::getId).isEmpty();
        };
    }

    private boolean confirms(OptimisticUpdate<T> update, ChangeEvent<T> event) {
        return switch (update.getType()) {
            case ADD -> update.getConfirmedId() != null
                    && update.getConfirmedId().equals(event.key())
                    && event.type() != ChangeType.DELETE;
            case UPDATE -> update.getEntityId().equals(event.key()) && event.type() == ChangeType.UPDATE;
            case REMOVE -> update.getEntityId().equals(event.key()) && event.type() == ChangeType.DELETE;
        };
    }

    // caller holds the lock
    private void confirm(Pending mutation) {
        mutation.outcome = Outcome.CONFIRMED;
        mutation.update = mutation.update.withConfirmed(true);
        mutation.timeout.cancel(false);
        pending.remove(mutation.update.getLocalId());
        log.debug("Optimistic {} of {} confirmed", mutation.update.getType(), mutation.update.currentKey());
    }

    // caller holds the lock
    private void rollback(Pending mutation) {
        OptimisticUpdate<T> update = mutation.update;
        switch (update.getType()) {
            case ADD -> view.mutate(items -> CacheMerge.removeData(items,
                    List.of(update.getEntityId(), update.currentKey()), SyncEntity::getId));
            case UPDATE -> view.mutate(items -> CacheMerge.updateData(items, update.getEntityId(),
                    existing -> update.getPrevious(), SyncEntity::getId));
            case REMOVE -> view.mutate(items -> CacheMerge.findByKey(items, update.getEntityId(), SyncEntity::getId)
                    .isPresent()
                    ? items
                    : CacheMerge.mergeData(items, List.of(update.getPrevious()), SyncEntity::getId));
        }
        mutation.outcome = Outcome.ROLLED_BACK;
        mutation.timeout.cancel(false);
        pending.remove(update.getLocalId());
    }

    private enum Outcome {
        PENDING,
        CONFIRMED,
        ROLLED_BACK
    }

    private final class Pending {
        private final CompletableFuture<OperationResult<T>> result = new CompletableFuture<>();
        private OptimisticUpdate<T> update;
        private Outcome outcome = Outcome.PENDING;
        private boolean acknowledged;
        private ScheduledFuture<?> timeout;

        private Pending(OptimisticUpdate<T> update) {
            this.update = update;
        }
    }
}
