package com.openstable.sync.view;

import com.openstable.sync.codec.EntityCodec;
import com.openstable.sync.filter.FilterDescriptor;
import com.openstable.sync.model.SyncEntity;
import com.openstable.sync.subscription.SubscriptionManager;
import com.openstable.sync.subscription.SubscriptionOptions;
import com.openstable.sync.transport.BackingStore;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.TaskScheduler;

/**
 * Creates views wired to the shared store, subscription manager and scheduler.
 */
@RequiredArgsConstructor
public class EntityViewFactory {

    private final BackingStore store;
    private final SubscriptionManager subscriptionManager;
    private final TaskScheduler scheduler;
    private final SubscriptionOptions defaultOptions;

    public <T extends SyncEntity> EntityView<T> create(FilterDescriptor filter, EntityCodec<T> codec) {
        return create(filter, codec, RefreshPolicy.eventDriven());
    }

    public <T extends SyncEntity> EntityView<T> create(FilterDescriptor filter, EntityCodec<T> codec,
                                                       RefreshPolicy refreshPolicy) {
        return EntityView.<T>builder()
                .filter(filter)
                .codec(codec)
                .store(store)
                .subscriptionManager(subscriptionManager)
                .scheduler(scheduler)
                .refreshPolicy(refreshPolicy)
                .options(defaultOptions)
                .build();
    }
}
