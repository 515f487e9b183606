package com.openstable.sync.subscription;

import com.openstable.sync.exception.SyncException;
import com.openstable.sync.model.ChangeEvent;
import com.openstable.sync.model.SyncEntity;

/**
 * Receives the typed events of a subscription. Calls for one channel never overlap.
 */
@FunctionalInterface
public interface ChangeHandler<T extends SyncEntity> {

    void onChange(ChangeEvent<T> event);

    /**
     * Terminal failure: the channel could not be (re)established and retries are exhausted.
     */
    default void onError(SyncException error) {
    }

    default void onStatusChange(ConnectionStatus status) {
    }
}
