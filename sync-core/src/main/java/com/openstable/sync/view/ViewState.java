package com.openstable.sync.view;

import com.openstable.sync.exception.SyncException;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a view. A new instance is published for every change,
 * so consumers can detect changes by reference.
 *
 * @param items          cached entities in merge order
 * @param loadState      state of the most recent full load
 * @param loadError      error of the last failed load, null otherwise
 * @param transportError terminal feed error, cleared when the feed reconnects
 * @param version        incremented on every published change
 * @param lastLoadedAt   completion time of the last successful load
 */
public record ViewState<T>(
        List<T> items,
        LoadState loadState,
        SyncException loadError,
        SyncException transportError,
        long version,
        Instant lastLoadedAt
) {

    public static <T> ViewState<T> initial() {
        return new ViewState<>(List.of(), LoadState.IDLE, null, null, 0, null);
    }

    public boolean isLoading() {
        return loadState == LoadState.LOADING;
    }

    public boolean hasError() {
        return loadError != null || transportError != null;
    }

    ViewState<T> withItems(List<T> newItems) {
        return new ViewState<>(newItems, loadState, loadError, transportError, version + 1, lastLoadedAt);
    }

    ViewState<T> loading() {
        return new ViewState<>(items, LoadState.LOADING, loadError, transportError, version + 1, lastLoadedAt);
    }

    ViewState<T> loaded(List<T> newItems, Instant at) {
        return new ViewState<>(newItems, LoadState.READY, null, transportError, version + 1, at);
    }

    ViewState<T> failed(List<T> currentItems, SyncException error) {
        return new ViewState<>(currentItems, LoadState.FAILED, error, transportError, version + 1, lastLoadedAt);
    }

    ViewState<T> withTransportError(SyncException error) {
        return new ViewState<>(items, loadState, loadError, error, version + 1, lastLoadedAt);
    }
}
