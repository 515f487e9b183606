package com.openstable.sync.transport;

import com.openstable.sync.filter.FilterDescriptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port to the server's query and write API. Rows are column-name keyed maps.
 */
public interface BackingStore {

    CompletableFuture<List<Map<String, Object>>> query(FilterDescriptor filter);

    /**
     * Inserts a row and returns it as persisted, including the server-assigned id.
     */
    CompletableFuture<Map<String, Object>> insert(String collection, Map<String, Object> row);

    /**
     * Applies a partial update and returns the full row as persisted.
     */
    CompletableFuture<Map<String, Object>> update(String collection, String id, Map<String, Object> changes);

    CompletableFuture<Void> delete(String collection, String id);
}
