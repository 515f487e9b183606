package com.openstable.sync.model;

import java.time.Instant;
import java.util.Map;

/**
 * Change notification as delivered by the transport: loosely typed rows keyed by column name.
 * Converted into a {@link ChangeEvent} at the subscription boundary.
 *
 * @param collection collection (table) the row belongs to
 * @param eventType  insert, update or delete
 * @param newRow     row after the change; null for deletes
 * @param oldRow     row before the change; for deletes it may hold only the key column
 * @param timestamp  commit time reported by the feed, may be null
 */
public record RawChangeEvent(
        String collection,
        ChangeType eventType,
        Map<String, Object> newRow,
        Map<String, Object> oldRow,
        Instant timestamp
) {

    public static RawChangeEvent insert(String collection, Map<String, Object> row) {
        return new RawChangeEvent(collection, ChangeType.INSERT, row, null, Instant.now());
    }

    public static RawChangeEvent update(String collection, Map<String, Object> row) {
        return new RawChangeEvent(collection, ChangeType.UPDATE, row, null, Instant.now());
    }

    public static RawChangeEvent delete(String collection, Map<String, Object> oldRow) {
        return new RawChangeEvent(collection, ChangeType.DELETE, null, oldRow, Instant.now());
    }
}
