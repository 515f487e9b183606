package com.openstable.sync.model;

import java.time.Instant;

/**
 * An immutable snapshot of a server-side record kept in a synchronized collection.
 * Identifiers are unique within a collection; a change replaces the whole snapshot.
 */
public interface SyncEntity {

    String getId();

    Instant getUpdatedAt();
}
