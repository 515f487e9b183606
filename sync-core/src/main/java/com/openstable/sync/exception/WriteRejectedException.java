package com.openstable.sync.exception;

import lombok.Getter;

/**
 * The backing store refused a create, update or delete. The optimistic change has been rolled back.
 */
@Getter
public class WriteRejectedException extends SyncException {
    private final String collection;
    private final String entityId;

    public WriteRejectedException(String collection, String entityId, Throwable cause) {
        super(String.format("Write to %s rejected for entity %s: %s",
                collection, entityId, cause == null ? "unknown error" : cause.getMessage()),
                cause, "WRITE_REJECTED");
        this.collection = collection;
        this.entityId = entityId;
    }
}
