package com.openstable.sync.exception;

import lombok.Getter;

@Getter
public class LoadException extends SyncException {
    private final String collection;

    public LoadException(String collection, Throwable cause) {
        super("Failed to load collection " + collection + ": " + (cause == null ? "unknown error" : cause.getMessage()),
                cause, "LOAD_FAILED");
        this.collection = collection;
    }
}
