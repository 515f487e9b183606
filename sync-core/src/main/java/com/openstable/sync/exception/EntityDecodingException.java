package com.openstable.sync.exception;

public class EntityDecodingException extends SyncException {

    public EntityDecodingException(String message) {
        super(message, "DECODE_FAILED");
    }

    public EntityDecodingException(String message, Throwable cause) {
        super(message, cause, "DECODE_FAILED");
    }
}
