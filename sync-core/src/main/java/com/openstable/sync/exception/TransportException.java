package com.openstable.sync.exception;

/**
 * The change feed channel could not be opened or was lost for good.
 */
public class TransportException extends SyncException {

    public TransportException(String message) {
        super(message, "TRANSPORT_ERROR");
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause, "TRANSPORT_ERROR");
    }
}
