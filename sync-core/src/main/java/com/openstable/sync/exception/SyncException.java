package com.openstable.sync.exception;

import com.openstable.common.exception.BusinessException;

/**
 * Root of the errors raised by the synchronization core.
 */
public class SyncException extends BusinessException {

    public SyncException(String message, String errorCode) {
        super(message, errorCode);
    }

    public SyncException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
