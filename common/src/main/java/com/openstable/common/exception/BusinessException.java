package com.openstable.common.exception;

import lombok.Getter;

/**
 * Base exception for domain-specific errors.
 * Every error raised by the sync core carries a stable error code so callers can
 * branch on it without parsing messages.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
