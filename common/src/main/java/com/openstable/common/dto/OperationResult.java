package com.openstable.common.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result wrapper returned across the sync core boundary.
 * Views and the mutation coordinator report load and write outcomes through this type
 * instead of letting exceptions escape to the consumer layer.
 *
 * @param <T> Type of the result data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResult<T> {
    private boolean success;
    private String message;
    private T data;
    private Instant timestamp;
    private String errorCode;
    @JsonIgnore
    private Throwable error;

    public static <T> OperationResult<T> success(T data) {
        return OperationResult.<T>builder()
                .success(true)
                .data(data)
                .timestamp(Instant.now())
                .build();
    }

    public static <T> OperationResult<T> failure(String message, String errorCode) {
        return OperationResult.<T>builder()
                .success(false)
                .message(message)
                .errorCode(errorCode)
                .timestamp(Instant.now())
                .build();
    }

    /**
     * Failure carrying the original exception. The error code is taken from
     * {@link com.openstable.common.exception.BusinessException} when available.
     */
    public static <T> OperationResult<T> failure(Throwable error) {
        String errorCode = error instanceof com.openstable.common.exception.BusinessException be
                ? be.getErrorCode()
                : "INTERNAL_ERROR";
        return OperationResult.<T>builder()
                .success(false)
                .message(error.getMessage())
                .errorCode(errorCode)
                .error(error)
                .timestamp(Instant.now())
                .build();
    }

    @JsonIgnore
    public boolean isFailure() {
        return !success;
    }
}
