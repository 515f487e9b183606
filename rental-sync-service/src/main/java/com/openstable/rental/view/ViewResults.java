package com.openstable.rental.view;

import com.openstable.common.dto.OperationResult;

import java.util.function.Supplier;

final class ViewResults {

    private ViewResults() {
    }

    /**
     * Success with {@code data} when both loads succeeded, otherwise the first failure.
     */
    static <R> OperationResult<R> combine(OperationResult<?> first, OperationResult<?> second, Supplier<R> data) {
        OperationResult<?> failed = first.isFailure() ? first : second.isFailure() ? second : null;
        if (failed == null) {
            return OperationResult.success(data.get());
        }
        return failed.getError() != null
                ? OperationResult.failure(failed.getError())
                : OperationResult.failure(failed.getMessage(), failed.getErrorCode());
    }
}
