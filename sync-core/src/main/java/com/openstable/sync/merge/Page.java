package com.openstable.sync.merge;

import java.util.List;

public record Page<T>(
        List<T> items,
        int currentPage,
        int totalPages,
        int totalItems,
        boolean hasNext,
        boolean hasPrev
) {
}
