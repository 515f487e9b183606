package com.openstable.sync.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class InvalidSubscriptionOptionsException extends SyncException {
    private final List<String> violations;

    public InvalidSubscriptionOptionsException(List<String> violations) {
        super("Invalid subscription options: " + String.join("; ", violations), "INVALID_OPTIONS");
        this.violations = List.copyOf(violations);
    }
}
