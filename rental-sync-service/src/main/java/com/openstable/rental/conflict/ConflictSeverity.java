package com.openstable.rental.conflict;

public enum ConflictSeverity {
    MEDIUM,
    HIGH,
    CRITICAL
}
