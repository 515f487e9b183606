package com.openstable.rental.conflict;

public enum ConflictKind {
    /** More than one active booking on the same unit. */
    DOUBLE_BOOKING,
    /** A proposed booking overlaps an active booking of the same unit. */
    OVERLAPPING_DATES,
    /** An active booking references a unit that has been archived. */
    UNIT_UNAVAILABLE,
    /** An active booking whose payment has not come in yet. */
    PAYMENT_PENDING;

    String slug() {
        return name().toLowerCase().replace('_', '-');
    }
}
