package com.openstable.rental.domain.model;

import java.util.Set;

/**
 * Lifecycle of a booking. Only an active booking can change status; ended and cancelled
 * bookings are final.
 */
public enum BookingStatus {
    ACTIVE,
    ENDED,
    CANCELLED;

    /**
     * Whether a booking in this status may move to {@code next}. Keeping the same status is
     * not a transition and is always allowed.
     */
    public boolean canTransitionTo(BookingStatus next) {
        return this == next || allowedTargets().contains(next);
    }

    private Set<BookingStatus> allowedTargets() {
        return this == ACTIVE ? Set.of(ENDED, CANCELLED) : Set.of();
    }
}
