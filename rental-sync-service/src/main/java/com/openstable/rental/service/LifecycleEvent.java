package com.openstable.rental.service;

import com.openstable.rental.domain.model.BookingStatus;

import java.time.Instant;

/**
 * One entry of the booking lifecycle log.
 *
 * @param bookingId      null for entries that are not about a single booking
 * @param status         status after the change, null for entries that are not status changes
 * @param previousStatus status before the change, null when unknown
 * @param trigger        what produced the entry: {@code feed} or {@code conflict-resolution}
 */
public record LifecycleEvent(
        String id,
        String bookingId,
        BookingStatus status,
        BookingStatus previousStatus,
        Instant timestamp,
        String trigger,
        String description
) {
}
