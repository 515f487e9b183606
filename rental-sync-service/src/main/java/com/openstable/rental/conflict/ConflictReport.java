package com.openstable.rental.conflict;

import java.util.List;

/**
 * A detected booking conflict. Reports are rebuilt from scratch on every evaluation.
 *
 * @param bookingId          the booking the report is about; for a proposal, its id if it has one
 * @param affectedBookingIds the other bookings involved
 * @param autoResolvable     whether the conflict clears without human action
 */
public record ConflictReport(
        String id,
        ConflictKind kind,
        ConflictSeverity severity,
        String bookingId,
        String unitId,
        List<String> affectedBookingIds,
        String description,
        String suggestedResolution,
        boolean autoResolvable
) {

    public ConflictReport {
        affectedBookingIds = affectedBookingIds == null ? List.of() : List.copyOf(affectedBookingIds);
    }
}
