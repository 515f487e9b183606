package com.openstable.rental.exception;

import com.openstable.common.exception.BusinessException;
import com.openstable.rental.conflict.ConflictReport;
import lombok.Getter;

import java.util.List;

/**
 * Raised when conflict prevention is enabled and a booking would overlap an active one.
 * Nothing has been applied to the views or written when this is raised.
 */
@Getter
public class BookingConflictException extends BusinessException {

    private final List<ConflictReport> conflicts;

    public BookingConflictException(List<ConflictReport> conflicts) {
        super("Booking conflicts with " + conflicts.stream()
                .mapToInt(report -> report.affectedBookingIds().size())
                .sum() + " active booking(s)", "BOOKING_CONFLICT");
        this.conflicts = List.copyOf(conflicts);
    }
}
