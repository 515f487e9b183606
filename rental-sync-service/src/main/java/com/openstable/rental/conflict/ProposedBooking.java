package com.openstable.rental.conflict;

import java.time.LocalDate;

/**
 * A booking that has not been written yet, checked against the active bookings of its unit.
 *
 * @param bookingId null for a new booking
 * @param endDate   null for an open-ended rental
 */
public record ProposedBooking(String bookingId, String unitId, LocalDate startDate, LocalDate endDate) {
}
