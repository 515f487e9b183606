package com.openstable.rental.exception;

import com.openstable.common.exception.BusinessException;
import com.openstable.rental.domain.model.BookingStatus;
import lombok.Getter;

/**
 * Raised when a booking is moved to a status its current status does not lead to.
 */
@Getter
public class InvalidTransitionException extends BusinessException {

    private final BookingStatus from;
    private final BookingStatus to;

    public InvalidTransitionException(String bookingId, BookingStatus from, BookingStatus to) {
        super("Booking " + bookingId + " cannot move from " + from + " to " + to, "INVALID_TRANSITION");
        this.from = from;
        this.to = to;
    }
}
