package com.openstable.rental.conflict;

import com.openstable.rental.domain.model.BookingRecord;
import com.openstable.rental.domain.model.PaymentStatus;
import com.openstable.rental.domain.model.RentableUnit;
import com.openstable.sync.merge.CacheMerge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Evaluates booking rules over the full set of booking records.
 *
 * <p>Detection only: the detector never changes a booking. Every call recomputes all reports,
 * there is no incremental state between calls.
 */
@Slf4j
@Component
public class BookingConflictDetector {

    /**
     * Reports double bookings, active bookings on archived units and active bookings awaiting payment.
     * Reports are ordered by unit, then by booking order within the unit.
     */
    public List<ConflictReport> detect(List<BookingRecord> bookings, Collection<RentableUnit> units) {
        Map<String, RentableUnit> unitsById = units.stream()
                .collect(Collectors.toMap(RentableUnit::getId, Function.identity(), (first, second) -> second));
        List<ConflictReport> reports = new ArrayList<>();
        CacheMerge.groupBy(bookings, BookingRecord::getUnitId).forEach((unitId, unitBookings) -> {
            List<BookingRecord> active = unitBookings.stream().filter(BookingRecord::isActive).toList();
            if (active.size() > 1) {
                active.forEach(booking -> reports.add(doubleBooking(unitId, booking, active)));
            }
            RentableUnit unit = unitsById.get(unitId);
            if (unit != null && unit.isArchived()) {
                active.forEach(booking -> reports.add(unitUnavailable(unit, booking)));
            }
            active.stream()
                    .filter(booking -> booking.getPaymentStatus() == PaymentStatus.PENDING)
                    .forEach(booking -> reports.add(paymentPending(booking)));
        });
        if (!reports.isEmpty()) {
            log.debug("Detected {} booking conflict(s) over {} booking(s)", reports.size(), bookings.size());
        }
        return List.copyOf(reports);
    }

    public List<ConflictReport> detect(List<BookingRecord> bookings) {
        return detect(bookings, List.of());
    }

    /**
     * Checks a proposed booking against the active bookings of the same unit.
     * Returns a single report listing every overlapping booking, or nothing.
     */
    public List<ConflictReport> checkProposed(ProposedBooking proposed, List<BookingRecord> bookings) {
        List<String> overlapping = bookings.stream()
                .filter(BookingRecord::isActive)
                .filter(booking -> Objects.equals(proposed.unitId(), booking.getUnitId()))
                .filter(booking -> !Objects.equals(booking.getId(), proposed.bookingId()))
                .filter(booking -> booking.overlaps(proposed.startDate(), proposed.endDate()))
                .map(BookingRecord::getId)
                .toList();
        if (overlapping.isEmpty()) {
            return List.of();
        }
        return List.of(new ConflictReport(
                reportId(ConflictKind.OVERLAPPING_DATES,
                        proposed.bookingId() != null ? proposed.bookingId() : proposed.unitId()),
                ConflictKind.OVERLAPPING_DATES,
                ConflictSeverity.HIGH,
                proposed.bookingId(),
                proposed.unitId(),
                overlapping,
                "Requested period from " + proposed.startDate() + " overlaps " + overlapping.size()
                        + " active booking(s) of unit " + proposed.unitId(),
                "Choose another start date or end the current booking first",
                false));
    }

    private ConflictReport doubleBooking(String unitId, BookingRecord booking, List<BookingRecord> active) {
        List<String> others = active.stream()
                .map(BookingRecord::getId)
                .filter(id -> !id.equals(booking.getId()))
                .toList();
        return new ConflictReport(
                reportId(ConflictKind.DOUBLE_BOOKING, booking.getId()),
                ConflictKind.DOUBLE_BOOKING,
                ConflictSeverity.CRITICAL,
                booking.getId(),
                unitId,
                others,
                "Multiple active bookings for unit " + unitId,
                "Manual review of the bookings is required",
                false);
    }

    private ConflictReport unitUnavailable(RentableUnit unit, BookingRecord booking) {
        return new ConflictReport(
                reportId(ConflictKind.UNIT_UNAVAILABLE, booking.getId()),
                ConflictKind.UNIT_UNAVAILABLE,
                ConflictSeverity.HIGH,
                booking.getId(),
                unit.getId(),
                List.of(),
                "Unit " + unit.getName() + " is archived but still has an active booking",
                "Move the renter to another unit or restore the unit",
                false);
    }

    private ConflictReport paymentPending(BookingRecord booking) {
        return new ConflictReport(
                reportId(ConflictKind.PAYMENT_PENDING, booking.getId()),
                ConflictKind.PAYMENT_PENDING,
                ConflictSeverity.MEDIUM,
                booking.getId(),
                booking.getUnitId(),
                List.of(),
                "Payment for active booking " + booking.getId() + " is still pending",
                "Wait for the payment to clear or remind the renter",
                true);
    }

    private static String reportId(ConflictKind kind, String subject) {
        return "conflict-" + kind.slug() + "-" + subject;
    }
}
