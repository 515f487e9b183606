package com.openstable.rental.domain.readmodel;

import com.openstable.rental.domain.model.BookingRecord;
import com.openstable.rental.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;
import java.util.Collection;

/**
 * Booking figures of an owner or stable.
 *
 * @param monthlyRevenue      sum of the monthly price of active bookings
 * @param conversionRate      active bookings as a percentage of all bookings
 * @param cancellationRate    cancelled bookings as a percentage of all bookings
 * @param averageRentalDays   mean length of ended bookings that have an end date
 */
public record BookingAnalytics(
        int totalBookings,
        int activeBookings,
        int endedBookings,
        int cancelledBookings,
        BigDecimal monthlyRevenue,
        double conversionRate,
        double cancellationRate,
        double averageRentalDays
) {

    public static final BookingAnalytics EMPTY =
            new BookingAnalytics(0, 0, 0, 0, BigDecimal.ZERO, 0.0, 0.0, 0.0);

    public static BookingAnalytics of(Collection<BookingRecord> bookings) {
        int active = 0;
        int ended = 0;
        int cancelled = 0;
        BigDecimal revenue = BigDecimal.ZERO;
        long rentalDays = 0;
        int measured = 0;
        for (BookingRecord booking : bookings) {
            if (booking.getStatus() == BookingStatus.ACTIVE) {
                active++;
                if (booking.getMonthlyPrice() != null) {
                    revenue = revenue.add(booking.getMonthlyPrice());
                }
            } else if (booking.getStatus() == BookingStatus.ENDED) {
                ended++;
                if (booking.getStartDate() != null && booking.getEndDate() != null) {
                    rentalDays += ChronoUnit.DAYS.between(booking.getStartDate(), booking.getEndDate());
                    measured++;
                }
            } else if (booking.getStatus() == BookingStatus.CANCELLED) {
                cancelled++;
            }
        }
        int total = bookings.size();
        double averageDays = measured == 0 ? 0.0 : BigDecimal.valueOf(rentalDays)
                .divide(BigDecimal.valueOf(measured), 1, RoundingMode.HALF_UP)
                .doubleValue();
        return new BookingAnalytics(total, active, ended, cancelled, revenue,
                AvailabilityStats.percentage(active, total),
                AvailabilityStats.percentage(cancelled, total),
                averageDays);
    }
}
