package com.openstable.rental.conflict;

import com.openstable.rental.domain.model.BookingRecord;
import com.openstable.rental.domain.model.BookingStatus;
import com.openstable.rental.domain.model.PaymentStatus;
import com.openstable.rental.domain.model.RentableUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.openstable.rental.RentalFixtures.bookingRecord;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BookingConflictDetector}.
 *
 * Verifies:
 * - Two active bookings on one unit yield one critical double-booking report per booking
 * - Zero or one active booking per unit yields no report
 * - Archived units, pending payments and overlapping proposals are reported with their own severity
 */
class BookingConflictDetectorTest {

    private final BookingConflictDetector detector = new BookingConflictDetector();

    @Test
    @DisplayName("detect: two active bookings on one unit give two critical double-booking reports")
    void detect_doubleBooking() {
        // given
        List<BookingRecord> bookings = List.of(
                bookingRecord("b1", "u1", BookingStatus.ACTIVE),
                bookingRecord("b2", "u1", BookingStatus.ACTIVE));

        // when
        List<ConflictReport> reports = detector.detect(bookings);

        // then
        assertThat(reports).hasSize(2);
        assertThat(reports).allSatisfy(report -> {
            assertThat(report.kind()).isEqualTo(ConflictKind.DOUBLE_BOOKING);
            assertThat(report.severity()).isEqualTo(ConflictSeverity.CRITICAL);
            assertThat(report.autoResolvable()).isFalse();
            assertThat(report.unitId()).isEqualTo("u1");
        });
        assertThat(reports.get(0).bookingId()).isEqualTo("b1");
        assertThat(reports.get(0).affectedBookingIds()).containsExactly("b2");
        assertThat(reports.get(1).bookingId()).isEqualTo("b2");
        assertThat(reports.get(1).affectedBookingIds()).containsExactly("b1");
        assertThat(reports.get(0).id()).isEqualTo("conflict-double-booking-b1");
    }

    @Test
    @DisplayName("detect: at most one active booking per unit gives no report")
    void detect_noConflict() {
        // given
        List<BookingRecord> bookings = List.of(
                bookingRecord("b1", "u1", BookingStatus.ACTIVE),
                bookingRecord("b2", "u1", BookingStatus.ENDED),
                bookingRecord("b3", "u1", BookingStatus.CANCELLED),
                bookingRecord("b4", "u2", BookingStatus.ACTIVE));

        // when / then
        assertThat(detector.detect(bookings)).isEmpty();
        assertThat(detector.detect(List.of())).isEmpty();
    }

    @Test
    @DisplayName("detect: three active bookings each list the two others")
    void detect_threeActive() {
        // given
        List<BookingRecord> bookings = List.of(
                bookingRecord("b1", "u1", BookingStatus.ACTIVE),
                bookingRecord("b2", "u1", BookingStatus.ACTIVE),
                bookingRecord("b3", "u1", BookingStatus.ACTIVE));

        // when
        List<ConflictReport> reports = detector.detect(bookings);

        // then
        assertThat(reports).extracting(ConflictReport::bookingId).containsExactly("b1", "b2", "b3");
        assertThat(reports.get(1).affectedBookingIds()).containsExactly("b1", "b3");
    }

    @Test
    @DisplayName("detect: active booking on an archived unit is reported as unit unavailable")
    void detect_archivedUnit() {
        // given
        RentableUnit archived = RentableUnit.builder()
                .id("u1").stableId("s1").name("Box 1").monthlyPrice(new BigDecimal("4000")).archived(true)
                .build();

        // when
        List<ConflictReport> reports = detector.detect(
                List.of(bookingRecord("b1", "u1", BookingStatus.ACTIVE), bookingRecord("b2", "u1", BookingStatus.ENDED)),
                List.of(archived));

        // then
        assertThat(reports).singleElement().satisfies(report -> {
            assertThat(report.kind()).isEqualTo(ConflictKind.UNIT_UNAVAILABLE);
            assertThat(report.severity()).isEqualTo(ConflictSeverity.HIGH);
            assertThat(report.bookingId()).isEqualTo("b1");
        });
    }

    @Test
    @DisplayName("detect: pending payment on an active booking is an auto-resolvable medium report")
    void detect_paymentPending() {
        // given
        BookingRecord pending = bookingRecord("b1", "u1", BookingStatus.ACTIVE).toBuilder()
                .paymentStatus(PaymentStatus.PENDING)
                .build();
        BookingRecord endedPending = bookingRecord("b2", "u2", BookingStatus.ENDED).toBuilder()
                .paymentStatus(PaymentStatus.PENDING)
                .build();

        // when
        List<ConflictReport> reports = detector.detect(List.of(pending, endedPending));

        // then
        assertThat(reports).singleElement().satisfies(report -> {
            assertThat(report.kind()).isEqualTo(ConflictKind.PAYMENT_PENDING);
            assertThat(report.severity()).isEqualTo(ConflictSeverity.MEDIUM);
            assertThat(report.autoResolvable()).isTrue();
        });
    }

    @Test
    @DisplayName("checkProposed: proposal overlapping an open-ended active booking is reported")
    void checkProposed_overlap() {
        // given
        List<BookingRecord> bookings = List.of(
                bookingRecord("b1", "u1", BookingStatus.ACTIVE),
                bookingRecord("b2", "u1", BookingStatus.ENDED),
                bookingRecord("b3", "u2", BookingStatus.ACTIVE));
        ProposedBooking proposed = new ProposedBooking(null, "u1", LocalDate.of(2026, 3, 1), null);

        // when
        List<ConflictReport> reports = detector.checkProposed(proposed, bookings);

        // then
        assertThat(reports).singleElement().satisfies(report -> {
            assertThat(report.kind()).isEqualTo(ConflictKind.OVERLAPPING_DATES);
            assertThat(report.severity()).isEqualTo(ConflictSeverity.HIGH);
            assertThat(report.affectedBookingIds()).containsExactly("b1");
            assertThat(report.autoResolvable()).isFalse();
        });
    }

    @Test
    @DisplayName("checkProposed: periods are half-open, so starting on the end date does not overlap")
    void checkProposed_adjacentPeriods() {
        // given
        BookingRecord endsInFebruary = bookingRecord("b1", "u1", BookingStatus.ACTIVE).toBuilder()
                .endDate(LocalDate.of(2026, 2, 1))
                .build();

        // when
        List<ConflictReport> adjacent = detector.checkProposed(
                new ProposedBooking(null, "u1", LocalDate.of(2026, 2, 1), null), List.of(endsInFebruary));
        List<ConflictReport> before = detector.checkProposed(
                new ProposedBooking(null, "u1", LocalDate.of(2025, 12, 1), LocalDate.of(2026, 1, 1)),
                List.of(endsInFebruary));
        List<ConflictReport> inside = detector.checkProposed(
                new ProposedBooking(null, "u1", LocalDate.of(2026, 1, 15), LocalDate.of(2026, 1, 20)),
                List.of(endsInFebruary));

        // then
        assertThat(adjacent).isEmpty();
        assertThat(before).isEmpty();
        assertThat(inside).hasSize(1);
    }

    @Test
    @DisplayName("checkProposed: a booking is not in conflict with itself")
    void checkProposed_ignoresSameBooking() {
        List<BookingRecord> bookings = List.of(bookingRecord("b1", "u1", BookingStatus.ACTIVE));

        assertThat(detector.checkProposed(
                new ProposedBooking("b1", "u1", LocalDate.of(2026, 1, 1), null), bookings)).isEmpty();
    }
}
