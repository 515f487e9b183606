package com.openstable.rental.service;

import com.openstable.common.dto.OperationResult;
import com.openstable.rental.RentalFixtures;
import com.openstable.rental.config.SyncProperties;
import com.openstable.rental.conflict.BookingConflictDetector;
import com.openstable.rental.conflict.ConflictKind;
import com.openstable.rental.domain.model.BookingRecord;
import com.openstable.rental.domain.model.BookingStatus;
import com.openstable.rental.domain.model.CollectionNames;
import com.openstable.rental.domain.model.PaymentStatus;
import com.openstable.rental.service.dto.CreateBookingRequest;
import com.openstable.rental.view.BookingRecordView;
import com.openstable.sync.optimistic.OptimisticMutationCoordinator;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static com.openstable.rental.RentalFixtures.booking;
import static com.openstable.rental.RentalFixtures.unit;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BookingCommandService}.
 *
 * Verifies:
 * - new bookings appear at once and are confirmed through the feed
 * - the conflict policy decides whether an overlapping booking is written
 * - end and cancel stamp today's date, rejected writes roll back
 * - invalid requests and status changes fail before anything is applied
 * - moving an active booking onto an occupied unit is checked like a new booking
 */
class BookingCommandServiceTest {

    private RentalFixtures fixtures;
    private SyncProperties properties;
    private BookingRecordView view;
    private OptimisticMutationCoordinator<BookingRecord> coordinator;
    private BookingCommandService service;

    @BeforeEach
    void setUp() {
        fixtures = new RentalFixtures();
        fixtures.store
                .seed(CollectionNames.RENTALS, booking("b1", "u1", BookingStatus.ACTIVE))
                .seed(CollectionNames.RENTALS, booking("b2", "u1", BookingStatus.CANCELLED))
                .seed(CollectionNames.RENTABLE_UNITS, unit("u1", "s1", 4000, false))
                .seed(CollectionNames.RENTABLE_UNITS, unit("u2", "s1", 4500, true));
        properties = new SyncProperties();
        view = new BookingRecordView(fixtures.allBookings(), fixtures.allUnits(), new BookingConflictDetector());
        view.start().join();
        coordinator = new OptimisticMutationCoordinator<>(view.getView(), fixtures.store, fixtures.scheduler,
                OptimisticMutationCoordinator.DEFAULT_CONFIRMATION_TIMEOUT);
        service = new BookingCommandService(view, coordinator, properties,
                Validation.buildDefaultValidatorFactory().getValidator(), fixtures.scheduler.getClock());
    }

    @Test
    @DisplayName("createBooking: shown under a temporary id, swapped to the server id and confirmed")
    void createBooking_optimisticThenConfirmed() {
        // given
        fixtures.store.nextIds("b9");
        CompletableFuture<Void> gate = fixtures.store.holdWrites();

        // when
        CompletableFuture<OperationResult<BookingRecord>> result = service.createBooking(request("u2"));

        // then
        assertThat(view.find("tmp-1")).get().satisfies(provisional -> {
            assertThat(provisional.getStatus()).isEqualTo(BookingStatus.ACTIVE);
            assertThat(provisional.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(provisional.getCreatedAt()).isEqualTo(fixtures.scheduler.now());
        });

        // when
        gate.complete(null);
        Map<String, Object> persisted = fixtures.store.rowsOf(CollectionNames.RENTALS).stream()
                .filter(row -> "b9".equals(row.get("id")))
                .findFirst()
                .orElseThrow();
        fixtures.feed.insert(CollectionNames.RENTALS, persisted);

        // then
        assertThat(result.join().getData().getId()).isEqualTo("b9");
        assertThat(view.bookings()).extracting(BookingRecord::getId).containsExactly("b1", "b2", "b9");
        assertThat(coordinator.pending()).isEmpty();
    }

    @Test
    @DisplayName("createBooking: PREVENT policy rejects an overlapping booking without writing it")
    void createBooking_preventPolicy_rejected() {
        // given
        properties.getConflict().setPolicy(SyncProperties.ConflictPolicy.PREVENT);

        // when
        OperationResult<BookingRecord> result = service.createBooking(request("u1")).join();

        // then
        assertThat(result.isFailure()).isTrue();
        assertThat(result.getErrorCode()).isEqualTo("BOOKING_CONFLICT");
        assertThat(fixtures.store.rowsOf(CollectionNames.RENTALS)).hasSize(2);
        assertThat(view.bookings()).hasSize(2);
        assertThat(coordinator.pending()).isEmpty();
    }

    @Test
    @DisplayName("createBooking: DETECT policy writes the booking and the view reports the double booking")
    void createBooking_detectPolicy_reported() {
        // when
        OperationResult<BookingRecord> result = service.createBooking(request("u1")).join();

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(fixtures.store.rowsOf(CollectionNames.RENTALS)).hasSize(3);
        assertThat(view.conflicts(ConflictKind.DOUBLE_BOOKING)).hasSize(2);
    }

    @Test
    @DisplayName("cancelBooking: status CANCELLED with today's date as end date")
    void cancelBooking_stampsEndDate() {
        // when
        OperationResult<BookingRecord> result = service.cancelBooking("b1").join();

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(view.find("b1")).get().satisfies(cancelled -> {
            assertThat(cancelled.getStatus()).isEqualTo(BookingStatus.CANCELLED);
            assertThat(cancelled.getEndDate()).isEqualTo(LocalDate.of(2026, 1, 1));
        });
        assertThat(fixtures.store.rowsOf(CollectionNames.RENTALS).get(0)).containsEntry("status", "CANCELLED");
    }

    @Test
    @DisplayName("endBooking: unknown booking fails with RESOURCE_NOT_FOUND")
    void endBooking_unknown_notFound() {
        // when
        OperationResult<BookingRecord> result = service.endBooking("missing").join();

        // then
        assertThat(result.getErrorCode()).isEqualTo("RESOURCE_NOT_FOUND");
    }

    @Test
    @DisplayName("endBooking: rejected write restores the active booking")
    void endBooking_writeRejected_rolledBack() {
        // given
        fixtures.store.failNextWrite(new IllegalStateException("connection reset"));

        // when
        OperationResult<BookingRecord> result = service.endBooking("b1").join();

        // then
        assertThat(result.getErrorCode()).isEqualTo("WRITE_REJECTED");
        assertThat(view.find("b1")).get().extracting(BookingRecord::getStatus).isEqualTo(BookingStatus.ACTIVE);
    }

    @Test
    @DisplayName("updateBooking: a cancelled booking cannot be reactivated, whatever the policy")
    void updateBooking_cancelledToActive_invalidTransition() {
        // when
        OperationResult<BookingRecord> result = service.updateBooking("b2", Map.of("status", "ACTIVE")).join();

        // then
        assertThat(result.getErrorCode()).isEqualTo("INVALID_TRANSITION");
        assertThat(view.find("b2")).get().extracting(BookingRecord::getStatus).isEqualTo(BookingStatus.CANCELLED);
        assertThat(fixtures.store.rowsOf(CollectionNames.RENTALS).get(1)).containsEntry("status", "CANCELLED");
        assertThat(coordinator.pending()).isEmpty();
    }

    @Test
    @DisplayName("cancelBooking: an ended booking cannot be cancelled")
    void cancelBooking_afterEnd_invalidTransition() {
        // given
        assertThat(service.endBooking("b1").join().isSuccess()).isTrue();

        // when
        OperationResult<BookingRecord> result = service.cancelBooking("b1").join();

        // then
        assertThat(result.isFailure()).isTrue();
        assertThat(result.getErrorCode()).isEqualTo("INVALID_TRANSITION");
        assertThat(view.find("b1")).get().extracting(BookingRecord::getStatus).isEqualTo(BookingStatus.ENDED);
        assertThat(fixtures.store.rowsOf(CollectionNames.RENTALS).get(0)).containsEntry("status", "ENDED");
    }

    @Test
    @DisplayName("updateBooking: an unknown status value fails validation")
    void updateBooking_unknownStatus_validationError() {
        // when
        OperationResult<BookingRecord> result = service.updateBooking("b1", Map.of("status", "PAUSED")).join();

        // then
        assertThat(result.getErrorCode()).isEqualTo("VALIDATION_ERROR");
        assertThat(view.find("b1")).get().extracting(BookingRecord::getStatus).isEqualTo(BookingStatus.ACTIVE);
    }

    @Test
    @DisplayName("createBooking: request without a unit fails validation and nothing is written")
    void createBooking_missingUnit_validationError() {
        // given
        properties.getConflict().setPolicy(SyncProperties.ConflictPolicy.PREVENT);
        CreateBookingRequest request = new CreateBookingRequest(null, "s1", "o1", "r-new",
                LocalDate.of(2026, 3, 1), null, new BigDecimal("4500"));

        // when
        OperationResult<BookingRecord> result = service.createBooking(request).join();

        // then
        assertThat(result.getErrorCode()).isEqualTo("VALIDATION_ERROR");
        assertThat(result.getMessage()).contains("Unit ID cannot be blank");
        assertThat(fixtures.store.rowsOf(CollectionNames.RENTALS)).hasSize(2);
        assertThat(view.bookings()).hasSize(2);
    }

    @Test
    @DisplayName("createBooking: non-positive price and an end before the start fail validation")
    void createBooking_invalidPriceOrPeriod_validationError() {
        // given
        CreateBookingRequest freeOfCharge = new CreateBookingRequest("u2", "s1", "o1", "r-new",
                LocalDate.of(2026, 3, 1), null, BigDecimal.ZERO);
        CreateBookingRequest backwards = new CreateBookingRequest("u2", "s1", "o1", "r-new",
                LocalDate.of(2026, 3, 1), LocalDate.of(2026, 2, 1), new BigDecimal("4500"));

        // when
        OperationResult<BookingRecord> priceResult = service.createBooking(freeOfCharge).join();
        OperationResult<BookingRecord> periodResult = service.createBooking(backwards).join();

        // then
        assertThat(priceResult.getErrorCode()).isEqualTo("VALIDATION_ERROR");
        assertThat(priceResult.getMessage()).contains("Monthly price must be positive");
        assertThat(periodResult.getErrorCode()).isEqualTo("VALIDATION_ERROR");
        assertThat(periodResult.getMessage()).contains("End date must be after start date");
        assertThat(fixtures.store.rowsOf(CollectionNames.RENTALS)).hasSize(2);
    }

    @Test
    @DisplayName("updateBooking: moving an active booking onto an occupied unit is rejected under PREVENT")
    void updateBooking_moveOntoOccupiedUnit_rejected() {
        // given
        properties.getConflict().setPolicy(SyncProperties.ConflictPolicy.PREVENT);
        fixtures.feed.insert(CollectionNames.RENTALS, booking("b3", "u2", BookingStatus.ACTIVE));

        // when
        OperationResult<BookingRecord> result = service.updateBooking("b3", Map.of("unit_id", "u1")).join();

        // then
        assertThat(result.getErrorCode()).isEqualTo("BOOKING_CONFLICT");
        assertThat(view.find("b3")).get().extracting(BookingRecord::getUnitId).isEqualTo("u2");
        assertThat(view.activeBookingsForUnit("u1")).extracting(BookingRecord::getId).containsExactly("b1");
        assertThat(coordinator.pending()).isEmpty();
    }

    @Test
    @DisplayName("updateBooking: moving an active booking's start date into another booking's period is rejected")
    void updateBooking_moveDatesIntoOccupiedPeriod_rejected() {
        // given
        properties.getConflict().setPolicy(SyncProperties.ConflictPolicy.PREVENT);
        Map<String, Object> later = booking("b3", "u1", BookingStatus.ACTIVE);
        later.put("start_date", "2025-06-01");
        later.put("end_date", "2025-12-01");
        fixtures.feed.insert(CollectionNames.RENTALS, later);

        // when
        OperationResult<BookingRecord> result = service.updateBooking("b3", Map.of("end_date", "2026-02-01")).join();

        // then
        assertThat(result.getErrorCode()).isEqualTo("BOOKING_CONFLICT");
        assertThat(view.find("b3")).get().extracting(BookingRecord::getEndDate).isEqualTo(LocalDate.of(2025, 12, 1));
    }

    @Test
    @DisplayName("updateBooking: moving an active booking to a free unit is written")
    void updateBooking_moveToFreeUnit_written() {
        // given
        properties.getConflict().setPolicy(SyncProperties.ConflictPolicy.PREVENT);

        // when
        OperationResult<BookingRecord> result = service.updateBooking("b1", Map.of("unit_id", "u2")).join();

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(view.activeBookingsForUnit("u2")).extracting(BookingRecord::getId).containsExactly("b1");
        assertThat(fixtures.store.rowsOf(CollectionNames.RENTALS).get(0)).containsEntry("unit_id", "u2");
    }

    private static CreateBookingRequest request(String unitId) {
        return new CreateBookingRequest(unitId, "s1", "o1", "r-new", LocalDate.of(2026, 3, 1), null,
                new BigDecimal("4500"));
    }
}
