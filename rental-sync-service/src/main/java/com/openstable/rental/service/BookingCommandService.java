package com.openstable.rental.service;

import com.openstable.common.dto.OperationResult;
import com.openstable.common.exception.BusinessException;
import com.openstable.rental.config.SyncProperties;
import com.openstable.rental.conflict.ConflictReport;
import com.openstable.rental.conflict.ProposedBooking;
import com.openstable.rental.domain.model.BookingRecord;
import com.openstable.rental.domain.model.BookingStatus;
import com.openstable.rental.domain.model.PaymentStatus;
import com.openstable.rental.exception.BookingConflictException;
import com.openstable.rental.exception.InvalidTransitionException;
import com.openstable.rental.service.dto.CreateBookingRequest;
import com.openstable.rental.view.BookingRecordView;
import com.openstable.sync.exception.EntityDecodingException;
import com.openstable.sync.optimistic.OptimisticMutationCoordinator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Booking mutations issued through the optimistic coordinator of the booking view.
 *
 * <p>Every command is checked before anything is applied: requests are validated, status
 * changes must follow {@link BookingStatus#canTransitionTo}, and an active booking whose
 * unit or period is new is checked against the other active bookings of that unit. With
 * {@link SyncProperties.ConflictPolicy#PREVENT} an overlap is rejected. With
 * {@link SyncProperties.ConflictPolicy#DETECT} it goes through and shows up in the booking
 * view's reports.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingCommandService {

    private final BookingRecordView bookingView;
    private final OptimisticMutationCoordinator<BookingRecord> bookingMutations;
    private final SyncProperties properties;
    private final Validator validator;
    private final Clock clock;

    public CompletableFuture<OperationResult<BookingRecord>> createBooking(CreateBookingRequest request) {
        log.info("Creating booking of unit {} for renter {}", request.unitId(), request.renterId());
        String violation = validate(request);
        if (violation != null) {
            log.warn("Rejected booking request: {}", violation);
            return failed(new BusinessException("Validation failed: " + violation, "VALIDATION_ERROR"));
        }
        List<ConflictReport> conflicts = bookingView.checkProposed(
                new ProposedBooking(null, request.unitId(), request.startDate(), request.endDate()));
        if (!conflicts.isEmpty() && rejects(conflicts)) {
            return failed(new BookingConflictException(conflicts));
        }
        BookingRecord booking = BookingRecord.builder()
                .unitId(request.unitId())
                .stableId(request.stableId())
                .ownerId(request.ownerId())
                .renterId(request.renterId())
                .status(BookingStatus.ACTIVE)
                .startDate(request.startDate())
                .endDate(request.endDate())
                .monthlyPrice(request.monthlyPrice())
                .paymentStatus(PaymentStatus.PENDING)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        return bookingMutations.create(booking);
    }

    /**
     * Applies a partial update given as column/value pairs. A status change must be allowed
     * from the current status, and an update that leaves the booking active on a changed
     * unit or period is checked for conflicts like a new booking.
     */
    public CompletableFuture<OperationResult<BookingRecord>> updateBooking(String bookingId,
                                                                           Map<String, Object> changes) {
        BookingRecord current = bookingView.find(bookingId).orElse(null);
        if (current != null) {
            BookingRecord candidate;
            try {
                candidate = bookingView.getView().getCodec().patch(current, changes);
            } catch (EntityDecodingException e) {
                log.warn("Rejected update of booking {}: {}", bookingId, e.getMessage());
                return failed(new BusinessException("Validation failed: " + e.getMessage(), e, "VALIDATION_ERROR"));
            }
            if (!current.getStatus().canTransitionTo(candidate.getStatus())) {
                log.warn("Rejected status change of booking {} from {} to {}",
                        bookingId, current.getStatus(), candidate.getStatus());
                return failed(new InvalidTransitionException(bookingId, current.getStatus(), candidate.getStatus()));
            }
            if (candidate.isActive() && movesOccupancy(current, candidate)) {
                List<ConflictReport> conflicts = bookingView.checkProposed(new ProposedBooking(
                        bookingId, candidate.getUnitId(), candidate.getStartDate(), candidate.getEndDate()));
                if (!conflicts.isEmpty() && rejects(conflicts)) {
                    return failed(new BookingConflictException(conflicts));
                }
            }
        }
        Map<String, Object> stamped = new LinkedHashMap<>(changes);
        stamped.put("updated_at", clock.instant().toString());
        return bookingMutations.update(bookingId, stamped);
    }

    /**
     * Ends a rental as of today.
     */
    public CompletableFuture<OperationResult<BookingRecord>> endBooking(String bookingId) {
        log.info("Ending booking {}", bookingId);
        return close(bookingId, BookingStatus.ENDED);
    }

    public CompletableFuture<OperationResult<BookingRecord>> cancelBooking(String bookingId) {
        log.info("Cancelling booking {}", bookingId);
        return close(bookingId, BookingStatus.CANCELLED);
    }

    private CompletableFuture<OperationResult<BookingRecord>> close(String bookingId, BookingStatus status) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", status.name());
        changes.put("end_date", LocalDate.now(clock).toString());
        return updateBooking(bookingId, changes);
    }

    private String validate(CreateBookingRequest request) {
        Set<ConstraintViolation<CreateBookingRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            return violations.stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(ConstraintViolation::getMessage)
                    .collect(Collectors.joining(", "));
        }
        if (request.endDate() != null && !request.endDate().isAfter(request.startDate())) {
            return "End date must be after start date";
        }
        return null;
    }

    private static boolean movesOccupancy(BookingRecord current, BookingRecord candidate) {
        return !Objects.equals(current.getUnitId(), candidate.getUnitId())
                || !Objects.equals(current.getStartDate(), candidate.getStartDate())
                || !Objects.equals(current.getEndDate(), candidate.getEndDate());
    }

    private boolean rejects(List<ConflictReport> conflicts) {
        if (properties.getConflict().getPolicy() == SyncProperties.ConflictPolicy.PREVENT) {
            log.warn("Rejected booking: {}", conflicts.get(0).description());
            return true;
        }
        log.warn("Booking accepted despite conflict: {}", conflicts.get(0).description());
        return false;
    }

    private static CompletableFuture<OperationResult<BookingRecord>> failed(BusinessException exception) {
        return CompletableFuture.completedFuture(OperationResult.failure(exception));
    }
}
