package com.openstable.rental.view;

import com.openstable.common.dto.OperationResult;
import com.openstable.rental.conflict.BookingConflictDetector;
import com.openstable.rental.conflict.ConflictKind;
import com.openstable.rental.conflict.ConflictReport;
import com.openstable.rental.conflict.ProposedBooking;
import com.openstable.rental.domain.model.BookingRecord;
import com.openstable.rental.domain.model.BookingStatus;
import com.openstable.rental.domain.model.RentableUnit;
import com.openstable.rental.domain.readmodel.BookingAnalytics;
import com.openstable.sync.view.EntityView;
import com.openstable.sync.view.ViewState;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Booking records with their analytics and conflict reports.
 *
 * <p>Units are followed in a second view because archiving a unit can raise a conflict on
 * its active booking. Any change in either view re-runs analytics and conflict detection
 * over the full data.
 */
@Slf4j
public class BookingRecordView implements AutoCloseable {

    private final EntityView<BookingRecord> bookings;
    private final EntityView<RentableUnit> units;
    private final BookingConflictDetector detector;
    private final AtomicReference<BookingAnalytics> analytics = new AtomicReference<>(BookingAnalytics.EMPTY);
    private final AtomicReference<List<ConflictReport>> conflicts = new AtomicReference<>(List.of());
    private final List<Consumer<List<ConflictReport>>> conflictListeners = new CopyOnWriteArrayList<>();
    private final Object evaluation = new Object();

    public BookingRecordView(EntityView<BookingRecord> bookings, EntityView<RentableUnit> units,
                             BookingConflictDetector detector) {
        this.bookings = bookings;
        this.units = units;
        this.detector = detector;
        bookings.addStateListener(state -> evaluate());
        units.addStateListener(state -> evaluate());
    }

    public CompletableFuture<OperationResult<List<BookingRecord>>> start() {
        return bookings.start().thenCombine(units.start(), (bookingResult, unitResult) ->
                ViewResults.combine(bookingResult, unitResult, bookings::snapshot));
    }

    public CompletableFuture<OperationResult<List<BookingRecord>>> refresh() {
        return bookings.refresh().thenCombine(units.refresh(), (bookingResult, unitResult) ->
                ViewResults.combine(bookingResult, unitResult, bookings::snapshot));
    }

    public List<BookingRecord> bookings() {
        return bookings.snapshot();
    }

    public Optional<BookingRecord> find(String bookingId) {
        return bookings.find(bookingId);
    }

    public List<BookingRecord> activeBookingsForUnit(String unitId) {
        return bookings.snapshot().stream()
                .filter(booking -> booking.isActive() && unitId.equals(booking.getUnitId()))
                .toList();
    }

    public List<BookingRecord> bookingsByStatus(BookingStatus status) {
        return bookings.snapshot().stream()
                .filter(booking -> booking.getStatus() == status)
                .toList();
    }

    public BookingAnalytics analytics() {
        return analytics.get();
    }

    public List<ConflictReport> conflicts() {
        return conflicts.get();
    }

    public List<ConflictReport> conflicts(ConflictKind kind) {
        return conflicts.get().stream().filter(report -> report.kind() == kind).toList();
    }

    /**
     * Checks a booking that has not been written yet against the current active bookings.
     */
    public List<ConflictReport> checkProposed(ProposedBooking proposed) {
        return detector.checkProposed(proposed, bookings.snapshot());
    }

    /**
     * Removes a report from the current list. The next evaluation reports it again if the
     * underlying bookings still conflict.
     */
    public boolean dismissConflict(String conflictId) {
        synchronized (evaluation) {
            List<ConflictReport> current = conflicts.get();
            List<ConflictReport> remaining = current.stream()
                    .filter(report -> !report.id().equals(conflictId))
                    .toList();
            if (remaining.size() == current.size()) {
                return false;
            }
            conflicts.set(remaining);
            notifyConflicts(remaining);
            return true;
        }
    }

    public ViewState<BookingRecord> getState() {
        return bookings.getState();
    }

    public EntityView<BookingRecord> getView() {
        return bookings;
    }

    public void addConflictListener(Consumer<List<ConflictReport>> listener) {
        conflictListeners.add(listener);
    }

    @Override
    public void close() {
        bookings.close();
        units.close();
    }

    private void evaluate() {
        synchronized (evaluation) {
            List<BookingRecord> current = bookings.snapshot();
            analytics.set(BookingAnalytics.of(current));
            List<ConflictReport> next = detector.detect(current, units.snapshot());
            List<ConflictReport> previous = conflicts.getAndSet(next);
            if (next.equals(previous)) {
                return;
            }
            long critical = next.stream().filter(report -> report.kind() == ConflictKind.DOUBLE_BOOKING).count();
            if (critical > 0) {
                log.warn("{} booking(s) on {} are part of a double booking", critical, bookings.getFilter());
            }
            notifyConflicts(next);
        }
    }

    private void notifyConflicts(List<ConflictReport> reports) {
        for (Consumer<List<ConflictReport>> listener : conflictListeners) {
            try {
                listener.accept(reports);
            } catch (RuntimeException e) {
                log.error("Conflict listener failed", e);
            }
        }
    }
}
