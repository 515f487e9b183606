package com.openstable.rental.service;

import com.openstable.common.util.Constants;
import com.openstable.rental.domain.model.BookingRecord;
import com.openstable.rental.domain.model.BookingStatus;
import com.openstable.rental.view.BookingRecordView;
import com.openstable.sync.model.ChangeEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log of booking status transitions seen on the booking feed and of manual conflict resolutions.
 * Keeps the newest {@value Constants#MAX_LIFECYCLE_EVENTS} entries, newest first.
 */
@Slf4j
@Component
public class RentalLifecycleTracker {

    private static final String FEED = "feed";
    private static final String CONFLICT_RESOLUTION = "conflict-resolution";

    private final BookingRecordView bookingView;
    private final Clock clock;
    private final Deque<LifecycleEvent> events = new ArrayDeque<>();
    private final Map<String, BookingStatus> knownStatuses = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public RentalLifecycleTracker(BookingRecordView bookingView, Clock clock) {
        this.bookingView = bookingView;
        this.clock = clock;
        bookingView.getView().addChangeListener(this::onChange);
    }

    public synchronized List<LifecycleEvent> events() {
        return List.copyOf(events);
    }

    public synchronized List<LifecycleEvent> eventsFor(String bookingId) {
        return events.stream().filter(event -> bookingId.equals(event.bookingId())).toList();
    }

    /**
     * Dismisses a conflict report and logs how it was resolved.
     *
     * @return false when no report with that id is currently listed
     */
    public boolean resolveConflict(String conflictId, String resolution) {
        if (!bookingView.dismissConflict(conflictId)) {
            return false;
        }
        log.info("Conflict {} resolved: {}", conflictId, resolution);
        record(null, null, null, CONFLICT_RESOLUTION, "Conflict " + conflictId + " resolved: " + resolution);
        return true;
    }

    public synchronized void clear() {
        events.clear();
    }

    private void onChange(ChangeEvent<BookingRecord> event) {
        BookingStatus previous;
        BookingStatus status;
        synchronized (this) {
            previous = knownStatuses.get(event.key());
            if (event instanceof ChangeEvent.Delete<BookingRecord> delete) {
                BookingRecord removed = delete.previous();
                status = removed != null && removed.getStatus() != null ? removed.getStatus() : previous;
                knownStatuses.remove(event.key());
            } else {
                status = event.current().getStatus();
                knownStatuses.put(event.key(), status);
            }
        }
        switch (event.type()) {
            case INSERT -> record(event.key(), status, null, FEED, "Booking created with status " + status);
            case UPDATE -> {
                if (status != previous) {
                    record(event.key(), status, previous, FEED, previous == null
                            ? "Status set to " + status
                            : "Status changed from " + previous + " to " + status);
                }
            }
            case DELETE -> record(event.key(), status, previous, FEED, "Booking removed");
        }
    }

    private synchronized void record(String bookingId, BookingStatus status, BookingStatus previous,
                                     String trigger, String description) {
        events.addFirst(new LifecycleEvent("evt-" + sequence.incrementAndGet(), bookingId, status, previous,
                clock.instant(), trigger, description));
        while (events.size() > Constants.MAX_LIFECYCLE_EVENTS) {
            events.removeLast();
        }
    }
}
