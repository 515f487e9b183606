package com.openstable.rental.service;

import com.openstable.common.util.Constants;
import com.openstable.rental.RentalFixtures;
import com.openstable.rental.conflict.BookingConflictDetector;
import com.openstable.rental.domain.model.BookingStatus;
import com.openstable.rental.domain.model.CollectionNames;
import com.openstable.rental.view.BookingRecordView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.openstable.rental.RentalFixtures.booking;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RentalLifecycleTracker}.
 */
class RentalLifecycleTrackerTest {

    private RentalFixtures fixtures;
    private BookingRecordView view;
    private RentalLifecycleTracker tracker;

    @BeforeEach
    void setUp() {
        fixtures = new RentalFixtures();
        fixtures.store.seed(CollectionNames.RENTALS, booking("b1", "u1", BookingStatus.ACTIVE));
        view = new BookingRecordView(fixtures.allBookings(), fixtures.allUnits(), new BookingConflictDetector());
        tracker = new RentalLifecycleTracker(view, fixtures.scheduler.getClock());
        view.start().join();
    }

    @Test
    @DisplayName("feed events: creation, status change and removal recorded newest first")
    void feedEvents_recorded() {
        // when
        fixtures.feed.insert(CollectionNames.RENTALS, booking("b5", "u2", BookingStatus.ACTIVE));
        fixtures.feed.update(CollectionNames.RENTALS, booking("b5", "u2", BookingStatus.ENDED));
        fixtures.feed.delete(CollectionNames.RENTALS, Map.of("id", "b5"));

        // then
        assertThat(tracker.eventsFor("b5")).extracting(LifecycleEvent::description).containsExactly(
                "Booking removed",
                "Status changed from ACTIVE to ENDED",
                "Booking created with status ACTIVE");
        LifecycleEvent latest = tracker.events().get(0);
        assertThat(latest.status()).isEqualTo(BookingStatus.ENDED);
        assertThat(latest.trigger()).isEqualTo("feed");
        assertThat(latest.timestamp()).isEqualTo(fixtures.scheduler.now());
    }

    @Test
    @DisplayName("update without a status change: nothing recorded")
    void updateSameStatus_notRecorded() {
        // given
        fixtures.feed.insert(CollectionNames.RENTALS, booking("b5", "u2", BookingStatus.ACTIVE));
        Map<String, Object> repriced = booking("b5", "u2", BookingStatus.ACTIVE);
        repriced.put("monthly_price", 4200);

        // when
        fixtures.feed.update(CollectionNames.RENTALS, repriced);

        // then
        assertThat(tracker.events()).hasSize(1);
    }

    @Test
    @DisplayName("update of a booking loaded before tracking: status recorded without a previous one")
    void updateOfLoadedBooking_statusSet() {
        // when
        fixtures.feed.update(CollectionNames.RENTALS, booking("b1", "u1", BookingStatus.CANCELLED));

        // then
        assertThat(tracker.events()).singleElement().satisfies(event -> {
            assertThat(event.description()).isEqualTo("Status set to CANCELLED");
            assertThat(event.previousStatus()).isNull();
        });
    }

    @Test
    @DisplayName("history: capped at the newest entries")
    void history_capped() {
        // when
        for (int i = 0; i < Constants.MAX_LIFECYCLE_EVENTS + 5; i++) {
            fixtures.feed.insert(CollectionNames.RENTALS, booking("n" + i, "u" + i, BookingStatus.ACTIVE));
        }

        // then
        assertThat(tracker.events()).hasSize(Constants.MAX_LIFECYCLE_EVENTS);
        assertThat(tracker.events().get(0).bookingId()).isEqualTo("n" + (Constants.MAX_LIFECYCLE_EVENTS + 4));
        assertThat(tracker.eventsFor("n0")).isEmpty();
    }

    @Test
    @DisplayName("resolveConflict: listed report dismissed and recorded, unknown id refused")
    void resolveConflict() {
        // given
        fixtures.feed.insert(CollectionNames.RENTALS, booking("b5", "u1", BookingStatus.ACTIVE));
        tracker.clear();

        // when
        boolean resolved = tracker.resolveConflict("conflict-double-booking-b5", "renter moved to u2");
        boolean unknown = tracker.resolveConflict("conflict-double-booking-b9", "n/a");

        // then
        assertThat(resolved).isTrue();
        assertThat(unknown).isFalse();
        assertThat(view.conflicts()).extracting(report -> report.bookingId()).containsExactly("b1");
        assertThat(tracker.events()).singleElement().satisfies(event -> {
            assertThat(event.trigger()).isEqualTo("conflict-resolution");
            assertThat(event.description()).contains("renter moved to u2");
        });
    }
}
