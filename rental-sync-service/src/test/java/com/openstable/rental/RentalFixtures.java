package com.openstable.rental;

import com.openstable.rental.domain.model.BookingRecord;
import com.openstable.rental.domain.model.BookingStatus;
import com.openstable.rental.domain.model.CollectionNames;
import com.openstable.rental.domain.model.PaymentStatus;
import com.openstable.rental.domain.model.RentableUnit;
import com.openstable.rental.domain.model.RentalListing;
import com.openstable.sync.codec.EntityCodec;
import com.openstable.sync.filter.FilterDescriptor;
import com.openstable.sync.subscription.SubscriptionManager;
import com.openstable.sync.subscription.SubscriptionOptions;
import com.openstable.sync.support.BackoffPolicy;
import com.openstable.sync.support.BackoffRetrier;
import com.openstable.sync.testing.InMemoryBackingStore;
import com.openstable.sync.testing.InMemoryChangeFeed;
import com.openstable.sync.testing.ManualTaskScheduler;
import com.openstable.sync.view.EntityView;
import com.openstable.sync.view.EntityViewFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory feed, store and scheduler plus row builders for the rental collections.
 */
public class RentalFixtures {

    public final ManualTaskScheduler scheduler = new ManualTaskScheduler();
    public final InMemoryChangeFeed feed = new InMemoryChangeFeed();
    public final InMemoryBackingStore store = new InMemoryBackingStore();
    public final SubscriptionManager subscriptions =
            new SubscriptionManager(feed, new BackoffRetrier(scheduler), scheduler);
    public final EntityViewFactory views = new EntityViewFactory(store, subscriptions, scheduler,
            SubscriptionOptions.builder().retry(BackoffPolicy.of(2, Duration.ofMillis(100), 2.0)).build());

    public static final EntityCodec<RentableUnit> UNITS = EntityCodec.of(RentableUnit.class);
    public static final EntityCodec<RentalListing> LISTINGS = EntityCodec.of(RentalListing.class);
    public static final EntityCodec<BookingRecord> BOOKINGS = EntityCodec.of(BookingRecord.class);

    public EntityView<RentableUnit> unitView(FilterDescriptor filter) {
        return views.create(filter, UNITS);
    }

    public EntityView<RentableUnit> allUnits() {
        return unitView(FilterDescriptor.all(CollectionNames.RENTABLE_UNITS));
    }

    public EntityView<RentalListing> allListings() {
        return views.create(FilterDescriptor.all(CollectionNames.STABLES), LISTINGS);
    }

    public EntityView<BookingRecord> allBookings() {
        return views.create(FilterDescriptor.all(CollectionNames.RENTALS), BOOKINGS);
    }

    public static Map<String, Object> unit(String id, String stableId, int price, boolean available) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("stable_id", stableId);
        row.put("name", "Box " + id);
        row.put("monthly_price", price);
        row.put("available", available);
        row.put("archived", false);
        row.put("updated_at", "2026-01-01T00:00:00Z");
        return row;
    }

    public static Map<String, Object> listing(String id, String ownerId, String name, String location) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("owner_id", ownerId);
        row.put("name", name);
        row.put("location", location);
        row.put("updated_at", "2026-01-01T00:00:00Z");
        return row;
    }

    public static Map<String, Object> booking(String id, String unitId, BookingStatus status) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("unit_id", unitId);
        row.put("stable_id", "s1");
        row.put("owner_id", "o1");
        row.put("renter_id", "r-" + id);
        row.put("status", status.name());
        row.put("start_date", "2026-01-01");
        row.put("end_date", null);
        row.put("monthly_price", 4000);
        row.put("payment_status", PaymentStatus.PAID.name());
        row.put("created_at", "2026-01-01T00:00:00Z");
        row.put("updated_at", "2026-01-01T00:00:00Z");
        return row;
    }

    public static BookingRecord bookingRecord(String id, String unitId, BookingStatus status) {
        return BookingRecord.builder()
                .id(id)
                .unitId(unitId)
                .stableId("s1")
                .renterId("r-" + id)
                .status(status)
                .startDate(LocalDate.of(2026, 1, 1))
                .monthlyPrice(new BigDecimal("4000"))
                .paymentStatus(PaymentStatus.PAID)
                .build();
    }
}
