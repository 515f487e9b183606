package com.openstable.rental.config;

import com.openstable.rental.conflict.BookingConflictDetector;
import com.openstable.rental.domain.model.BookingRecord;
import com.openstable.rental.domain.model.RentableUnit;
import com.openstable.rental.domain.model.RentalListing;
import com.openstable.rental.view.BookingRecordView;
import com.openstable.rental.view.RentableUnitAvailabilityView;
import com.openstable.rental.view.RentalFilters;
import com.openstable.rental.view.RentalListingView;
import com.openstable.sync.codec.EntityCodec;
import com.openstable.sync.optimistic.OptimisticMutationCoordinator;
import com.openstable.sync.subscription.SubscriptionManager;
import com.openstable.sync.subscription.SubscriptionOptions;
import com.openstable.sync.support.BackoffRetrier;
import com.openstable.sync.transport.BackingStore;
import com.openstable.sync.transport.ChangeFeedTransport;
import com.openstable.sync.view.EntityViewFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

/**
 * Wires the sync core and the rental views.
 *
 * <p>The {@link ChangeFeedTransport} and {@link BackingStore} adapters are not part of this
 * service; the deployment provides them as beans.
 */
@Slf4j
@Configuration
public class RealtimeSyncConfig {

    @Bean
    public BackoffRetrier backoffRetrier(TaskScheduler scheduler) {
        return new BackoffRetrier(scheduler);
    }

    @Bean(destroyMethod = "close")
    public SubscriptionManager subscriptionManager(ChangeFeedTransport transport, BackoffRetrier retrier,
                                                   TaskScheduler scheduler) {
        return new SubscriptionManager(transport, retrier, scheduler);
    }

    @Bean
    public SubscriptionOptions subscriptionOptions(SyncProperties properties) {
        SubscriptionOptions options = SubscriptionOptions.builder()
                .retry(properties.backoffPolicy())
                .batchUpdates(properties.getBatch().isEnabled())
                .batchDelay(properties.getBatch().getDelay())
                .maxBatchSize(properties.getBatch().getMaxSize())
                .build();
        options.validate();
        log.info("Sync subscriptions: retry {}, batching {}", options.getRetry(), options.isBatchUpdates());
        return options;
    }

    @Bean
    public EntityViewFactory entityViewFactory(BackingStore store, SubscriptionManager subscriptionManager,
                                               TaskScheduler scheduler, SubscriptionOptions subscriptionOptions) {
        return new EntityViewFactory(store, subscriptionManager, scheduler, subscriptionOptions);
    }

    @Bean
    public EntityCodec<RentalListing> rentalListingCodec() {
        return EntityCodec.of(RentalListing.class);
    }

    @Bean
    public EntityCodec<RentableUnit> rentableUnitCodec() {
        return EntityCodec.of(RentableUnit.class);
    }

    @Bean
    public EntityCodec<BookingRecord> bookingRecordCodec() {
        return EntityCodec.of(BookingRecord.class);
    }

    @Bean(destroyMethod = "close")
    public RentableUnitAvailabilityView rentableUnitAvailabilityView(EntityViewFactory views,
                                                                     EntityCodec<RentableUnit> codec,
                                                                     SyncProperties properties) {
        return new RentableUnitAvailabilityView(
                views.create(RentalFilters.units(null, false), codec, properties.refreshPolicy()));
    }

    @Bean(destroyMethod = "close")
    public RentalListingView rentalListingView(EntityViewFactory views, EntityCodec<RentalListing> listingCodec,
                                               EntityCodec<RentableUnit> unitCodec, TaskScheduler scheduler,
                                               SyncProperties properties) {
        return new RentalListingView(
                views.create(RentalFilters.listings(properties.getOwnerId()), listingCodec, properties.refreshPolicy()),
                views.create(RentalFilters.units(null, false), unitCodec, properties.refreshPolicy()),
                scheduler,
                properties.getListing().getThrottleInterval(),
                properties.getListing().getSearchDebounce());
    }

    @Bean(destroyMethod = "close")
    public BookingRecordView bookingRecordView(EntityViewFactory views, EntityCodec<BookingRecord> bookingCodec,
                                               EntityCodec<RentableUnit> unitCodec, BookingConflictDetector detector,
                                               SyncProperties properties) {
        return new BookingRecordView(
                views.create(RentalFilters.bookings(null, properties.getOwnerId()), bookingCodec,
                        properties.refreshPolicy()),
                views.create(RentalFilters.units(null, false), unitCodec, properties.refreshPolicy()),
                detector);
    }

    @Bean(destroyMethod = "close")
    public OptimisticMutationCoordinator<BookingRecord> bookingMutations(BookingRecordView bookingRecordView,
                                                                         BackingStore store, TaskScheduler scheduler,
                                                                         SyncProperties properties) {
        return new OptimisticMutationCoordinator<>(bookingRecordView.getView(), store, scheduler,
                properties.getOptimistic().getConfirmationTimeout());
    }
}
