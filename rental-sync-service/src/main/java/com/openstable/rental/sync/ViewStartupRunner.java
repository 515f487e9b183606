package com.openstable.rental.sync;

import com.openstable.common.dto.OperationResult;
import com.openstable.rental.view.BookingRecordView;
import com.openstable.rental.view.RentableUnitAvailabilityView;
import com.openstable.rental.view.RentalListingView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Starts the rental views once the context is up. A failed initial load is logged and left
 * in the view's state; the views keep their subscriptions and can be refreshed later.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ViewStartupRunner implements ApplicationRunner {

    private final RentableUnitAvailabilityView availabilityView;
    private final RentalListingView listingView;
    private final BookingRecordView bookingView;

    @Override
    public void run(ApplicationArguments args) {
        CompletableFuture.allOf(
                availabilityView.start().thenAccept(result -> report("availability", result)),
                listingView.start().thenAccept(result -> report("listings", result)),
                bookingView.start().thenAccept(result -> report("bookings", result))
        ).join();
    }

    private void report(String view, OperationResult<?> result) {
        if (result.isFailure()) {
            log.error("Initial load of the {} view failed: {} ({})", view, result.getMessage(), result.getErrorCode());
        } else {
            log.info("The {} view is live", view);
        }
    }
}
