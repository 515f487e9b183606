package com.openstable.rental.view;

import com.openstable.common.dto.OperationResult;
import com.openstable.common.util.Constants;
import com.openstable.rental.domain.model.CollectionNames;
import com.openstable.rental.domain.model.RentableUnit;
import com.openstable.rental.domain.model.RentalListing;
import com.openstable.rental.domain.readmodel.AvailabilityStats;
import com.openstable.rental.domain.readmodel.RentalListingSummary;
import com.openstable.sync.merge.CacheMerge;
import com.openstable.sync.merge.Page;
import com.openstable.sync.support.Debouncer;
import com.openstable.sync.support.Throttler;
import com.openstable.sync.view.EntityView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Stable listings with the availability of their units embedded.
 *
 * <p>Listings and units are two independent views; a change in either one recomputes every
 * summary. Recomputation is throttled so that a burst of unit updates costs one pass per interval.
 * The search term is debounced for type-ahead use.
 */
@Slf4j
public class RentalListingView implements AutoCloseable {

    private final EntityView<RentalListing> listings;
    private final EntityView<RentableUnit> units;
    private final Throttler<String> recompute;
    private final Debouncer<String> search;
    private final AtomicReference<List<RentalListingSummary>> summaries = new AtomicReference<>(List.of());
    private final List<Consumer<List<RentalListingSummary>>> listeners = new CopyOnWriteArrayList<>();
    private volatile String searchTerm = "";

    public RentalListingView(EntityView<RentalListing> listings, EntityView<RentableUnit> units,
                             TaskScheduler scheduler, Duration throttleInterval, Duration searchDebounce) {
        this.listings = listings;
        this.units = units;
        this.recompute = new Throttler<>(this::recompute, throttleInterval, scheduler);
        this.search = new Debouncer<>(this::applySearch, searchDebounce, scheduler);
        listings.addStateListener(state -> recompute.accept(CollectionNames.STABLES));
        units.addStateListener(state -> recompute.accept(CollectionNames.RENTABLE_UNITS));
    }

    /**
     * Loads both collections. The returned summaries are computed from the loaded data directly.
     */
    public CompletableFuture<OperationResult<List<RentalListingSummary>>> start() {
        return listings.start().thenCombine(units.start(), (listingResult, unitResult) ->
                ViewResults.combine(listingResult, unitResult, () -> recomputeNow("start")));
    }

    public CompletableFuture<OperationResult<List<RentalListingSummary>>> refresh() {
        return listings.refresh().thenCombine(units.refresh(), (listingResult, unitResult) ->
                ViewResults.combine(listingResult, unitResult, () -> recomputeNow("refresh")));
    }

    /**
     * All summaries, in listing order.
     */
    public List<RentalListingSummary> summaries() {
        return summaries.get();
    }

    public Optional<RentalListingSummary> summaryOf(String listingId) {
        return CacheMerge.findByKey(summaries.get(), listingId, RentalListingSummary::id);
    }

    /**
     * Summaries matching the current search term by name or location.
     */
    public List<RentalListingSummary> visibleSummaries() {
        return CacheMerge.filterBySearch(summaries.get(), searchTerm,
                RentalListingSummary::name, RentalListingSummary::location);
    }

    public Page<RentalListingSummary> page(int page, int pageSize) {
        return CacheMerge.paginate(visibleSummaries(), page, Math.min(pageSize, Constants.MAX_PAGE_SIZE));
    }

    /**
     * Sets the search term once typing has paused.
     */
    public void search(String term) {
        search.accept(term == null ? "" : term);
    }

    public void searchNow(String term) {
        search.cancel();
        applySearch(term == null ? "" : term);
    }

    public String getSearchTerm() {
        return searchTerm;
    }

    /**
     * Notified with the visible summaries after every recomputation or search change.
     */
    public void addListener(Consumer<List<RentalListingSummary>> listener) {
        listeners.add(listener);
    }

    public EntityView<RentalListing> getListings() {
        return listings;
    }

    public EntityView<RentableUnit> getUnits() {
        return units;
    }

    @Override
    public void close() {
        recompute.cancel();
        search.cancel();
        listings.close();
        units.close();
    }

    private List<RentalListingSummary> recomputeNow(String trigger) {
        recompute(trigger);
        return summaries.get();
    }

    private void recompute(String trigger) {
        Map<String, List<RentableUnit>> unitsByStable = CacheMerge.groupBy(units.snapshot(), RentableUnit::getStableId);
        List<RentalListing> current = listings.snapshot();
        List<RentalListingSummary> next = new ArrayList<>(current.size());
        for (RentalListing listing : current) {
            List<RentableUnit> stableUnits = unitsByStable.getOrDefault(listing.getId(), List.of());
            next.add(new RentalListingSummary(listing, AvailabilityStats.of(stableUnits)));
        }
        summaries.set(List.copyOf(next));
        log.debug("Recomputed {} listing summaries after change in {}", next.size(), trigger);
        notifyListeners();
    }

    private void applySearch(String term) {
        searchTerm = term;
        log.debug("Listing search term set to '{}'", term);
        notifyListeners();
    }

    private void notifyListeners() {
        List<RentalListingSummary> visible = visibleSummaries();
        for (Consumer<List<RentalListingSummary>> listener : listeners) {
            try {
                listener.accept(visible);
            } catch (RuntimeException e) {
                log.error("Listing summary listener failed", e);
            }
        }
    }
}
