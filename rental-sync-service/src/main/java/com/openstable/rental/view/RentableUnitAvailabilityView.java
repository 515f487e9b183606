package com.openstable.rental.view;

import com.openstable.common.dto.OperationResult;
import com.openstable.rental.domain.model.RentableUnit;
import com.openstable.rental.domain.readmodel.AvailabilityStats;
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
 * Units of a stable (or of all stables) with their availability statistics,
 * recomputed from the full unit list on every change.
 */
@Slf4j
public class RentableUnitAvailabilityView implements AutoCloseable {

    private final EntityView<RentableUnit> units;
    private final AtomicReference<AvailabilityStats> stats = new AtomicReference<>(AvailabilityStats.EMPTY);
    private final List<Consumer<AvailabilityStats>> statsListeners = new CopyOnWriteArrayList<>();

    public RentableUnitAvailabilityView(EntityView<RentableUnit> units) {
        this.units = units;
        units.addStateListener(this::recompute);
    }

    public CompletableFuture<OperationResult<AvailabilityStats>> start() {
        return units.start().thenApply(result -> ViewResults.combine(result, result, this::stats));
    }

    public CompletableFuture<OperationResult<AvailabilityStats>> refresh() {
        return units.refresh().thenApply(result -> ViewResults.combine(result, result, this::stats));
    }

    public List<RentableUnit> units() {
        return units.snapshot();
    }

    public List<RentableUnit> availableUnits() {
        return units.snapshot().stream()
                .filter(unit -> unit.isAvailable() && !unit.isArchived())
                .toList();
    }

    public Optional<RentableUnit> find(String unitId) {
        return units.find(unitId);
    }

    public AvailabilityStats stats() {
        return stats.get();
    }

    public ViewState<RentableUnit> getState() {
        return units.getState();
    }

    public EntityView<RentableUnit> getView() {
        return units;
    }

    /**
     * Notified whenever the statistics change.
     */
    public void addStatsListener(Consumer<AvailabilityStats> listener) {
        statsListeners.add(listener);
    }

    @Override
    public void close() {
        units.close();
    }

    private void recompute(ViewState<RentableUnit> state) {
        AvailabilityStats next = AvailabilityStats.of(state.items());
        AvailabilityStats previous = stats.getAndSet(next);
        if (next.equals(previous)) {
            return;
        }
        log.debug("Availability on {}: {}/{} units free", units.getFilter(), next.availableUnits(), next.totalUnits());
        statsListeners.forEach(listener -> listener.accept(next));
    }
}
