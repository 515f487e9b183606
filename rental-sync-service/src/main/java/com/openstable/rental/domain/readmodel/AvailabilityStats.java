package com.openstable.rental.domain.readmodel;

import com.openstable.rental.domain.model.RentableUnit;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Availability figures over a set of units. Archived units are not counted.
 *
 * @param occupancyRate occupied units as a percentage of all counted units, one decimal
 * @param minPrice      lowest monthly price, null when no unit is counted
 * @param maxPrice      highest monthly price, null when no unit is counted
 */
public record AvailabilityStats(
        int totalUnits,
        int availableUnits,
        int occupiedUnits,
        double occupancyRate,
        BigDecimal minPrice,
        BigDecimal maxPrice
) {

    public static final AvailabilityStats EMPTY = new AvailabilityStats(0, 0, 0, 0.0, null, null);

    public static AvailabilityStats of(Collection<RentableUnit> units) {
        int total = 0;
        int available = 0;
        BigDecimal min = null;
        BigDecimal max = null;
        for (RentableUnit unit : units) {
            if (unit.isArchived()) {
                continue;
            }
            total++;
            if (unit.isAvailable()) {
                available++;
            }
            BigDecimal price = unit.getMonthlyPrice();
            if (price != null) {
                min = min == null || price.compareTo(min) < 0 ? price : min;
                max = max == null || price.compareTo(max) > 0 ? price : max;
            }
        }
        if (total == 0) {
            return EMPTY;
        }
        int occupied = total - available;
        return new AvailabilityStats(total, available, occupied, percentage(occupied, total), min, max);
    }

    static double percentage(long part, long whole) {
        if (whole == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100L)
                .divide(BigDecimal.valueOf(whole), 1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public boolean hasAvailability() {
        return availableUnits > 0;
    }
}
