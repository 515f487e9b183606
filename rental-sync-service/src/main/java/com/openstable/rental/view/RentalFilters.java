package com.openstable.rental.view;

import com.openstable.rental.domain.model.CollectionNames;
import com.openstable.sync.filter.FilterBuilder;
import com.openstable.sync.filter.FilterDescriptor;

/**
 * Filters used by the rental views. Null arguments leave the corresponding condition out.
 */
public final class RentalFilters {

    private RentalFilters() {
    }

    public static FilterDescriptor units(String stableId, boolean availableOnly) {
        FilterBuilder builder = FilterBuilder.on(CollectionNames.RENTABLE_UNITS);
        if (stableId != null) {
            builder.eq("stable_id", stableId);
        }
        if (availableOnly) {
            builder.eq("available", true);
        }
        return builder.build();
    }

    public static FilterDescriptor listings(String ownerId) {
        FilterBuilder builder = FilterBuilder.on(CollectionNames.STABLES);
        if (ownerId != null) {
            builder.eq("owner_id", ownerId);
        }
        return builder.build();
    }

    public static FilterDescriptor bookings(String stableId, String ownerId) {
        FilterBuilder builder = FilterBuilder.on(CollectionNames.RENTALS);
        if (stableId != null) {
            builder.eq("stable_id", stableId);
        }
        if (ownerId != null) {
            builder.eq("owner_id", ownerId);
        }
        return builder.build();
    }
}
