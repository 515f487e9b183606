package com.openstable.rental.domain.readmodel;

import com.openstable.rental.domain.model.RentalListing;

/**
 * A listing together with the availability of its units.
 */
public record RentalListingSummary(RentalListing listing, AvailabilityStats units) {

    public String id() {
        return listing.getId();
    }

    public String name() {
        return listing.getName();
    }

    public String location() {
        return listing.getLocation();
    }
}
