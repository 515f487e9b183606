package com.openstable.rental.domain.model;

/**
 * Collection names used by the backing store and the change feed.
 */
public final class CollectionNames {

    public static final String STABLES = "stables";
    public static final String RENTABLE_UNITS = "rentable-units";
    public static final String RENTALS = "rentals";

    private CollectionNames() {
    }
}
