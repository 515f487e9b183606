package com.openstable.rental.domain.model;

import com.openstable.sync.model.SyncEntity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A stable advertising rentable units.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RentalListing implements SyncEntity {
    String id;
    String ownerId;
    String name;
    String location;
    Instant updatedAt;
}
