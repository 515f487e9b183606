package com.openstable.rental.domain.model;

import com.openstable.sync.model.SyncEntity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A box in a stable. {@code available} is cleared while the box is rented out;
 * {@code archived} boxes are withdrawn from the market.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RentableUnit implements SyncEntity {
    String id;
    String stableId;
    String name;
    BigDecimal monthlyPrice;
    boolean available;
    boolean archived;
    Instant updatedAt;
}
