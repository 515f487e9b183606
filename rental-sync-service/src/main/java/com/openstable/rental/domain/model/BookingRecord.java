package com.openstable.rental.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openstable.sync.model.SyncEntity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A rental of one unit by one renter. An open {@code endDate} means the rental runs until further notice.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BookingRecord implements SyncEntity {
    String id;
    String unitId;
    String stableId;
    String ownerId;
    String renterId;
    BookingStatus status;
    LocalDate startDate;
    LocalDate endDate;
    BigDecimal monthlyPrice;
    PaymentStatus paymentStatus;
    Instant createdAt;
    Instant updatedAt;

    @JsonIgnore
    public boolean isActive() {
        return status == BookingStatus.ACTIVE;
    }

    /**
     * Whether the half-open period {@code [startDate, endDate)} of this record intersects
     * {@code [from, until)}. A null end is unbounded.
     */
    public boolean overlaps(LocalDate from, LocalDate until) {
        boolean startsBeforeOtherEnds = until == null || startDate == null || startDate.isBefore(until);
        boolean endsAfterOtherStarts = endDate == null || from == null || endDate.isAfter(from);
        return startsBeforeOtherEnds && endsAfterOtherStarts;
    }
}
