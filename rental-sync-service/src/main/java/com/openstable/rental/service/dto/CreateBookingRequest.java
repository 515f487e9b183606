package com.openstable.rental.service.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Request to rent a unit. A null {@code endDate} books the unit until further notice.
 */
public record CreateBookingRequest(
        @NotBlank(message = "Unit ID cannot be blank")
        String unitId,

        @NotBlank(message = "Stable ID cannot be blank")
        String stableId,

        String ownerId,

        @NotBlank(message = "Renter ID cannot be blank")
        String renterId,

        @NotNull(message = "Start date cannot be null")
        LocalDate startDate,

        LocalDate endDate,

        @Positive(message = "Monthly price must be positive")
        @NotNull(message = "Monthly price cannot be null")
        BigDecimal monthlyPrice
) {
}
