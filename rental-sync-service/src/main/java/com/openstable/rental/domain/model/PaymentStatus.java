package com.openstable.rental.domain.model;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED
}
