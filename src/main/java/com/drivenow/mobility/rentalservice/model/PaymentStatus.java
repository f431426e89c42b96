package com.drivenow.mobility.rentalservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Payment label of a reservation. Moves independently of {@link ReservationStatus}.
 */
public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED;

    public boolean canTransitionTo(PaymentStatus target) {
        if (target == null) {
            return false;
        }
        if (target == this) {
            return true;
        }
        return switch (this) {
            case PENDING -> target == PAID || target == FAILED;
            case PAID -> target == REFUNDED;
            case FAILED, REFUNDED -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PaymentStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown payment status: " + value));
    }
}
