package com.drivenow.mobility.rentalservice.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a reservation.
 * <p>
 * {@code CONFIRMED} and {@code ACTIVE} are blocking: while a reservation is in one of them no other
 * blocking reservation may overlap it on the same vehicle. {@code CANCELLED} and {@code COMPLETED} are terminal.
 */
public enum ReservationStatus {
    PENDING,
    CONFIRMED,
    ACTIVE,
    CANCELLED,
    COMPLETED;

    public static final Set<ReservationStatus> BLOCKING = EnumSet.of(CONFIRMED, ACTIVE);

    public boolean isBlocking() {
        return BLOCKING.contains(this);
    }

    public boolean isTerminal() {
        return this == CANCELLED || this == COMPLETED;
    }

    /**
     * Re-applying the current status is always accepted.
     */
    public boolean canTransitionTo(ReservationStatus target) {
        if (target == null) {
            return false;
        }
        if (target == this) {
            return true;
        }
        if (isTerminal()) {
            return false;
        }
        return switch (this) {
            case PENDING -> target == CONFIRMED || target == CANCELLED;
            case CONFIRMED -> target == ACTIVE || target == CANCELLED;
            case ACTIVE -> target == COMPLETED || target == CANCELLED;
            default -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ReservationStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown reservation status: " + value));
    }
}
