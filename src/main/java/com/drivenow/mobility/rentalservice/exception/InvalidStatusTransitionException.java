package com.drivenow.mobility.rentalservice.exception;

public class InvalidStatusTransitionException extends ReservationValidationException {
    public InvalidStatusTransitionException(Enum<?> from, Enum<?> to) {
        super("Illegal transition from " + from.name().toLowerCase() + " to " + to.name().toLowerCase());
    }
}
