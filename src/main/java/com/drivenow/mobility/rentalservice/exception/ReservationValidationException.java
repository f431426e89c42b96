package com.drivenow.mobility.rentalservice.exception;

public class ReservationValidationException extends RuntimeException {
    public ReservationValidationException(String message) {
        super(message);
    }

    public ReservationValidationException(String message, Throwable throwable) {
        super(message, throwable);
    }
}
