package com.drivenow.mobility.rentalservice.exception;

/**
 * Raised for a missing bound or an end date before the start date.
 */
public class InvalidIntervalException extends ReservationValidationException {
    public InvalidIntervalException(String message) {
        super(message);
    }
}
