package com.drivenow.mobility.rentalservice.util;

import com.drivenow.mobility.rentalservice.exception.ReservationValidationException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Reduces ISO-8601 dates and timestamps to the calendar date they fall on, in the offset they
 * were written with. {@code 2025-03-10}, {@code 2025-03-10T23:00:00} and
 * {@code 2025-03-10T23:00:00Z} all yield 2025-03-10.
 */
public final class CalendarDates {

    private CalendarDates() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static LocalDate parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ReservationValidationException("Date value is required");
        }
        String text = value.trim();
        try {
            if (text.indexOf('T') < 0) {
                return LocalDate.parse(text);
            }
            if (hasOffset(text)) {
                return OffsetDateTime.parse(text).toLocalDate();
            }
            return LocalDateTime.parse(text).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new ReservationValidationException("Invalid date format: " + value, e);
        }
    }

    private static boolean hasOffset(String text) {
        int timeStart = text.indexOf('T');
        String time = text.substring(timeStart);
        return time.endsWith("Z") || time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }
}
