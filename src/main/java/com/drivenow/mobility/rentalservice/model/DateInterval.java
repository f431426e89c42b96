package com.drivenow.mobility.rentalservice.model;

import com.drivenow.mobility.rentalservice.exception.InvalidIntervalException;

import java.time.LocalDate;

/**
 * Inclusive range of calendar dates. Both ends belong to the interval, so a single-day
 * interval has {@code start == end}.
 */
public record DateInterval(LocalDate start, LocalDate end) {

    public DateInterval {
        if (start == null || end == null) {
            throw new InvalidIntervalException("Start date and end date are required");
        }
        if (end.isBefore(start)) {
            throw new InvalidIntervalException("End date " + end + " is before start date " + start);
        }
    }

    public static DateInterval of(LocalDate start, LocalDate end) {
        return new DateInterval(start, end);
    }

    /**
     * True when the two intervals share at least one calendar day. Touching ends count.
     */
    public boolean overlaps(DateInterval other) {
        return !start.isAfter(other.end) && !end.isBefore(other.start);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
