package com.drivenow.mobility.rentalservice.service;

import com.drivenow.mobility.rentalservice.exception.ReservationValidationException;
import com.drivenow.mobility.rentalservice.model.DateInterval;
import com.drivenow.mobility.rentalservice.model.PriceQuote;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.temporal.ChronoUnit;

/**
 * Prices a rental by calendar-day difference. A same-day rental is billed as one day.
 */
@Component
public class PricingCalculator {

    public static final int AMOUNT_SCALE = 2;

    public PriceQuote price(DateInterval interval, BigDecimal ratePerDay) {
        if (ratePerDay == null || ratePerDay.signum() <= 0) {
            throw new ReservationValidationException("Rate per day must be positive");
        }
        int days = billableDays(interval);
        BigDecimal amount = ratePerDay.multiply(BigDecimal.valueOf(days))
                .setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
        return new PriceQuote(days, amount);
    }

    public int billableDays(DateInterval interval) {
        long days = ChronoUnit.DAYS.between(interval.start(), interval.end());
        return (int) Math.max(1, days);
    }
}
