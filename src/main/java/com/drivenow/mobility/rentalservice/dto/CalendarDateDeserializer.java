package com.drivenow.mobility.rentalservice.dto;

import com.drivenow.mobility.rentalservice.exception.ReservationValidationException;
import com.drivenow.mobility.rentalservice.util.CalendarDates;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.LocalDate;

/**
 * Accepts both calendar dates and timestamps for booking bounds.
 */
public class CalendarDateDeserializer extends JsonDeserializer<LocalDate> {

    @Override
    public LocalDate deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        String text = parser.getValueAsString();
        try {
            return CalendarDates.parse(text);
        } catch (ReservationValidationException e) {
            return (LocalDate) context.handleWeirdStringValue(LocalDate.class, text, e.getMessage());
        }
    }
}
