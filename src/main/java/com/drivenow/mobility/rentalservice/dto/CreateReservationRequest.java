package com.drivenow.mobility.rentalservice.dto;


import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;


import java.time.LocalDate;
import java.util.UUID;

import static io.swagger.v3.oas.annotations.media.Schema.RequiredMode.REQUIRED;

public record CreateReservationRequest(

        @NotNull(message = "Vehicle ID is required")
        @Schema(description = "Vehicle to reserve", example = "3f1c2a8e-5b7d-4c0e-9a31-6d2f8b4e1c55", requiredMode = REQUIRED)
        UUID vehicleId,

        @NotNull(message = "Start date is required")
        @JsonDeserialize(using = CalendarDateDeserializer.class)
        @Schema(description = "First rental day (ISO date or timestamp, reduced to its calendar date)",
                example = "2026-03-10", requiredMode = REQUIRED)
        LocalDate startDate,

        @NotNull(message = "End date is required")
        @JsonDeserialize(using = CalendarDateDeserializer.class)
        @Schema(description = "Last rental day, inclusive (ISO date or timestamp)", example = "2026-03-13",
                requiredMode = REQUIRED)
        LocalDate endDate
) {}
