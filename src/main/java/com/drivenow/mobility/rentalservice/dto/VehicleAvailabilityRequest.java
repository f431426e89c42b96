package com.drivenow.mobility.rentalservice.dto;

import jakarta.validation.constraints.NotNull;

public record VehicleAvailabilityRequest(
        @NotNull(message = "Available flag is required")
        Boolean available
) {}
