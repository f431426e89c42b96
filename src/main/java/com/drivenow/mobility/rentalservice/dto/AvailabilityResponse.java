package com.drivenow.mobility.rentalservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Advisory availability; the booking itself re-checks conflicts")
public record AvailabilityResponse(boolean available) {}
