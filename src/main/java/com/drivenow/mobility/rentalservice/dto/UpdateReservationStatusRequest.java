package com.drivenow.mobility.rentalservice.dto;

import com.drivenow.mobility.rentalservice.model.PaymentStatus;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import static io.swagger.v3.oas.annotations.media.Schema.RequiredMode.REQUIRED;

public record UpdateReservationStatusRequest(

        @NotNull(message = "Status is required")
        @Schema(description = "Target reservation status", example = "confirmed", requiredMode = REQUIRED)
        ReservationStatus status,

        @Schema(description = "Target payment status, unchanged when omitted", example = "paid")
        PaymentStatus paymentStatus
) {}
