package com.drivenow.mobility.rentalservice.dto;

import com.drivenow.mobility.rentalservice.model.PaymentStatus;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;
import com.drivenow.mobility.rentalservice.model.VehicleType;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Schema(description = "A vehicle reservation with its snapshotted price")
public record ReservationResponse(

        @Schema(description = "Reservation ID")
        UUID id,

        @Schema(description = "Customer who made the reservation")
        UUID userId,

        UUID vehicleId,

        @Schema(description = "Vehicle name, absent when the vehicle was removed from the fleet")
        String vehicleName,

        VehicleType vehicleType,

        LocalDate startDate,

        LocalDate endDate,

        @Schema(description = "Billable days, at least 1", example = "3")
        int totalDays,

        @Schema(description = "Days times the vehicle rate at booking time", example = "450.00")
        BigDecimal totalAmount,

        @Schema(description = "Reservation status",
                allowableValues = {"pending", "confirmed", "active", "cancelled", "completed"}, example = "pending")
        ReservationStatus status,

        @Schema(description = "Payment status", allowableValues = {"pending", "paid", "failed", "refunded"},
                example = "pending")
        PaymentStatus paymentStatus,

        LocalDateTime createdAt
) {}
