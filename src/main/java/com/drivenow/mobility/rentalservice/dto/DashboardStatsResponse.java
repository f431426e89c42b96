package com.drivenow.mobility.rentalservice.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.util.Map;

@Schema(description = "Fleet and booking aggregates for the admin dashboard")
public record DashboardStatsResponse(
        long totalVehicles,
        long availableVehicles,
        long totalBookings,
        long activeBookings,
        @Schema(description = "Distinct customers holding at least one booking")
        long totalCustomers,
        @Schema(description = "Sum of booking amounts whose payment status is paid", example = "1350.00")
        BigDecimal totalRevenue,
        Map<String, Long> bookingsByStatus,
        Map<String, Long> bookingsByPaymentStatus
) {}
