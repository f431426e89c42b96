package com.drivenow.mobility.rentalservice.dto;

import com.drivenow.mobility.rentalservice.model.VehicleType;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

public record VehicleResponse(
        UUID id,
        String name,
        VehicleType type,
        String brand,
        String model,
        int year,
        BigDecimal pricePerDay,
        int capacity,
        String imageUrl,
        String description,
        boolean available,
        LocalDateTime createdAt
) {}
