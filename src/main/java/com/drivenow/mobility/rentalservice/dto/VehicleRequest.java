package com.drivenow.mobility.rentalservice.dto;

import com.drivenow.mobility.rentalservice.model.VehicleType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

import static io.swagger.v3.oas.annotations.media.Schema.RequiredMode.REQUIRED;

public record VehicleRequest(

        @NotBlank(message = "Name is required")
        @Size(max = 100, message = "Name must be at most 100 characters")
        @Schema(example = "Corolla Hybrid", requiredMode = REQUIRED)
        String name,

        @NotNull(message = "Vehicle type is required")
        @Schema(allowableValues = {"car", "motorcycle", "truck", "van"}, example = "car", requiredMode = REQUIRED)
        VehicleType type,

        @NotBlank(message = "Brand is required")
        @Schema(example = "Toyota", requiredMode = REQUIRED)
        String brand,

        @NotBlank(message = "Model is required")
        @Schema(example = "Corolla", requiredMode = REQUIRED)
        String model,

        @NotNull(message = "Year is required")
        @Min(value = 1900, message = "Year must be 1900 or later")
        @Max(value = 2100, message = "Year must be 2100 or earlier")
        @Schema(example = "2024", requiredMode = REQUIRED)
        Integer year,

        @NotNull(message = "Price per day is required")
        @DecimalMin(value = "0.01", message = "Price per day must be positive")
        @Digits(integer = 8, fraction = 2, message = "Price per day must have at most 2 decimals")
        @Schema(example = "150.00", requiredMode = REQUIRED)
        BigDecimal pricePerDay,

        @NotNull(message = "Capacity is required")
        @Min(value = 1, message = "Capacity must be at least 1")
        @Schema(description = "Seats or load capacity", example = "5", requiredMode = REQUIRED)
        Integer capacity,

        @Size(max = 2000, message = "Description must be at most 2000 characters")
        String description
) {}
