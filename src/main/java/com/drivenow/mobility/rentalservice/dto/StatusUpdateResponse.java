package com.drivenow.mobility.rentalservice.dto;

import com.drivenow.mobility.rentalservice.model.PaymentStatus;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;

import java.util.UUID;

public record StatusUpdateResponse(
        String message,
        UUID reservationId,
        ReservationStatus status,
        PaymentStatus paymentStatus
) {}
