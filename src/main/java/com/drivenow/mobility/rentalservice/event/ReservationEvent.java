package com.drivenow.mobility.rentalservice.event;


import com.drivenow.mobility.rentalservice.entity.Reservation;
import com.drivenow.mobility.rentalservice.model.PaymentStatus;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;


import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;


public record ReservationEvent(
        Type type,
        UUID reservationId,
        UUID vehicleId,
        UUID userId,
        LocalDate startDate,
        LocalDate endDate,
        BigDecimal totalAmount,
        ReservationStatus status,
        PaymentStatus paymentStatus,
        Instant occurredAt
) {

    public enum Type {
        RESERVATION_CREATED,
        RESERVATION_STATUS_CHANGED
    }

    public static ReservationEvent of(Type type, Reservation reservation) {
        return new ReservationEvent(
                type,
                reservation.getId(),
                reservation.getVehicleId(),
                reservation.getUserId(),
                reservation.getStartDate(),
                reservation.getEndDate(),
                reservation.getTotalAmount(),
                reservation.getStatus(),
                reservation.getPaymentStatus(),
                Instant.now()
        );
    }
}
