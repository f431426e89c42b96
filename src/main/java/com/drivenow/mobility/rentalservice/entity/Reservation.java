package com.drivenow.mobility.rentalservice.entity;


import com.drivenow.mobility.rentalservice.model.DateInterval;
import com.drivenow.mobility.rentalservice.model.PaymentStatus;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;
import jakarta.persistence.*;
import lombok.*;


import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;


@Entity
@Table(name = "reservations", indexes = @Index(name = "idx_reservations_vehicle_dates",
        columnList = "vehicleId, startDate, endDate"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {
    @Id
    private UUID id;


    @Column(nullable = false)
    private UUID userId;
    @Column(nullable = false)
    private UUID vehicleId;
    @Column(nullable = false)
    private LocalDate startDate;
    @Column(nullable = false)
    private LocalDate endDate;
    @Column(nullable = false)
    private int totalDays;
    // Snapshot of the vehicle rate at booking time, never recomputed.
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReservationStatus status = ReservationStatus.PENDING;
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;


    public DateInterval interval() {
        return DateInterval.of(startDate, endDate);
    }


    @PrePersist
    protected void onCreate() {
        createdAt = updatedAt = LocalDateTime.now();
        if (id == null) {
            id = UUID.randomUUID();
        }
    }


    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
