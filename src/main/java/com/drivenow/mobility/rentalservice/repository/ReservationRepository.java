package com.drivenow.mobility.rentalservice.repository;

import com.drivenow.mobility.rentalservice.entity.Reservation;
import com.drivenow.mobility.rentalservice.model.PaymentStatus;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ReservationRepository extends JpaRepository<Reservation, UUID> {

    List<Reservation> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<Reservation> findAllByOrderByCreatedAtDesc();

    long countByStatus(ReservationStatus status);

    /**
     * Conflict window of a candidate starting on {@code from}: reservations of the vehicle in one of
     * {@code statuses} that do not end before that day.
     */
    List<Reservation> findByVehicleIdAndStatusInAndEndDateGreaterThanEqualOrderByStartDate(
            UUID vehicleId, Collection<ReservationStatus> statuses, LocalDate from);

    @Query("SELECT COUNT(DISTINCT r.userId) FROM Reservation r")
    long countDistinctCustomers();

    @Query("SELECT COALESCE(SUM(r.totalAmount), 0) FROM Reservation r WHERE r.paymentStatus = :paymentStatus")
    BigDecimal sumTotalAmountByPaymentStatus(@Param("paymentStatus") PaymentStatus paymentStatus);

    @Query("SELECT r.status AS status, COUNT(r) AS total FROM Reservation r GROUP BY r.status")
    List<StatusCount> countGroupedByStatus();

    @Query("SELECT r.paymentStatus AS paymentStatus, COUNT(r) AS total FROM Reservation r GROUP BY r.paymentStatus")
    List<PaymentStatusCount> countGroupedByPaymentStatus();

    interface StatusCount {
        ReservationStatus getStatus();

        long getTotal();
    }

    interface PaymentStatusCount {
        PaymentStatus getPaymentStatus();

        long getTotal();
    }
}
