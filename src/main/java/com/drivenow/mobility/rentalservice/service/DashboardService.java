package com.drivenow.mobility.rentalservice.service;

import com.drivenow.mobility.rentalservice.dto.DashboardStatsResponse;
import com.drivenow.mobility.rentalservice.model.PaymentStatus;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;
import com.drivenow.mobility.rentalservice.repository.ReservationRepository;
import com.drivenow.mobility.rentalservice.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class DashboardService {

    private final VehicleRepository vehicleRepository;
    private final ReservationRepository reservationRepository;

    /**
     * Counts are read independently and may straddle a concurrent write.
     */
    @Transactional(readOnly = true)
    public DashboardStatsResponse getStats() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (ReservationStatus status : ReservationStatus.values()) {
            byStatus.put(status.value(), 0L);
        }
        reservationRepository.countGroupedByStatus()
                .forEach(row -> byStatus.put(row.getStatus().value(), row.getTotal()));

        Map<String, Long> byPaymentStatus = new LinkedHashMap<>();
        for (PaymentStatus status : PaymentStatus.values()) {
            byPaymentStatus.put(status.value(), 0L);
        }
        reservationRepository.countGroupedByPaymentStatus()
                .forEach(row -> byPaymentStatus.put(row.getPaymentStatus().value(), row.getTotal()));

        BigDecimal revenue = reservationRepository.sumTotalAmountByPaymentStatus(PaymentStatus.PAID);

        return new DashboardStatsResponse(
                vehicleRepository.count(),
                vehicleRepository.countByAvailableTrue(),
                reservationRepository.count(),
                reservationRepository.countByStatus(ReservationStatus.ACTIVE),
                reservationRepository.countDistinctCustomers(),
                (revenue != null ? revenue : BigDecimal.ZERO).setScale(PricingCalculator.AMOUNT_SCALE, RoundingMode.HALF_UP),
                byStatus,
                byPaymentStatus
        );
    }
}
