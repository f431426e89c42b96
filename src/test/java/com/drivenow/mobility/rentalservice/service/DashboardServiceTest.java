package com.drivenow.mobility.rentalservice.service;

import com.drivenow.mobility.rentalservice.dto.DashboardStatsResponse;
import com.drivenow.mobility.rentalservice.model.PaymentStatus;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;
import com.drivenow.mobility.rentalservice.repository.ReservationRepository;
import com.drivenow.mobility.rentalservice.repository.VehicleRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    @Mock
    private VehicleRepository vehicleRepository;

    @Mock
    private ReservationRepository reservationRepository;

    @InjectMocks
    private DashboardService service;

    @Test
    void should_aggregateFleetAndBookingFigures() {
        when(vehicleRepository.count()).thenReturn(4L);
        when(vehicleRepository.countByAvailableTrue()).thenReturn(3L);
        when(reservationRepository.count()).thenReturn(5L);
        when(reservationRepository.countByStatus(ReservationStatus.ACTIVE)).thenReturn(1L);
        when(reservationRepository.countDistinctCustomers()).thenReturn(2L);
        when(reservationRepository.sumTotalAmountByPaymentStatus(PaymentStatus.PAID)).thenReturn(new BigDecimal("600"));
        when(reservationRepository.countGroupedByStatus()).thenReturn(List.of(
                statusCount(ReservationStatus.PENDING, 3L),
                statusCount(ReservationStatus.ACTIVE, 1L),
                statusCount(ReservationStatus.CANCELLED, 1L)));
        when(reservationRepository.countGroupedByPaymentStatus()).thenReturn(List.of(
                paymentCount(PaymentStatus.PENDING, 3L),
                paymentCount(PaymentStatus.PAID, 2L)));

        DashboardStatsResponse stats = service.getStats();

        assertThat(stats.totalVehicles()).isEqualTo(4L);
        assertThat(stats.availableVehicles()).isEqualTo(3L);
        assertThat(stats.totalBookings()).isEqualTo(5L);
        assertThat(stats.activeBookings()).isEqualTo(1L);
        assertThat(stats.totalCustomers()).isEqualTo(2L);
        assertThat(stats.totalRevenue()).isEqualTo(new BigDecimal("600.00"));
        assertThat(stats.bookingsByStatus()).containsExactly(
                entry("pending", 3L), entry("confirmed", 0L), entry("active", 1L),
                entry("cancelled", 1L), entry("completed", 0L));
        assertThat(stats.bookingsByPaymentStatus()).containsExactly(
                entry("pending", 3L), entry("paid", 2L), entry("failed", 0L), entry("refunded", 0L));
    }

    @Test
    void should_reportZeroes_when_nothingBooked() {
        when(reservationRepository.countGroupedByStatus()).thenReturn(List.of());
        when(reservationRepository.countGroupedByPaymentStatus()).thenReturn(List.of());
        when(reservationRepository.sumTotalAmountByPaymentStatus(PaymentStatus.PAID)).thenReturn(BigDecimal.ZERO);

        DashboardStatsResponse stats = service.getStats();

        assertThat(stats.totalBookings()).isZero();
        assertThat(stats.totalRevenue()).isEqualTo(new BigDecimal("0.00"));
        assertThat(stats.bookingsByStatus()).hasSize(5).allSatisfy((status, count) -> assertThat(count).isZero());
    }

    private static ReservationRepository.StatusCount statusCount(ReservationStatus status, long total) {
        return new ReservationRepository.StatusCount() {
            @Override
            public ReservationStatus getStatus() {
                return status;
            }

            @Override
            public long getTotal() {
                return total;
            }
        };
    }

    private static ReservationRepository.PaymentStatusCount paymentCount(PaymentStatus status, long total) {
        return new ReservationRepository.PaymentStatusCount() {
            @Override
            public PaymentStatus getPaymentStatus() {
                return status;
            }

            @Override
            public long getTotal() {
                return total;
            }
        };
    }
}
