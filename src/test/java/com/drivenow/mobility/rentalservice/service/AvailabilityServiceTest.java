package com.drivenow.mobility.rentalservice.service;

import com.drivenow.mobility.rentalservice.entity.Reservation;
import com.drivenow.mobility.rentalservice.model.DateInterval;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;
import com.drivenow.mobility.rentalservice.repository.ReservationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AvailabilityServiceTest {

    private static final UUID VEHICLE_ID = UUID.randomUUID();

    @Mock
    private ReservationRepository repository;

    private AvailabilityService service;

    @BeforeEach
    void setUp() {
        service = new AvailabilityService(new BookingConflictDetector(repository));
    }

    @Test
    void should_beUnavailable_when_confirmedReservationOverlaps() {
        givenBlocking(LocalDate.of(2025, 4, 1), LocalDate.of(2025, 4, 5));

        boolean available = service.isAvailable(VEHICLE_ID,
                DateInterval.of(LocalDate.of(2025, 4, 4), LocalDate.of(2025, 4, 8)));

        assertThat(available).isFalse();
    }

    @Test
    void should_beAvailable_when_rangeStartsAfterConfirmedReservation() {
        givenBlocking(LocalDate.of(2025, 4, 1), LocalDate.of(2025, 4, 5));

        boolean available = service.isAvailable(VEHICLE_ID,
                DateInterval.of(LocalDate.of(2025, 4, 6), LocalDate.of(2025, 4, 8)));

        assertThat(available).isTrue();
    }

    @Test
    void should_returnSameAnswer_when_calledRepeatedly() {
        givenBlocking(LocalDate.of(2025, 4, 1), LocalDate.of(2025, 4, 5));
        DateInterval interval = DateInterval.of(LocalDate.of(2025, 4, 5), LocalDate.of(2025, 4, 6));

        boolean first = service.isAvailable(VEHICLE_ID, interval);
        boolean second = service.isAvailable(VEHICLE_ID, interval);
        boolean third = service.isAvailable(VEHICLE_ID, interval);

        assertThat(first).isFalse();
        assertThat(second).isEqualTo(first);
        assertThat(third).isEqualTo(first);
        verify(repository, never()).save(any());
    }

    @Test
    void should_onlyConsultBlockingStatuses() {
        when(repository.findByVehicleIdAndStatusInAndEndDateGreaterThanEqualOrderByStartDate(
                eq(VEHICLE_ID), any(), any())).thenReturn(List.of());

        service.isAvailable(VEHICLE_ID, DateInterval.of(LocalDate.of(2025, 4, 1), LocalDate.of(2025, 4, 2)));

        verify(repository).findByVehicleIdAndStatusInAndEndDateGreaterThanEqualOrderByStartDate(
                VEHICLE_ID, ReservationStatus.BLOCKING, LocalDate.of(2025, 4, 1));
    }

    private void givenBlocking(LocalDate start, LocalDate end) {
        Reservation confirmed = Reservation.builder()
                .id(UUID.randomUUID())
                .vehicleId(VEHICLE_ID)
                .startDate(start)
                .endDate(end)
                .status(ReservationStatus.CONFIRMED)
                .build();
        when(repository.findByVehicleIdAndStatusInAndEndDateGreaterThanEqualOrderByStartDate(
                eq(VEHICLE_ID), eq(ReservationStatus.BLOCKING), any(LocalDate.class)))
                .thenReturn(List.of(confirmed));
    }
}
