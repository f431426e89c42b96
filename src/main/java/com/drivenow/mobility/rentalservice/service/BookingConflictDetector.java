package com.drivenow.mobility.rentalservice.service;

import com.drivenow.mobility.rentalservice.entity.Reservation;
import com.drivenow.mobility.rentalservice.model.DateInterval;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;
import com.drivenow.mobility.rentalservice.repository.ReservationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Finds blocking reservations of a vehicle that share a day with a candidate interval. The
 * repository narrows the window by end date; {@link DateInterval#overlaps} decides.
 */
@Component
@RequiredArgsConstructor
public class BookingConflictDetector {

    private final ReservationRepository repository;

    public List<Reservation> findConflicts(UUID vehicleId, DateInterval candidate) {
        return findConflicts(vehicleId, candidate, null);
    }

    /**
     * @param excludeId reservation to leave out of the window, typically the one being transitioned
     */
    public List<Reservation> findConflicts(UUID vehicleId, DateInterval candidate, UUID excludeId) {
        return repository.findByVehicleIdAndStatusInAndEndDateGreaterThanEqualOrderByStartDate(
                        vehicleId, ReservationStatus.BLOCKING, candidate.start())
                .stream()
                .filter(existing -> !existing.getId().equals(excludeId))
                .filter(existing -> candidate.overlaps(existing.interval()))
                .toList();
    }

    public boolean hasConflict(UUID vehicleId, DateInterval candidate) {
        return !findConflicts(vehicleId, candidate).isEmpty();
    }
}
