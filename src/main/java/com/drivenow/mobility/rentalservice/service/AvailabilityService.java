package com.drivenow.mobility.rentalservice.service;

import com.drivenow.mobility.rentalservice.model.DateInterval;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Advisory availability for pre-booking checks. Takes no lock and holds nothing: a positive answer
 * is not a reservation, the commit re-checks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final BookingConflictDetector conflictDetector;

    @Transactional(readOnly = true)
    public boolean isAvailable(UUID vehicleId, DateInterval interval) {
        boolean available = !conflictDetector.hasConflict(vehicleId, interval);
        log.debug("Availability of vehicle {} for {}: {}", vehicleId, interval, available);
        return available;
    }
}
