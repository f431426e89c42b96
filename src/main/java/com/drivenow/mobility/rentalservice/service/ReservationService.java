package com.drivenow.mobility.rentalservice.service;

import com.drivenow.mobility.rentalservice.config.UserContext;
import com.drivenow.mobility.rentalservice.dto.*;
import com.drivenow.mobility.rentalservice.entity.Reservation;
import com.drivenow.mobility.rentalservice.entity.Vehicle;
import com.drivenow.mobility.rentalservice.event.ReservationEvent;
import com.drivenow.mobility.rentalservice.event.ReservationEventPublisher;
import com.drivenow.mobility.rentalservice.exception.*;
import com.drivenow.mobility.rentalservice.model.DateInterval;
import com.drivenow.mobility.rentalservice.model.PaymentStatus;
import com.drivenow.mobility.rentalservice.model.PriceQuote;
import com.drivenow.mobility.rentalservice.model.ReservationStatus;
import com.drivenow.mobility.rentalservice.repository.ReservationRepository;
import com.drivenow.mobility.rentalservice.repository.VehicleRepository;
import com.drivenow.mobility.rentalservice.service.lock.LockOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;


import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.drivenow.mobility.rentalservice.event.ReservationEvent.Type.RESERVATION_CREATED;
import static com.drivenow.mobility.rentalservice.event.ReservationEvent.Type.RESERVATION_STATUS_CHANGED;


/**
 * Commits reservations and moves them through their lifecycle.
 * <p>
 * Commits and transitions into a blocking status run under the per-vehicle lock and inside one
 * transaction that also holds the vehicle row lock, so the conflict check and the write are atomic
 * with respect to every other writer of the same vehicle. Events are published after commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService {

    public static final String STATUS_UPDATED_MESSAGE = "Booking status updated successfully";

    private final ReservationRepository repository;
    private final VehicleRepository vehicleRepository;
    private final BookingConflictDetector conflictDetector;
    private final PricingCalculator pricingCalculator;
    private final LockOperations lockOperations;
    private final TransactionTemplate transactionTemplate;
    private final ReservationEventPublisher eventPublisher;

    public ReservationResponse createReservation(CreateReservationRequest request, UserContext user) {
        DateInterval interval = DateInterval.of(request.startDate(), request.endDate());
        UUID vehicleId = request.vehicleId();

        Committed committed = lockOperations.executeWithLock(vehicleId.toString(),
                () -> transactionTemplate.execute(tx -> commit(user.userId(), vehicleId, interval)));

        Reservation reservation = committed.reservation();
        log.info("Created reservation {} for user {} on vehicle {} {} ({} days, {})", reservation.getId(),
                user.userId(), vehicleId, interval, reservation.getTotalDays(), reservation.getTotalAmount());
        eventPublisher.publish(ReservationEvent.of(RESERVATION_CREATED, reservation));

        return toResponse(reservation, committed.vehicle());
    }

    private Committed commit(UUID userId, UUID vehicleId, DateInterval interval) {
        Vehicle vehicle = vehicleRepository.findByIdForUpdate(vehicleId)
                .filter(Vehicle::isAvailable)
                .orElseThrow(() -> new VehicleNotFoundException("Vehicle not found or not available: " + vehicleId));

        checkForConflicts(vehicleId, interval, null);

        PriceQuote quote = pricingCalculator.price(interval, vehicle.getPricePerDay());
        Reservation reservation = Reservation.builder()
                .userId(userId)
                .vehicleId(vehicleId)
                .startDate(interval.start())
                .endDate(interval.end())
                .totalDays(quote.days())
                .totalAmount(quote.amount())
                .status(ReservationStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .build();

        return new Committed(repository.saveAndFlush(reservation), vehicle);
    }

    private void checkForConflicts(UUID vehicleId, DateInterval interval, UUID excludeId) {
        List<Reservation> conflicts = conflictDetector.findConflicts(vehicleId, interval, excludeId);
        if (!conflicts.isEmpty()) {
            log.info("Rejected {} on vehicle {}: overlaps reservation {}", interval, vehicleId,
                    conflicts.get(0).getId());
            throw new ReservationConflictException("Vehicle " + vehicleId + " is not available for selected dates");
        }
    }


    public StatusUpdateResponse updateStatus(UUID reservationId, UpdateReservationStatusRequest request,
                                             UserContext user) {
        if (!user.isAdmin()) {
            throw new ForbiddenException("Admin access required");
        }

        UUID vehicleId = findReservationOrThrow(reservationId).getVehicleId();
        Reservation updated = lockOperations.executeWithLock(vehicleId.toString(),
                () -> transactionTemplate.execute(tx -> applyTransition(reservationId, vehicleId, request)));

        log.info("Admin {} moved reservation {} to {}/{}", user.userId(), reservationId,
                updated.getStatus(), updated.getPaymentStatus());
        eventPublisher.publish(ReservationEvent.of(RESERVATION_STATUS_CHANGED, updated));

        return new StatusUpdateResponse(STATUS_UPDATED_MESSAGE, updated.getId(), updated.getStatus(),
                updated.getPaymentStatus());
    }

    private Reservation applyTransition(UUID reservationId, UUID vehicleId, UpdateReservationStatusRequest request) {
        // Row lock first, so the reservation and the conflict window are read after any other writer commits.
        // A removed vehicle has no row to lock; its reservations can still be moved.
        vehicleRepository.findByIdForUpdate(vehicleId);
        Reservation reservation = findReservationOrThrow(reservationId);

        ReservationStatus targetStatus = request.status();
        if (!reservation.getStatus().canTransitionTo(targetStatus)) {
            throw new InvalidStatusTransitionException(reservation.getStatus(), targetStatus);
        }

        PaymentStatus targetPayment = request.paymentStatus() != null
                ? request.paymentStatus()
                : reservation.getPaymentStatus();
        if (!reservation.getPaymentStatus().canTransitionTo(targetPayment)) {
            throw new InvalidStatusTransitionException(reservation.getPaymentStatus(), targetPayment);
        }

        if (targetStatus.isBlocking()) {
            checkForConflicts(reservation.getVehicleId(), reservation.interval(), reservation.getId());
        }

        reservation.setStatus(targetStatus);
        reservation.setPaymentStatus(targetPayment);
        return repository.saveAndFlush(reservation);
    }


    @Transactional(readOnly = true)
    public ReservationResponse getById(UUID reservationId, UserContext user) {
        Reservation reservation = findReservationOrThrow(reservationId);
        if (!user.isAdmin() && !reservation.getUserId().equals(user.userId())) {
            throw new ForbiddenException("You do not have access to this reservation");
        }
        Vehicle vehicle = vehicleRepository.findById(reservation.getVehicleId()).orElse(null);
        return toResponse(reservation, vehicle);
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> getMyReservations(UserContext user) {
        return toResponses(repository.findByUserIdOrderByCreatedAtDesc(user.userId()));
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> getAllReservations(UserContext user) {
        if (!user.isAdmin()) {
            throw new ForbiddenException("Admin access required");
        }
        return toResponses(repository.findAllByOrderByCreatedAtDesc());
    }


    private Reservation findReservationOrThrow(UUID reservationId) {
        return repository.findById(reservationId)
                .orElseThrow(() -> new ReservationNotFoundException("Reservation not found with id: " + reservationId));
    }

    private List<ReservationResponse> toResponses(List<Reservation> reservations) {
        Set<UUID> vehicleIds = reservations.stream().map(Reservation::getVehicleId).collect(Collectors.toSet());
        Map<UUID, Vehicle> vehicles = vehicleRepository.findAllById(vehicleIds).stream()
                .collect(Collectors.toMap(Vehicle::getId, Function.identity()));
        return reservations.stream()
                .map(reservation -> toResponse(reservation, vehicles.get(reservation.getVehicleId())))
                .toList();
    }

    private static ReservationResponse toResponse(Reservation reservation, Vehicle vehicle) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getUserId(),
                reservation.getVehicleId(),
                vehicle != null ? vehicle.getName() : null,
                vehicle != null ? vehicle.getType() : null,
                reservation.getStartDate(),
                reservation.getEndDate(),
                reservation.getTotalDays(),
                reservation.getTotalAmount(),
                reservation.getStatus(),
                reservation.getPaymentStatus(),
                reservation.getCreatedAt()
        );
    }

    private record Committed(Reservation reservation, Vehicle vehicle) {}
}
