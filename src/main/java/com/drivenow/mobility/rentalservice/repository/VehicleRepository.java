package com.drivenow.mobility.rentalservice.repository;

import com.drivenow.mobility.rentalservice.entity.Vehicle;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface VehicleRepository extends JpaRepository<Vehicle, UUID> {

    List<Vehicle> findByAvailableTrueOrderByCreatedAtDesc();

    List<Vehicle> findAllByOrderByCreatedAtDesc();

    long countByAvailableTrue();

    /**
     * Loads the vehicle with a row lock held until the surrounding transaction ends. Serializes
     * reservation commits for one vehicle across service instances sharing the database.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Vehicle v WHERE v.id = :id")
    Optional<Vehicle> findByIdForUpdate(@Param("id") UUID id);
}
