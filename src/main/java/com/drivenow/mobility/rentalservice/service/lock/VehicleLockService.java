package com.drivenow.mobility.rentalservice.service.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process fair lock per vehicle. Callers that also take the vehicle row lock in the database
 * only ever wait on the row lock for requests coming from other instances.
 */
@Service
@Slf4j
public class VehicleLockService implements LockOperations {

    private final ConcurrentMap<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final Duration waitTimeout;

    public VehicleLockService(@Value("${rental.locking.wait-timeout:5s}") Duration waitTimeout) {
        this.waitTimeout = waitTimeout;
    }

    @Override
    public <T> T executeWithLock(String vehicleId, Supplier<T> action) {
        LockEntry entry = retain(vehicleId);
        try {
            return runLocked(vehicleId, entry.lock, action);
        } finally {
            release(vehicleId);
        }
    }

    private <T> T runLocked(String vehicleId, ReentrantLock lock, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = lock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for lock on vehicle: " + vehicleId);
        }

        if (!acquired) {
            log.warn("Failed to acquire lock within timeout: vehicleId={}, waitTimeout={}ms",
                    vehicleId, waitTimeout.toMillis());
            throw new LockAcquisitionException("Failed to acquire lock for vehicle: " + vehicleId);
        }

        log.debug("Acquired lock: vehicleId={}", vehicleId);
        try {
            return action.get();
        } finally {
            lock.unlock();
            log.debug("Released lock: vehicleId={}", vehicleId);
        }
    }

    // Users are counted inside compute, so an entry is only dropped when no thread holds or waits on it.
    private LockEntry retain(String vehicleId) {
        return locks.compute(vehicleId, (id, entry) -> {
            LockEntry retained = entry != null ? entry : new LockEntry();
            retained.users++;
            return retained;
        });
    }

    private void release(String vehicleId) {
        locks.computeIfPresent(vehicleId, (id, entry) -> --entry.users == 0 ? null : entry);
    }

    int trackedLocks() {
        return locks.size();
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        private int users;
    }
}
