package com.drivenow.mobility.rentalservice.service.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion keyed by resource id.
 */
public interface LockOperations {

    /**
     * Executes action while holding the lock of a single resource.
     *
     * @param resourceId Resource to lock
     * @param action Action to execute while holding lock
     * @return Result of action
     * @throws LockAcquisitionException if lock cannot be acquired in time
     */
    <T> T executeWithLock(String resourceId, Supplier<T> action);

    class LockAcquisitionException extends RuntimeException {
        public LockAcquisitionException(String message) {
            super(message);
        }
    }
}
