package com.delta.propertytracker.distress.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes the operations that rewrite tax-delinquency records: the bulk replace and resolver
 * batches. A second caller fails fast instead of queueing behind a slow county fetch.
 */
@Component
public class StoreMaintenanceGuard {
    private static final Logger log = LoggerFactory.getLogger(StoreMaintenanceGuard.class);

    private final ReentrantLock lock = new ReentrantLock();
    private volatile String activeOperation;

    public <T> T runExclusive(String operation, Supplier<T> action) {
        if (!lock.tryLock()) {
            log.warn("Rejected {} while {} is running", operation, activeOperation);
            throw new MaintenanceInProgressException(
                "Cannot start " + operation + " while " + activeOperation + " is running"
            );
        }
        try {
            activeOperation = operation;
            return action.get();
        } finally {
            activeOperation = null;
            lock.unlock();
        }
    }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
