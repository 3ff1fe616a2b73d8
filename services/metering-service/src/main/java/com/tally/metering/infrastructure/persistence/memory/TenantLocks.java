package com.tally.metering.infrastructure.persistence.memory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per tenant. Writers of different tenants never wait on each other.
 */
final class TenantLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    <T> T withLock(String tenantId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(tenantId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    void withLock(String tenantId, Runnable action) {
        withLock(
                tenantId,
                () -> {
                    action.run();
                    return null;
                });
    }
}
