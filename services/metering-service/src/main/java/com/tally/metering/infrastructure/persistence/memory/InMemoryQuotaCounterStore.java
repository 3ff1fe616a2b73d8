package com.tally.metering.infrastructure.persistence.memory;

import com.tally.metering.domain.quota.CounterTotals;
import com.tally.metering.domain.quota.QuotaCounterStore;
import com.tally.metering.domain.quota.UsageDelta;
import com.tally.metering.domain.quota.UsageTotals;
import com.tally.metering.domain.window.WindowKeys;
import com.tally.metering.domain.window.WindowType;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Window counters held in a concurrent map. Each window is updated with an atomic
 * {@code merge}; the tenant lock makes the three windows of one increment visible together.
 */
public class InMemoryQuotaCounterStore implements QuotaCounterStore {

    record CounterKey(String tenantId, WindowType type, Instant windowStart) {}

    private final ConcurrentMap<CounterKey, CounterTotals> counters = new ConcurrentHashMap<>();
    private final TenantLocks locks = new TenantLocks();

    @Override
    public UsageTotals increment(String tenantId, WindowKeys windows, UsageDelta delta) {
        return locks.withLock(
                tenantId,
                () ->
                        new UsageTotals(
                                windows,
                                add(tenantId, WindowType.HOUR, windows, delta),
                                add(tenantId, WindowType.DAY, windows, delta),
                                add(tenantId, WindowType.MONTH, windows, delta)));
    }

    @Override
    public UsageTotals read(String tenantId, WindowKeys windows) {
        return locks.withLock(
                tenantId,
                () ->
                        new UsageTotals(
                                windows,
                                get(tenantId, WindowType.HOUR, windows),
                                get(tenantId, WindowType.DAY, windows),
                                get(tenantId, WindowType.MONTH, windows)));
    }

    @Override
    public int evictOlderThan(WindowType type, Instant cutoff) {
        int removed = 0;
        for (CounterKey key : counters.keySet()) {
            if (key.type() == type && key.windowStart().isBefore(cutoff) && counters.remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    private CounterTotals add(String tenantId, WindowType type, WindowKeys windows, UsageDelta delta) {
        return counters.merge(
                new CounterKey(tenantId, type, windows.start(type)),
                CounterTotals.ZERO.plus(delta),
                (current, increment) ->
                        new CounterTotals(
                                current.sessions() + increment.sessions(),
                                current.tokens() + increment.tokens(),
                                current.costCents() + increment.costCents()));
    }

    private CounterTotals get(String tenantId, WindowType type, WindowKeys windows) {
        return counters.getOrDefault(new CounterKey(tenantId, type, windows.start(type)), CounterTotals.ZERO);
    }
}
