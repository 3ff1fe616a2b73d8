package com.tally.metering.domain.quota;

import com.tally.metering.domain.window.WindowKeys;
import com.tally.metering.domain.window.WindowType;
import java.time.Instant;

/**
 * Durable per-tenant window counters.
 *
 * <p>{@link #increment} must add to all three windows with one atomic insert-or-add per window
 * key. Implementations never read a counter into memory, add, and write it back.
 */
public interface QuotaCounterStore {

    /**
     * Adds {@code delta} to the hour, day and month counters, creating rows on first use.
     *
     * @return the totals after this increment
     */
    UsageTotals increment(String tenantId, WindowKeys windows, UsageDelta delta);

    /** Current totals; windows without a row read as zero. */
    UsageTotals read(String tenantId, WindowKeys windows);

    /**
     * Removes counters of the given type whose window started before {@code cutoff}.
     *
     * @return number of counters removed
     */
    int evictOlderThan(WindowType type, Instant cutoff);
}
