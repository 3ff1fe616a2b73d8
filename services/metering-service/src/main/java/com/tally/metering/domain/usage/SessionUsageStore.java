package com.tally.metering.domain.usage;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

public interface SessionUsageStore {

    void insert(SessionUsageRecord record);

    /**
     * Per-day sums of a tenant's records since {@code from}, oldest day first. Days without usage
     * are omitted.
     */
    List<DailyUsage> dailyTotals(String tenantId, Instant from, ZoneId zone);
}
