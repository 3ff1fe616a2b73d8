package com.tally.metering.infrastructure.persistence.memory;

import com.tally.metering.domain.usage.DailyUsage;
import com.tally.metering.domain.usage.SessionUsageRecord;
import com.tally.metering.domain.usage.SessionUsageStore;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;

public class InMemorySessionUsageStore implements SessionUsageStore {

    private final ConcurrentLinkedQueue<SessionUsageRecord> records = new ConcurrentLinkedQueue<>();

    @Override
    public void insert(SessionUsageRecord record) {
        records.add(record);
    }

    @Override
    public List<DailyUsage> dailyTotals(String tenantId, Instant from, ZoneId zone) {
        Map<LocalDate, DailyUsage> byDay = new TreeMap<>();
        for (SessionUsageRecord record : records) {
            if (!record.tenantId().equals(tenantId) || record.recordedAt().isBefore(from)) {
                continue;
            }
            LocalDate day = LocalDate.ofInstant(record.recordedAt(), zone);
            byDay.merge(
                    day,
                    new DailyUsage(day, record.sessions(), record.tokensInput(), record.tokensOutput(), record.costCents()),
                    (a, b) ->
                            new DailyUsage(
                                    day,
                                    a.sessions() + b.sessions(),
                                    a.tokensInput() + b.tokensInput(),
                                    a.tokensOutput() + b.tokensOutput(),
                                    a.costCents() + b.costCents()));
        }
        return List.copyOf(byDay.values());
    }
}
