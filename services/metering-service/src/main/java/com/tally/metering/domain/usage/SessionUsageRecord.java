package com.tally.metering.domain.usage;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Write-once detail row for one usage report. */
public record SessionUsageRecord(
        UUID id,
        String tenantId,
        String actorId,
        String conversationRef,
        SessionType sessionType,
        long sessions,
        long tokensInput,
        long tokensOutput,
        long costCents,
        Map<String, ModelUsage> modelBreakdown,
        Instant recordedAt) {

    public SessionUsageRecord {
        modelBreakdown = modelBreakdown == null ? Map.of() : Map.copyOf(modelBreakdown);
    }
}
