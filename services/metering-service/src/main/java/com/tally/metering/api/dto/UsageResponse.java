package com.tally.metering.api.dto;

import com.tally.metering.domain.usage.UsageOutcome;
import java.util.List;
import java.util.UUID;

/** Counters after the report plus advisory flags; flags never turn into an error status. */
public record UsageResponse(
        CountersResponse counters,
        List<AdvisoryResponse> advisories,
        List<AlertResponse> alertsRaised,
        UUID sessionRecordId,
        UUID auditEntryId) {

    public static UsageResponse from(UsageOutcome outcome) {
        return new UsageResponse(
                CountersResponse.from(outcome.totals()),
                AdvisoryResponse.from(outcome.limits()),
                outcome.alertsRaised().stream().map(AlertResponse::from).toList(),
                outcome.sessionRecordId(),
                outcome.auditEntryId());
    }
}
