package com.tally.metering.domain.usage;

import com.tally.metering.domain.alert.BudgetAlert;
import com.tally.metering.domain.quota.LimitCheck;
import com.tally.metering.domain.quota.UsageTotals;
import java.util.List;
import java.util.UUID;

/**
 * Result of metering one usage report. Limit advisories ride along; they are never errors.
 *
 * @param totals counters after the increment
 * @param limits advisory evaluation of those counters
 * @param alertsRaised alerts this report created
 * @param sessionRecordId id of the stored detail row
 * @param auditEntryId id of the audit entry
 */
public record UsageOutcome(
        UsageTotals totals,
        LimitCheck limits,
        List<BudgetAlert> alertsRaised,
        UUID sessionRecordId,
        UUID auditEntryId) {}
