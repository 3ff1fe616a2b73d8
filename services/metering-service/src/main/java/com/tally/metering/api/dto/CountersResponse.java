package com.tally.metering.api.dto;

import com.tally.metering.domain.quota.UsageTotals;
import java.time.Instant;

public record CountersResponse(
        long hourlySessions,
        long dailySessions,
        long monthlyTokens,
        long monthlyCostCents,
        Instant hourStart,
        Instant dayStart,
        Instant monthStart) {

    public static CountersResponse from(UsageTotals totals) {
        return new CountersResponse(
                totals.hourlySessions(),
                totals.dailySessions(),
                totals.monthlyTokens(),
                totals.monthlyCostCents(),
                totals.windows().hourStart(),
                totals.windows().dayStart(),
                totals.windows().monthStart());
    }
}
