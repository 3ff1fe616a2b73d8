package com.tally.metering.api.dto;

import com.tally.metering.domain.usage.DailyUsage;
import java.time.LocalDate;

public record DailyUsageResponse(
        LocalDate day, long sessions, long tokensInput, long tokensOutput, long totalTokens, long costCents) {

    public static DailyUsageResponse from(DailyUsage usage) {
        return new DailyUsageResponse(
                usage.day(),
                usage.sessions(),
                usage.tokensInput(),
                usage.tokensOutput(),
                usage.totalTokens(),
                usage.costCents());
    }
}
