package com.tally.metering.api.dto;

import com.tally.metering.domain.quota.PolicyUpdate;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

/** Partial update; omitted fields keep their current value. */
public record PolicyUpdateRequest(
        @Positive Integer sessionsPerHour,
        @Positive Integer sessionsPerDay,
        @Positive Long tokensPerMonth,
        @Positive Long budgetCentsPerMonth,
        @Min(1) @Max(100) Integer alertThresholdPercent) {

    public PolicyUpdate toUpdate() {
        return new PolicyUpdate(sessionsPerHour, sessionsPerDay, tokensPerMonth, budgetCentsPerMonth, alertThresholdPercent);
    }
}
