package com.tally.metering.api.dto;

import com.tally.metering.domain.quota.EffectivePolicy;
import com.tally.metering.domain.quota.RateLimitPolicy;

public record PolicyResponse(
        int sessionsPerHour,
        int sessionsPerDay,
        long tokensPerMonth,
        long budgetCentsPerMonth,
        int alertThresholdPercent,
        String tier,
        String source) {

    public static PolicyResponse from(EffectivePolicy effective) {
        RateLimitPolicy policy = effective.policy();
        return new PolicyResponse(
                policy.sessionsPerHour(),
                policy.sessionsPerDay(),
                policy.tokensPerMonth(),
                policy.budgetCentsPerMonth(),
                policy.alertThresholdPercent(),
                effective.tier(),
                effective.source().name());
    }
}
