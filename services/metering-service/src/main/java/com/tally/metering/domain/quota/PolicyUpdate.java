package com.tally.metering.domain.quota;

/**
 * Partial change to a tenant's rate limit policy; null fields keep their current value.
 */
public record PolicyUpdate(
        Integer sessionsPerHour,
        Integer sessionsPerDay,
        Long tokensPerMonth,
        Long budgetCentsPerMonth,
        Integer alertThresholdPercent) {

    public boolean isEmpty() {
        return sessionsPerHour == null
                && sessionsPerDay == null
                && tokensPerMonth == null
                && budgetCentsPerMonth == null
                && alertThresholdPercent == null;
    }

    /** Applies the non-null fields over {@code current}. */
    public RateLimitPolicy mergeOver(RateLimitPolicy current) {
        return new RateLimitPolicy(
                sessionsPerHour != null ? sessionsPerHour : current.sessionsPerHour(),
                sessionsPerDay != null ? sessionsPerDay : current.sessionsPerDay(),
                tokensPerMonth != null ? tokensPerMonth : current.tokensPerMonth(),
                budgetCentsPerMonth != null ? budgetCentsPerMonth : current.budgetCentsPerMonth(),
                alertThresholdPercent != null
                        ? alertThresholdPercent
                        : current.alertThresholdPercent());
    }
}
