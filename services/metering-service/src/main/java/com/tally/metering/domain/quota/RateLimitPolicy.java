package com.tally.metering.domain.quota;

import java.util.ArrayList;
import java.util.List;

/**
 * Quota ceilings for one tenant.
 *
 * @param sessionsPerHour hourly session ceiling
 * @param sessionsPerDay daily session ceiling
 * @param tokensPerMonth monthly token ceiling
 * @param budgetCentsPerMonth monthly cost ceiling in minor currency units
 * @param alertThresholdPercent percentage of a ceiling at which a warning is raised (1..100)
 */
public record RateLimitPolicy(
        int sessionsPerHour,
        int sessionsPerDay,
        long tokensPerMonth,
        long budgetCentsPerMonth,
        int alertThresholdPercent) {

    /** Lists every rule this policy breaks; empty when valid. */
    public List<String> violations() {
        var errors = new ArrayList<String>();
        if (sessionsPerHour <= 0) {
            errors.add("sessionsPerHour must be > 0");
        }
        if (sessionsPerDay <= 0) {
            errors.add("sessionsPerDay must be > 0");
        }
        if (tokensPerMonth <= 0) {
            errors.add("tokensPerMonth must be > 0");
        }
        if (budgetCentsPerMonth <= 0) {
            errors.add("budgetCentsPerMonth must be > 0");
        }
        if (alertThresholdPercent < 1 || alertThresholdPercent > 100) {
            errors.add("alertThresholdPercent must be between 1 and 100");
        }
        return errors;
    }

    /** Ceiling for a metric. */
    public long limitFor(Metric metric) {
        return switch (metric) {
            case HOURLY_SESSIONS -> sessionsPerHour;
            case DAILY_SESSIONS -> sessionsPerDay;
            case MONTHLY_TOKENS -> tokensPerMonth;
            case MONTHLY_COST -> budgetCentsPerMonth;
        };
    }

    /**
     * Usage at which a metric starts warning: the floor of {@code limit * threshold / 100},
     * never below 1 so an idle tenant does not warn. Split by hundreds so no ceiling overflows.
     */
    public long warningThresholdFor(Metric metric) {
        long limit = limitFor(metric);
        long threshold = limit / 100 * alertThresholdPercent + limit % 100 * alertThresholdPercent / 100;
        return Math.max(1, threshold);
    }
}
