package com.tally.metering.domain.quota;

import java.util.List;

/**
 * Outcome of evaluating a tenant's counters against its effective policy.
 *
 * @param tenantId the tenant
 * @param policy the effective policy used
 * @param totals the counters evaluated
 * @param advisories one entry per {@link Metric}, in declaration order
 */
public record LimitCheck(
        String tenantId, EffectivePolicy policy, UsageTotals totals, List<LimitAdvisory> advisories) {

    public LimitCheck {
        advisories = List.copyOf(advisories);
    }

    public List<Metric> warnings() {
        return advisories.stream().filter(LimitAdvisory::warning).map(LimitAdvisory::metric).toList();
    }

    public List<Metric> exceeded() {
        return advisories.stream().filter(LimitAdvisory::exceeded).map(LimitAdvisory::metric).toList();
    }

    public boolean anyFlagged() {
        return advisories.stream().anyMatch(LimitAdvisory::flagged);
    }
}
