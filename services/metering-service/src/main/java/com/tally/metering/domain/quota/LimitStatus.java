package com.tally.metering.domain.quota;

import java.util.List;

/**
 * Dashboard view of a tenant's limits.
 *
 * @param tenantId the tenant
 * @param policy effective ceilings
 * @param tier the tenant's tier
 * @param source where the ceilings came from
 * @param totals current counters
 * @param warnings metrics at or past their warning threshold
 * @param exceeded metrics at or past their ceiling
 */
public record LimitStatus(
        String tenantId,
        RateLimitPolicy policy,
        String tier,
        PolicySource source,
        UsageTotals totals,
        List<Metric> warnings,
        List<Metric> exceeded) {

    static LimitStatus from(LimitCheck check) {
        return new LimitStatus(
                check.tenantId(),
                check.policy().policy(),
                check.policy().tier(),
                check.policy().source(),
                check.totals(),
                check.warnings(),
                check.exceeded());
    }
}
