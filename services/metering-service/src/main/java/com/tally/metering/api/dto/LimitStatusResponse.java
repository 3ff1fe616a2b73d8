package com.tally.metering.api.dto;

import com.tally.metering.domain.quota.EffectivePolicy;
import com.tally.metering.domain.quota.LimitStatus;
import com.tally.metering.domain.quota.Metric;
import java.util.List;

public record LimitStatusResponse(
        String tenantId,
        PolicyResponse policy,
        CountersResponse counters,
        List<String> warnings,
        List<String> exceeded) {

    public static LimitStatusResponse from(LimitStatus status) {
        return new LimitStatusResponse(
                status.tenantId(),
                PolicyResponse.from(new EffectivePolicy(status.policy(), status.tier(), status.source())),
                CountersResponse.from(status.totals()),
                status.warnings().stream().map(Metric::name).toList(),
                status.exceeded().stream().map(Metric::name).toList());
    }
}
