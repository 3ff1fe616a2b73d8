package com.tally.metering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tally.metering.domain.quota.LimitAdvisory;
import com.tally.metering.domain.quota.LimitCheck;
import java.util.List;

public record AdvisoryResponse(
        String metric,
        long current,
        long limit,
        @JsonProperty("isExceeded") boolean isExceeded,
        @JsonProperty("isWarning") boolean isWarning) {

    public static AdvisoryResponse from(LimitAdvisory advisory) {
        return new AdvisoryResponse(
                advisory.metric().name(), advisory.current(), advisory.limit(), advisory.exceeded(), advisory.warning());
    }

    public static List<AdvisoryResponse> from(LimitCheck check) {
        return check.advisories().stream().map(AdvisoryResponse::from).toList();
    }
}
