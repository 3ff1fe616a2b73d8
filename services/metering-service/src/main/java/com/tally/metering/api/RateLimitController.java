package com.tally.metering.api;

import com.tally.metering.api.dto.AdvisoryResponse;
import com.tally.metering.api.dto.LimitStatusResponse;
import com.tally.metering.api.dto.PolicyResponse;
import com.tally.metering.api.dto.PolicyUpdateRequest;
import com.tally.metering.domain.quota.RateLimitPolicyService;
import com.tally.security.CallerContext;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
public class RateLimitController {

    private final RateLimitPolicyService policyService;

    public RateLimitController(RateLimitPolicyService policyService) {
        this.policyService = policyService;
    }

    /** Advisory flags for every metric; never blocks anything. */
    @GetMapping("/limits")
    public List<AdvisoryResponse> checkLimits(CallerContext caller, @PathVariable String tenantId) {
        return AdvisoryResponse.from(policyService.checkLimits(tenantId, caller));
    }

    @GetMapping("/rate-limits")
    public LimitStatusResponse limitStatus(CallerContext caller, @PathVariable String tenantId) {
        return LimitStatusResponse.from(policyService.getLimitStatus(tenantId, caller));
    }

    @PutMapping("/rate-limits")
    public PolicyResponse updatePolicy(
            CallerContext caller, @PathVariable String tenantId, @Valid @RequestBody PolicyUpdateRequest request) {
        return PolicyResponse.from(policyService.updatePolicy(tenantId, caller, request.toUpdate()));
    }
}
