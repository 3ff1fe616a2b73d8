package com.tally.metering.api;

import com.tally.metering.api.dto.CountersResponse;
import com.tally.metering.api.dto.DailyUsageResponse;
import com.tally.metering.api.dto.UsageReportRequest;
import com.tally.metering.api.dto.UsageResponse;
import com.tally.metering.domain.usage.UsageAnalyticsService;
import com.tally.metering.domain.usage.UsageMeteringService;
import com.tally.observability.SpanHelper;
import com.tally.security.CallerContext;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Usage ingestion and dashboards.
 *
 * <p>A report that pushes a tenant past a limit still answers 200; the breach shows up in the
 * {@code advisories} and {@code alertsRaised} fields.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/usage")
public class UsageController {

    private final UsageMeteringService meteringService;
    private final UsageAnalyticsService analyticsService;
    private final SpanHelper spans;

    public UsageController(
            UsageMeteringService meteringService, UsageAnalyticsService analyticsService, SpanHelper spans) {
        this.meteringService = meteringService;
        this.analyticsService = analyticsService;
        this.spans = spans;
    }

    @PostMapping
    public UsageResponse reportUsage(
            CallerContext caller, @PathVariable String tenantId, @Valid @RequestBody UsageReportRequest request) {
        return spans.inSpan(
                "usage.report",
                Map.of("tenant.id", tenantId),
                () -> UsageResponse.from(meteringService.reportUsage(tenantId, caller, request.toReport())));
    }

    @GetMapping("/counters")
    public CountersResponse currentCounters(CallerContext caller, @PathVariable String tenantId) {
        return CountersResponse.from(analyticsService.currentCounters(tenantId, caller));
    }

    @GetMapping("/daily")
    public List<DailyUsageResponse> dailyUsage(
            CallerContext caller,
            @PathVariable String tenantId,
            @RequestParam(defaultValue = "30") int days) {
        return analyticsService.dailyUsage(tenantId, caller, days).stream()
                .map(DailyUsageResponse::from)
                .toList();
    }
}
