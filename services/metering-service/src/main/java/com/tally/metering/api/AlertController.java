package com.tally.metering.api;

import com.tally.metering.api.dto.AlertResponse;
import com.tally.metering.domain.alert.BudgetAlertService;
import com.tally.security.CallerContext;
import java.util.List;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/alerts")
public class AlertController {

    private final BudgetAlertService alertService;

    public AlertController(BudgetAlertService alertService) {
        this.alertService = alertService;
    }

    @GetMapping
    public List<AlertResponse> listAlerts(
            CallerContext caller,
            @PathVariable String tenantId,
            @RequestParam(required = false) Boolean acknowledged,
            @RequestParam(defaultValue = "50") int limit) {
        return alertService.listAlerts(tenantId, caller, acknowledged, limit).stream()
                .map(AlertResponse::from)
                .toList();
    }

    /** Idempotent; the first acknowledgement is kept. */
    @PostMapping("/{alertId}/acknowledge")
    public AlertResponse acknowledge(CallerContext caller, @PathVariable String tenantId, @PathVariable UUID alertId) {
        return AlertResponse.from(alertService.acknowledge(tenantId, alertId, caller));
    }
}
