package com.tally.metering.api.dto;

import com.tally.metering.domain.alert.BudgetAlert;
import java.time.Instant;
import java.util.UUID;

public record AlertResponse(
        UUID id,
        String tenantId,
        String alertType,
        Instant periodStart,
        long currentValue,
        long limitValue,
        Instant raisedAt,
        Instant acknowledgedAt,
        String acknowledgedBy) {

    public static AlertResponse from(BudgetAlert alert) {
        return new AlertResponse(
                alert.id(),
                alert.tenantId(),
                alert.alertType().name(),
                alert.periodStart(),
                alert.currentValue(),
                alert.limitValue(),
                alert.raisedAt(),
                alert.acknowledgedAt(),
                alert.acknowledgedBy());
    }
}
