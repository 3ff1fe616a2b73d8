package com.tally.metering.domain.alert;

import java.time.Instant;
import java.util.UUID;

/**
 * A raised budget alert. At most one exists per tenant, type and period.
 *
 * @param id alert id
 * @param tenantId the tenant
 * @param alertType what crossed which threshold
 * @param periodStart start of the window the crossing happened in
 * @param currentValue usage when the alert was raised
 * @param limitValue the ceiling at that time
 * @param raisedAt when it was raised
 * @param acknowledgedAt when it was acknowledged, or null
 * @param acknowledgedBy who acknowledged it, or null
 */
public record BudgetAlert(
        UUID id,
        String tenantId,
        AlertType alertType,
        Instant periodStart,
        long currentValue,
        long limitValue,
        Instant raisedAt,
        Instant acknowledgedAt,
        String acknowledgedBy) {

    public boolean acknowledged() {
        return acknowledgedAt != null;
    }
}
