package com.tally.metering.domain.audit;

import java.util.Map;

/**
 * A tenant-scoped action to be written to the ledger.
 *
 * @param tenantId tenant the action was performed in
 * @param actorId who performed it
 * @param actionType namespaced action type
 * @param targetRef reference to the affected resource (may be null)
 * @param description free-text description (may be null)
 * @param before state before the action (may be null)
 * @param after state after the action (may be null)
 */
public record AuditEvent(
        String tenantId,
        String actorId,
        String actionType,
        String targetRef,
        String description,
        Map<String, ?> before,
        Map<String, ?> after) {

    public static AuditEvent of(
            String tenantId, String actorId, String actionType, String targetRef, String description) {
        return new AuditEvent(tenantId, actorId, actionType, targetRef, description, null, null);
    }
}
