package com.tally.metering.domain.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable ledger entry as stored.
 *
 * @param id entry id
 * @param tenantId tenant the action was performed in
 * @param actorId who performed it
 * @param actionType namespaced action type, e.g. {@code usage:recorded}
 * @param targetRef reference to the affected resource
 * @param description free-text description
 * @param beforeValue JSON of the state before the action, or null
 * @param afterValue JSON of the state after the action, or null
 * @param occurredAt when the action happened (microsecond precision)
 * @param integrityHash SHA-256 hex digest computed at insert time, or null for legacy rows
 */
public record AuditEntry(
        UUID id,
        String tenantId,
        String actorId,
        String actionType,
        String targetRef,
        String description,
        String beforeValue,
        String afterValue,
        Instant occurredAt,
        String integrityHash) {

    /** Copy carrying the given hash. */
    public AuditEntry withHash(String hash) {
        return new AuditEntry(
                id, tenantId, actorId, actionType, targetRef, description, beforeValue, afterValue,
                occurredAt, hash);
    }
}
