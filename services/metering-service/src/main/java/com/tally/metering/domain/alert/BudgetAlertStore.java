package com.tally.metering.domain.alert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Budget alerts keyed by (tenant, alert type, period start).
 *
 * <p>{@link #insertIfAbsent} is a single conditional insert. Acknowledged alerts keep their key,
 * so a period never gets a second alert of the same type.
 */
public interface BudgetAlertStore {

    /**
     * Inserts the alert unless one with the same key exists.
     *
     * @return the alert if this call created it, empty otherwise
     */
    Optional<BudgetAlert> insertIfAbsent(BudgetAlert alert);

    /**
     * Alerts of a tenant, newest first.
     *
     * @param acknowledged filter on acknowledgement, or null for all
     */
    List<BudgetAlert> list(String tenantId, Boolean acknowledged, int limit);

    /** Unacknowledged alerts across all tenants, oldest first. */
    List<BudgetAlert> pending(int limit);

    Optional<BudgetAlert> find(String tenantId, UUID alertId);

    /**
     * Sets the acknowledgement unless already set.
     *
     * @return the alert as stored afterwards, or empty if it does not exist
     */
    Optional<BudgetAlert> acknowledge(String tenantId, UUID alertId, String userId, Instant at);
}
