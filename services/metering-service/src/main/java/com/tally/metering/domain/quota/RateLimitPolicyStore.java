package com.tally.metering.domain.quota;

import java.time.Instant;
import java.util.Optional;

/** Per-tenant policy overrides. */
public interface RateLimitPolicyStore {

    Optional<RateLimitPolicy> find(String tenantId);

    /** Inserts or replaces the override for a tenant. */
    void save(String tenantId, RateLimitPolicy policy, String updatedBy, Instant updatedAt);
}
