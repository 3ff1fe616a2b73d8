package com.tally.metering.infrastructure.persistence.memory;

import com.tally.metering.domain.quota.RateLimitPolicy;
import com.tally.metering.domain.quota.RateLimitPolicyStore;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryRateLimitPolicyStore implements RateLimitPolicyStore {

    private final ConcurrentMap<String, RateLimitPolicy> policies = new ConcurrentHashMap<>();

    @Override
    public Optional<RateLimitPolicy> find(String tenantId) {
        return Optional.ofNullable(policies.get(tenantId));
    }

    @Override
    public void save(String tenantId, RateLimitPolicy policy, String updatedBy, Instant updatedAt) {
        policies.put(tenantId, policy);
    }
}
