package com.tally.metering.domain.quota;

import java.util.Map;
import java.util.Optional;

/**
 * Default policies per tier.
 *
 * @param tiers policy by tier name
 * @param defaultTier tier used when a tenant's tier has no entry
 */
public record TierDefaults(Map<String, RateLimitPolicy> tiers, String defaultTier) {

    public TierDefaults {
        tiers = Map.copyOf(tiers);
        if (!tiers.containsKey(defaultTier)) {
            throw new IllegalArgumentException("default tier '" + defaultTier + "' has no limits");
        }
    }

    public Optional<RateLimitPolicy> forTier(String tier) {
        return Optional.ofNullable(tier == null ? null : tiers.get(tier));
    }

    public RateLimitPolicy defaultPolicy() {
        return tiers.get(defaultTier);
    }
}
