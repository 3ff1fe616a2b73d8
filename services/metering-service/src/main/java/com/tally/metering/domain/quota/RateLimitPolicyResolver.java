package com.tally.metering.domain.quota;

import com.tally.metering.domain.membership.Tenant;

/**
 * Resolves the policy in force for a tenant: its own override, else its tier's defaults, else
 * the default tier.
 */
public class RateLimitPolicyResolver {

    private final RateLimitPolicyStore store;
    private final TierDefaults tierDefaults;

    public RateLimitPolicyResolver(RateLimitPolicyStore store, TierDefaults tierDefaults) {
        this.store = store;
        this.tierDefaults = tierDefaults;
    }

    public EffectivePolicy resolve(Tenant tenant) {
        return store.find(tenant.id())
                .map(policy -> new EffectivePolicy(policy, tenant.tier(), PolicySource.TENANT_OVERRIDE))
                .orElseGet(() -> new EffectivePolicy(tierDefault(tenant.tier()), tenant.tier(), PolicySource.TIER_DEFAULT));
    }

    RateLimitPolicy tierDefault(String tier) {
        return tierDefaults.forTier(tier).orElseGet(tierDefaults::defaultPolicy);
    }
}
