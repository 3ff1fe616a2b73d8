package com.tally.metering.domain.quota;

/**
 * The policy that applies to a tenant right now.
 *
 * @param policy the ceilings
 * @param tier the tenant's tier name
 * @param source whether a tenant override or the tier default supplied the ceilings
 */
public record EffectivePolicy(RateLimitPolicy policy, String tier, PolicySource source) {}
