package com.tally.metering.domain.membership;

/**
 * Request to create a tenant.
 *
 * @param name display name
 * @param tier tier name, or null for the default tier
 * @param timeZone IANA zone id, or null for the platform default
 */
public record NewTenant(String name, String tier, String timeZone) {}
