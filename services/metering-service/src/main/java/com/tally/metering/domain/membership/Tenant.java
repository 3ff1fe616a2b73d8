package com.tally.metering.domain.membership;

import java.time.Instant;
import java.time.ZoneId;

/**
 * An isolated organizational account; the unit of quota scope.
 *
 * @param id tenant id
 * @param name display name
 * @param tier pricing tier name (e.g. "free", "pro")
 * @param timeZone zone used for day and month windows, or null for the platform default
 * @param createdAt creation time
 */
public record Tenant(String id, String name, String tier, ZoneId timeZone, Instant createdAt) {

    public Tenant withTier(String newTier) {
        return new Tenant(id, name, newTier, timeZone, createdAt);
    }
}
