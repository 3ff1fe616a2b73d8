package com.tally.metering.api.dto;

import com.tally.metering.domain.membership.Tenant;
import java.time.Instant;

public record TenantResponse(String id, String name, String tier, String timeZone, Instant createdAt) {

    public static TenantResponse from(Tenant tenant) {
        return new TenantResponse(
                tenant.id(),
                tenant.name(),
                tenant.tier(),
                tenant.timeZone() == null ? null : tenant.timeZone().getId(),
                tenant.createdAt());
    }
}
