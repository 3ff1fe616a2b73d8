package com.tally.metering.domain.membership;

import com.tally.security.Role;
import java.time.Instant;

/**
 * A person's membership in a tenant.
 *
 * @param tenantId the tenant
 * @param userId the person
 * @param role their role; at most one member per tenant is OWNER
 * @param joinedAt when they joined
 */
public record Member(String tenantId, String userId, Role role, Instant joinedAt) {

    public boolean isOwner() {
        return role == Role.OWNER;
    }
}
