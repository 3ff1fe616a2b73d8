package com.tally.security;

import java.util.UUID;

/**
 * Identity of whoever invokes a tenant-scoped operation.
 *
 * <p>Passed as an explicit parameter to every service method that needs to know the caller. The
 * tenant role is not part of the context: it is looked up from membership for the tenant being
 * addressed, so a stale context can never carry a stale role.
 *
 * @param userId caller id (a user id, or a job name for {@link ActorType#SYSTEM})
 * @param tenantId the tenant the caller claims to act for, or null when unscoped
 * @param actorType kind of caller
 * @param correlationId trace correlation ID for this request
 */
public record CallerContext(
        String userId, String tenantId, ActorType actorType, String correlationId) {

    public CallerContext {
        if (actorType == null) {
            actorType = ActorType.USER;
        }
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
    }

    /** A user caller not bound to a tenant claim. */
    public static CallerContext user(String userId) {
        return new CallerContext(userId, null, ActorType.USER, null);
    }

    /** A background job acting with system privileges. */
    public static CallerContext system(String jobName) {
        return new CallerContext(jobName, null, ActorType.SYSTEM, null);
    }

    /** Whether this caller may use privileged maintenance paths. */
    public boolean isSystem() {
        return actorType == ActorType.SYSTEM;
    }
}
