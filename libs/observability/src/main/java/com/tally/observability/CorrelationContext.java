package com.tally.observability;

import java.util.UUID;

/**
 * Immutable correlation context for one request or one background job run.
 *
 * <p>Every HTTP request and every scheduled sweep establishes a {@code CorrelationContext}. Its
 * values are injected into SLF4J MDC by {@link CorrelationContextHolder} so that log lines carry
 * them without each call site repeating them.
 *
 * @param correlationId ID linking every log line of a business flow (e.g., one usage report)
 * @param tenantId tenant the work is scoped to (nullable for cross-tenant jobs)
 * @param userId caller performing the action (nullable for system work)
 * @param requestId unique ID for this specific request
 */
public record CorrelationContext(
        String correlationId, String tenantId, String userId, String requestId) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** Compact constructor: correlationId is never null. */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** A fresh context for a background job, correlation id prefixed with the job name. */
    public static CorrelationContext forJob(String jobName) {
        String id = jobName + "-" + UUID.randomUUID();
        return new CorrelationContext(id, null, jobName, id);
    }

    /** Copy of this context scoped to a tenant. */
    public CorrelationContext withTenant(String newTenantId) {
        return new CorrelationContext(correlationId, newTenantId, userId, requestId);
    }
}
