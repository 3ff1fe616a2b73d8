package com.tally.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 *
 * <p>When a correlation context is set, the MDC keys (correlationId, tenantId, userId, requestId)
 * are populated so that every log statement on this thread includes them. When cleared, the keys
 * are removed. Work handed to another thread must carry its context explicitly, for example via
 * {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's correlation context, if set. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /** Returns the current correlation id, if a context is set. */
    public static Optional<String> currentCorrelationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /** Clears the correlation context and removes its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    /**
     * Executes a {@link Runnable} with the given correlation context set, then restores the
     * previous context (or clears if there was none).
     *
     * @param context the correlation context for the duration of the runnable
     * @param runnable the work to execute
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_USER_ID, ctx.userId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
