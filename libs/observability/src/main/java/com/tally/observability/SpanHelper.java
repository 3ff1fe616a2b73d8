package com.tally.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs work inside an OpenTelemetry span tagged with the current correlation context.
 *
 * <p>Only the API is used here. Without an SDK or agent configured the tracer is a no-op and
 * spans cost nothing.
 */
public final class SpanHelper {

    static final String ATTR_CORRELATION_ID = "correlation.id";
    static final String ATTR_TENANT_ID = "tenant.id";
    static final String ATTR_USER_ID = "user.id";

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} in a new internal span. A runtime exception marks the span as failed and
     * is rethrown unchanged.
     *
     * @param name span name, e.g. {@code usage.report}
     * @param attributes extra span attributes
     */
    public <T> T inSpan(String name, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(name).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();
        CorrelationContextHolder.get()
                .ifPresent(
                        ctx -> {
                            span.setAttribute(ATTR_CORRELATION_ID, ctx.correlationId());
                            if (ctx.tenantId() != null) {
                                span.setAttribute(ATTR_TENANT_ID, ctx.tenantId());
                            }
                            if (ctx.userId() != null) {
                                span.setAttribute(ATTR_USER_ID, ctx.userId());
                            }
                        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public void inSpan(String name, Map<String, String> attributes, Runnable work) {
        inSpan(
                name,
                attributes,
                () -> {
                    work.run();
                    return null;
                });
    }
}
