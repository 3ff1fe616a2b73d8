/**
 * Logging correlation, metrics, tracing and redaction shared by Tally services.
 *
 * <ul>
 *   <li>{@link com.tally.observability.CorrelationContextHolder} bridges request identity into
 *       SLF4J MDC
 *   <li>{@link com.tally.observability.MetricFactory} creates Micrometer meters with a service tag
 *   <li>{@link com.tally.observability.SpanHelper} wraps work in OpenTelemetry spans
 *   <li>{@link com.tally.observability.SensitiveDataRedactor} scrubs secrets from structured values
 * </ul>
 */
package com.tally.observability;
