package com.tally.metering.infrastructure.web;

import com.tally.observability.CorrelationContext;
import com.tally.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Establishes the correlation context of every HTTP request.
 *
 * <p>{@code X-Correlation-ID} is propagated when present and generated otherwise, and echoed on
 * the response. {@code X-Tenant-ID} and {@code X-User-ID} are copied into the context so they
 * appear in every log line of the request. The context is cleared afterwards because Tomcat
 * reuses threads.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String TENANT_ID_HEADER = "X-Tenant-ID";
    public static final String USER_ID_HEADER = "X-User-ID";

    static final int MAX_CORRELATION_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank() || correlationId.length() > MAX_CORRELATION_ID_LENGTH) {
            correlationId = UUID.randomUUID().toString();
        }

        var context =
                new CorrelationContext(
                        correlationId,
                        blankToNull(request.getHeader(TENANT_ID_HEADER)),
                        blankToNull(request.getHeader(USER_ID_HEADER)),
                        UUID.randomUUID().toString());
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
