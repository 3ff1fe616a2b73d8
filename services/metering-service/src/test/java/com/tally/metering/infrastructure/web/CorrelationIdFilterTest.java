package com.tally.metering.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.tally.observability.CorrelationContext;
import com.tally.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates a correlation ID when none is provided")
    void generatesCorrelationId() throws Exception {
        var response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest(), response, (req, resp) -> {});

        assertThat(response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("propagates the caller's correlation ID")
    void propagatesCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("replaces an oversized correlation ID")
    void replacesOversizedId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "x".repeat(CorrelationIdFilter.MAX_CORRELATION_ID_LENGTH + 1));
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID"))
                .hasSizeLessThanOrEqualTo(CorrelationIdFilter.MAX_CORRELATION_ID_LENGTH);
    }

    @Test
    @DisplayName("exposes tenant and user headers to the chain")
    void exposesTenantAndUser() throws Exception {
        var captured = new AtomicReference<CorrelationContext>();
        FilterChain capturing = (req, resp) -> captured.set(CorrelationContextHolder.get().orElse(null));
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain-123");
        request.addHeader("X-Tenant-ID", " t-1 ");
        request.addHeader("X-User-ID", "alice");

        filter.doFilter(request, new MockHttpServletResponse(), capturing);

        assertThat(captured.get().correlationId()).isEqualTo("during-chain-123");
        assertThat(captured.get().tenantId()).isEqualTo("t-1");
        assertThat(captured.get().userId()).isEqualTo("alice");
    }

    @Test
    @DisplayName("clears the context after the request")
    void clearsContext() throws Exception {
        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), (req, resp) -> {});

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
