package com.tally.metering.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tally.observability.CorrelationContext;
import com.tally.observability.CorrelationContextHolder;
import com.tally.security.ActorType;
import com.tally.security.CallerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

@DisplayName("CallerContextArgumentResolver")
class CallerContextArgumentResolverTest {

    private final CallerContextArgumentResolver resolver = new CallerContextArgumentResolver();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private CallerContext resolve(MockHttpServletRequest request) {
        return resolver.resolveArgument(null, null, new ServletWebRequest(request), null);
    }

    @Test
    @DisplayName("builds a user caller with the claimed tenant and the request correlation ID")
    void userCaller() {
        CorrelationContextHolder.set(new CorrelationContext("corr-9", null, null, "req-9"));
        var request = new MockHttpServletRequest();
        request.addHeader("X-User-ID", " alice ");
        request.addHeader("X-Tenant-ID", "t-1");

        CallerContext caller = resolve(request);

        assertThat(caller.userId()).isEqualTo("alice");
        assertThat(caller.tenantId()).isEqualTo("t-1");
        assertThat(caller.actorType()).isEqualTo(ActorType.USER);
        assertThat(caller.correlationId()).isEqualTo("corr-9");
    }

    @Test
    @DisplayName("leaves the tenant claim empty when the header is absent")
    void noTenantClaim() {
        var request = new MockHttpServletRequest();
        request.addHeader("X-User-ID", "alice");

        assertThat(resolve(request).tenantId()).isNull();
    }

    @Test
    @DisplayName("recognizes API callers")
    void apiCaller() {
        var request = new MockHttpServletRequest();
        request.addHeader("X-User-ID", "key-1");
        request.addHeader("X-Actor-Type", "API");

        assertThat(resolve(request).actorType()).isEqualTo(ActorType.API);
    }

    @Test
    @DisplayName("never grants system privileges from a header")
    void noSystemOverHttp() {
        var request = new MockHttpServletRequest();
        request.addHeader("X-User-ID", "intruder");
        request.addHeader("X-Actor-Type", "system");

        CallerContext caller = resolve(request);

        assertThat(caller.isSystem()).isFalse();
        assertThat(caller.actorType()).isEqualTo(ActorType.USER);
    }

    @Test
    @DisplayName("rejects requests without a user")
    void missingUser() {
        assertThatThrownBy(() -> resolve(new MockHttpServletRequest()))
                .isInstanceOf(MissingCallerIdentityException.class)
                .hasMessageContaining("X-User-ID");
    }

    @Test
    @DisplayName("rejects oversized user ids")
    void oversizedUser() {
        var request = new MockHttpServletRequest();
        request.addHeader("X-User-ID", "u".repeat(129));

        assertThatThrownBy(() -> resolve(request)).isInstanceOf(MissingCallerIdentityException.class);
    }
}
