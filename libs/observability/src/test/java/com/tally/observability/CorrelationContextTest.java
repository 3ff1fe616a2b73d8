package com.tally.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Test
    @DisplayName("requires a correlation id")
    void requiresCorrelationId() {
        assertThatThrownBy(() -> new CorrelationContext(" ", "t", "u", "r"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }

    @Test
    @DisplayName("withTenant keeps the other identifiers")
    void withTenant() {
        var ctx = new CorrelationContext("c-1", null, "u-1", "r-1").withTenant("t-9");

        assertThat(ctx.tenantId()).isEqualTo("t-9");
        assertThat(ctx.correlationId()).isEqualTo("c-1");
        assertThat(ctx.userId()).isEqualTo("u-1");
    }

    @Test
    @DisplayName("forJob uses the job name as user and correlation prefix")
    void forJob() {
        var ctx = CorrelationContext.forJob("audit-retention");

        assertThat(ctx.userId()).isEqualTo("audit-retention");
        assertThat(ctx.correlationId()).startsWith("audit-retention-");
        assertThat(ctx.tenantId()).isNull();
    }
}
