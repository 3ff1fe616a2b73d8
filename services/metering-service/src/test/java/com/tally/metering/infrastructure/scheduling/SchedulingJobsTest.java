package com.tally.metering.infrastructure.scheduling;

import static org.assertj.core.api.Assertions.assertThat;

import com.tally.metering.domain.audit.AuditEvent;
import com.tally.metering.domain.membership.Tenant;
import com.tally.metering.domain.quota.UsageDelta;
import com.tally.metering.support.MeteringFixture;
import com.tally.observability.CorrelationContextHolder;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Scheduled jobs")
class SchedulingJobsTest {

    private final MeteringFixture fx = new MeteringFixture();

    @Test
    @DisplayName("counter sweep removes expired windows and leaves no context behind")
    void counterSweep() {
        Tenant tenant = fx.tenant("alice");
        fx.clock.set(Instant.parse("2025-10-10T00:00:00Z"));
        fx.quota.incrementUsage(tenant.id(), new UsageDelta(1, 1, 1));
        fx.clock.advance(Duration.ofDays(160));

        new QuotaCounterSweepJob(fx.quota, fx.clock).sweep();

        var evictedMonths =
                fx.registry.find("tally.quota.counters.evicted").tag("window", "MONTH").counter();
        assertThat(evictedMonths).isNotNull();
        assertThat(evictedMonths.count()).isEqualTo(1.0);
        assertThat(CorrelationContextHolder.get()).isEmpty();
    }

    @Test
    @DisplayName("audit purge runs with system privileges")
    void auditPurge() {
        fx.auditLedger.record(
                new AuditEvent("t-1", "alice", "policy:updated", "tenant/t-1", "old", Map.of(), Map.of()));
        fx.clock.advance(Duration.ofDays(2600));

        new AuditRetentionPurgeJob(fx.auditLedger).purge();

        assertThat(fx.auditLedger.verifyTenantLedger("t-1").total()).isZero();
        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
