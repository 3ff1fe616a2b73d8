package com.tally.metering.infrastructure.scheduling;

import com.tally.metering.domain.audit.AuditLedger;
import com.tally.observability.CorrelationContext;
import com.tally.observability.CorrelationContextHolder;
import com.tally.security.CallerContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Runs the privileged audit retention purge as a system caller. */
@Component
@ConditionalOnProperty(prefix = "tally.audit.purge", name = "enabled", havingValue = "true")
public class AuditRetentionPurgeJob {

    static final String JOB_NAME = "audit-retention-purge";

    private final AuditLedger auditLedger;

    public AuditRetentionPurgeJob(AuditLedger auditLedger) {
        this.auditLedger = auditLedger;
    }

    @Scheduled(
            fixedDelayString = "${tally.audit.purge.interval-ms:86400000}",
            initialDelayString = "${tally.audit.purge.interval-ms:86400000}")
    public void purge() {
        CorrelationContextHolder.runWithContext(
                CorrelationContext.forJob(JOB_NAME),
                () -> auditLedger.purgeExpired(CallerContext.system(JOB_NAME)));
    }
}
