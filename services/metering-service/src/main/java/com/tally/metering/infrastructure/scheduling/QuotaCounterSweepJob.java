package com.tally.metering.infrastructure.scheduling;

import com.tally.metering.domain.quota.QuotaService;
import com.tally.observability.CorrelationContext;
import com.tally.observability.CorrelationContextHolder;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically removes quota counters whose windows are past retention. */
@Component
@ConditionalOnProperty(prefix = "tally.metering.sweep", name = "enabled", havingValue = "true")
public class QuotaCounterSweepJob {

    static final String JOB_NAME = "quota-counter-sweep";

    private final QuotaService quotaService;
    private final Clock clock;

    public QuotaCounterSweepJob(QuotaService quotaService, Clock clock) {
        this.quotaService = quotaService;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${tally.metering.sweep.interval-ms:900000}",
            initialDelayString = "${tally.metering.sweep.interval-ms:900000}")
    public void sweep() {
        CorrelationContextHolder.runWithContext(
                CorrelationContext.forJob(JOB_NAME),
                () -> quotaService.evictStaleCounters(clock.instant()));
    }
}
