package com.tally.metering.domain.alert;

import com.tally.metering.domain.quota.LimitAdvisory;
import com.tally.metering.domain.quota.LimitCheck;
import com.tally.observability.MetricFactory;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns flagged limit advisories into alerts, at most once per tenant, type and period.
 *
 * <p>An exceeded metric raises both its warning and its limit alert: a jump straight past the
 * ceiling still leaves a warning on record for the period.
 */
public class BudgetAlertEvaluator {

    private static final Logger log = LoggerFactory.getLogger(BudgetAlertEvaluator.class);

    private final BudgetAlertStore store;
    private final MetricFactory metrics;
    private final Clock clock;

    public BudgetAlertEvaluator(BudgetAlertStore store, MetricFactory metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Raises alerts for every flagged metric of {@code check}.
     *
     * @return alerts newly created by this call
     */
    public List<BudgetAlert> evaluate(LimitCheck check) {
        var raised = new ArrayList<BudgetAlert>();
        for (LimitAdvisory advisory : check.advisories()) {
            if (advisory.warning() || advisory.exceeded()) {
                raise(check.tenantId(), advisory, advisory.metric().warningAlert()).ifPresent(raised::add);
            }
            if (advisory.exceeded()) {
                raise(check.tenantId(), advisory, advisory.metric().limitAlert()).ifPresent(raised::add);
            }
        }
        return raised;
    }

    private Optional<BudgetAlert> raise(String tenantId, LimitAdvisory advisory, AlertType type) {
        var candidate =
                new BudgetAlert(
                        UUID.randomUUID(),
                        tenantId,
                        type,
                        advisory.windowStart(),
                        advisory.current(),
                        advisory.limit(),
                        clock.instant(),
                        null,
                        null);
        var created = store.insertIfAbsent(candidate);
        created.ifPresent(
                alert -> {
                    metrics.counter("tally.alerts.raised", "Budget alerts raised", "type", type.name())
                            .increment();
                    log.info(
                            "Budget alert {} raised for tenant {}: {}/{} in period {}",
                            type, tenantId, advisory.current(), advisory.limit(), advisory.windowStart());
                });
        return created;
    }
}
