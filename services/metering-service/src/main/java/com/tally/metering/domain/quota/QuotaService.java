package com.tally.metering.domain.quota;

import com.tally.metering.domain.membership.MembershipService;
import com.tally.metering.domain.membership.Tenant;
import com.tally.metering.domain.window.WindowCalculator;
import com.tally.metering.domain.window.WindowKeys;
import com.tally.metering.domain.window.WindowType;
import com.tally.observability.MetricFactory;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Increments window counters and evaluates them against the tenant's effective policy.
 *
 * <p>Evaluation is advisory. Nothing here refuses usage; callers get {@link LimitAdvisory}
 * flags and decide what to do with them.
 */
public class QuotaService {

    private static final Logger log = LoggerFactory.getLogger(QuotaService.class);

    private final QuotaCounterStore counters;
    private final RateLimitPolicyResolver policyResolver;
    private final MembershipService membershipService;
    private final CounterRetention retention;
    private final MetricFactory metrics;
    private final Clock clock;

    public QuotaService(
            QuotaCounterStore counters,
            RateLimitPolicyResolver policyResolver,
            MembershipService membershipService,
            CounterRetention retention,
            MetricFactory metrics,
            Clock clock) {
        this.counters = counters;
        this.policyResolver = policyResolver;
        this.membershipService = membershipService;
        this.retention = retention;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Adds usage to the tenant's current hour, day and month counters.
     *
     * @return totals of the three windows after the increment
     */
    public UsageTotals incrementUsage(String tenantId, UsageDelta delta) {
        Tenant tenant = membershipService.getTenant(tenantId);
        WindowKeys windows = WindowCalculator.keysFor(clock.instant(), membershipService.zoneOf(tenant));
        UsageTotals totals = counters.increment(tenantId, windows, delta);
        metrics.counter("tally.usage.sessions", "Sessions metered").increment(delta.sessions());
        metrics.counter("tally.usage.tokens", "Tokens metered").increment(delta.tokens());
        metrics.counter("tally.usage.cost.cents", "Cost metered in minor units").increment(delta.costCents());
        return totals;
    }

    /** Reads the current counters and evaluates them. */
    public LimitCheck checkLimits(String tenantId) {
        return evaluate(tenantId, currentCounters(tenantId));
    }

    /** Evaluates totals that were just produced, without reading them again. */
    public LimitCheck evaluate(String tenantId, UsageTotals totals) {
        Tenant tenant = membershipService.getTenant(tenantId);
        EffectivePolicy effective = policyResolver.resolve(tenant);
        RateLimitPolicy policy = effective.policy();
        var advisories = new ArrayList<LimitAdvisory>();
        for (Metric metric : Metric.values()) {
            long current = metric.currentValue(totals);
            long limit = policy.limitFor(metric);
            advisories.add(
                    new LimitAdvisory(
                            metric,
                            current,
                            limit,
                            current >= limit,
                            current >= policy.warningThresholdFor(metric),
                            totals.windows().start(metric.window())));
        }
        LimitCheck check = new LimitCheck(tenantId, effective, totals, advisories);
        if (!check.exceeded().isEmpty()) {
            log.warn("Tenant {} exceeded {}", tenantId, check.exceeded());
        } else if (!check.warnings().isEmpty()) {
            log.warn("Tenant {} approaching limits on {}", tenantId, check.warnings());
        }
        return check;
    }

    public UsageTotals currentCounters(String tenantId) {
        Tenant tenant = membershipService.getTenant(tenantId);
        return counters.read(tenantId, WindowCalculator.keysFor(clock.instant(), membershipService.zoneOf(tenant)));
    }

    /**
     * Removes counters whose windows are past retention. Current windows are never touched.
     *
     * @return number of counters removed per window type
     */
    public Map<WindowType, Integer> evictStaleCounters(Instant now) {
        var removed = new EnumMap<WindowType, Integer>(WindowType.class);
        for (WindowType type : WindowType.values()) {
            int count = counters.evictOlderThan(type, retention.cutoff(type, now));
            removed.put(type, count);
            metrics.counter("tally.quota.counters.evicted", "Stale quota counters removed", "window", type.name())
                    .increment(count);
        }
        log.info("Quota counter sweep removed {}", removed);
        return removed;
    }
}
