package com.tally.metering.domain.quota;

import com.tally.metering.domain.alert.BudgetAlertEvaluator;
import com.tally.metering.domain.audit.AuditEvent;
import com.tally.metering.domain.audit.AuditLedger;
import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owner-managed rate limit overrides and the limit readouts. Every readout feeds the alert
 * evaluator, so a ceiling lowered below current usage raises its alerts on the next read.
 */
public class RateLimitPolicyService {

    private static final Logger log = LoggerFactory.getLogger(RateLimitPolicyService.class);

    private final RateLimitPolicyStore store;
    private final RateLimitPolicyResolver resolver;
    private final QuotaService quotaService;
    private final BudgetAlertEvaluator alertEvaluator;
    private final MembershipService membershipService;
    private final AuditLedger auditLedger;
    private final Clock clock;

    public RateLimitPolicyService(
            RateLimitPolicyStore store,
            RateLimitPolicyResolver resolver,
            QuotaService quotaService,
            BudgetAlertEvaluator alertEvaluator,
            MembershipService membershipService,
            AuditLedger auditLedger,
            Clock clock) {
        this.store = store;
        this.resolver = resolver;
        this.quotaService = quotaService;
        this.alertEvaluator = alertEvaluator;
        this.membershipService = membershipService;
        this.auditLedger = auditLedger;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public EffectivePolicy effectivePolicy(String tenantId, CallerContext caller) {
        membershipService.requireRole(tenantId, caller, Role.MEMBER, "read rate limits");
        return resolver.resolve(membershipService.getTenant(tenantId));
    }

    /**
     * Merges a partial update over the effective policy and stores it as the tenant's override.
     *
     * @throws ValidationException if the update is empty or the merged policy is invalid
     */
    @Transactional
    public EffectivePolicy updatePolicy(String tenantId, CallerContext caller, PolicyUpdate update) {
        if (update == null || update.isEmpty()) {
            throw new ValidationException("at least one limit must be provided");
        }
        membershipService.requireRole(tenantId, caller, Role.OWNER, "update rate limits");
        EffectivePolicy before = resolver.resolve(membershipService.getTenant(tenantId));
        RateLimitPolicy merged = update.mergeOver(before.policy());
        List<String> violations = merged.violations();
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        store.save(tenantId, merged, caller.userId(), clock.instant());
        auditLedger.record(
                new AuditEvent(
                        tenantId,
                        caller.userId(),
                        "policy:updated",
                        "rate-limits/" + tenantId,
                        "Rate limits updated",
                        describe(before.policy()),
                        describe(merged)));
        log.info("Rate limits of tenant {} updated by {}: {}", tenantId, caller.userId(), merged);
        return new EffectivePolicy(merged, before.tier(), PolicySource.TENANT_OVERRIDE);
    }

    /** Advisory flags for every metric. Raises alerts for flagged metrics; never blocks. */
    @Transactional
    public LimitCheck checkLimits(String tenantId, CallerContext caller) {
        membershipService.requireRole(tenantId, caller, Role.MEMBER, "check limits");
        return checkAndAlert(tenantId);
    }

    @Transactional
    public LimitStatus getLimitStatus(String tenantId, CallerContext caller) {
        membershipService.requireRole(tenantId, caller, Role.ADMIN, "read limit status");
        return LimitStatus.from(checkAndAlert(tenantId));
    }

    private LimitCheck checkAndAlert(String tenantId) {
        LimitCheck check = quotaService.checkLimits(tenantId);
        int raised = alertEvaluator.evaluate(check).size();
        if (raised > 0) {
            log.debug("Limit check of tenant {} raised {} alerts", tenantId, raised);
        }
        return check;
    }

    private static Map<String, Object> describe(RateLimitPolicy policy) {
        var values = new LinkedHashMap<String, Object>();
        values.put("sessionsPerHour", policy.sessionsPerHour());
        values.put("sessionsPerDay", policy.sessionsPerDay());
        values.put("tokensPerMonth", policy.tokensPerMonth());
        values.put("budgetCentsPerMonth", policy.budgetCentsPerMonth());
        values.put("alertThresholdPercent", policy.alertThresholdPercent());
        return values;
    }
}
