package com.tally.metering.domain.usage;

import com.tally.metering.domain.alert.BudgetAlert;
import com.tally.metering.domain.alert.BudgetAlertEvaluator;
import com.tally.metering.domain.audit.AuditEvent;
import com.tally.metering.domain.audit.AuditLedger;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.metering.domain.quota.LimitCheck;
import com.tally.metering.domain.quota.QuotaService;
import com.tally.metering.domain.quota.UsageDelta;
import com.tally.metering.domain.quota.UsageTotals;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

/**
 * The usage pipeline: counters, then alerts, then the detail row and the audit entry, as one
 * transaction.
 */
public class UsageMeteringService {

    private static final Logger log = LoggerFactory.getLogger(UsageMeteringService.class);

    private final QuotaService quotaService;
    private final BudgetAlertEvaluator alertEvaluator;
    private final SessionUsageStore sessionUsage;
    private final AuditLedger auditLedger;
    private final MembershipService membershipService;
    private final Clock clock;

    public UsageMeteringService(
            QuotaService quotaService,
            BudgetAlertEvaluator alertEvaluator,
            SessionUsageStore sessionUsage,
            AuditLedger auditLedger,
            MembershipService membershipService,
            Clock clock) {
        this.quotaService = quotaService;
        this.alertEvaluator = alertEvaluator;
        this.sessionUsage = sessionUsage;
        this.auditLedger = auditLedger;
        this.membershipService = membershipService;
        this.clock = clock;
    }

    @Transactional
    public UsageOutcome reportUsage(String tenantId, CallerContext caller, UsageReport report) {
        UsageDelta delta = report.toDelta();
        membershipService.requireRole(tenantId, caller, Role.MEMBER, "report usage");

        UsageTotals totals = quotaService.incrementUsage(tenantId, delta);
        LimitCheck limits = quotaService.evaluate(tenantId, totals);
        List<BudgetAlert> raised = alertEvaluator.evaluate(limits);

        var record =
                new SessionUsageRecord(
                        UUID.randomUUID(),
                        tenantId,
                        caller.userId(),
                        report.conversationRef(),
                        report.sessionType(),
                        report.sessions(),
                        report.tokensInput(),
                        report.tokensOutput(),
                        report.costCents(),
                        report.models(),
                        clock.instant());
        sessionUsage.insert(record);

        var after = new LinkedHashMap<String, Object>();
        after.put("sessions", delta.sessions());
        after.put("tokens", delta.tokens());
        after.put("costCents", delta.costCents());
        after.put("sessionType", report.sessionType().name());
        if (!report.models().isEmpty()) {
            after.put("models", report.models().keySet());
        }
        UUID auditId =
                auditLedger.record(
                        new AuditEvent(
                                tenantId,
                                caller.userId(),
                                "usage:recorded",
                                report.conversationRef() != null
                                        ? "conversation/" + report.conversationRef()
                                        : "session/" + record.id(),
                                "Usage recorded",
                                null,
                                after));
        log.debug(
                "Usage for tenant {}: hour={} day={} monthTokens={} monthCost={}",
                tenantId,
                totals.hourlySessions(),
                totals.dailySessions(),
                totals.monthlyTokens(),
                totals.monthlyCostCents());
        return new UsageOutcome(totals, limits, raised, record.id(), auditId);
    }
}
