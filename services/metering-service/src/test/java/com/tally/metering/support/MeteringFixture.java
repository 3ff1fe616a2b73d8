package com.tally.metering.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tally.metering.config.MeteringProperties;
import com.tally.metering.domain.alert.BudgetAlertEvaluator;
import com.tally.metering.domain.alert.BudgetAlertService;
import com.tally.metering.domain.audit.AuditActionTypes;
import com.tally.metering.domain.audit.AuditLedger;
import com.tally.metering.domain.billing.BillingAuditHandler;
import com.tally.metering.domain.billing.BillingEventService;
import com.tally.metering.domain.billing.SubscriptionTierHandler;
import com.tally.metering.domain.idempotency.ExternalEventGuard;
import com.tally.metering.domain.membership.InvitationService;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.metering.domain.membership.NewTenant;
import com.tally.metering.domain.membership.Tenant;
import com.tally.metering.domain.quota.CounterRetention;
import com.tally.metering.domain.quota.QuotaService;
import com.tally.metering.domain.quota.RateLimitPolicyResolver;
import com.tally.metering.domain.quota.RateLimitPolicyService;
import com.tally.metering.domain.quota.TierDefaults;
import com.tally.metering.domain.usage.UsageAnalyticsService;
import com.tally.metering.domain.usage.UsageMeteringService;
import com.tally.metering.infrastructure.persistence.memory.InMemoryAuditLedgerStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryBudgetAlertStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryInvitationStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryMembershipStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryProcessedEventStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryQuotaCounterStore;
import com.tally.metering.infrastructure.persistence.memory.InMemoryRateLimitPolicyStore;
import com.tally.metering.infrastructure.persistence.memory.InMemorySessionUsageStore;
import com.tally.observability.MetricFactory;
import com.tally.observability.SensitiveDataRedactor;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import com.tally.security.testing.TestCallers;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

/**
 * The domain services wired over in-memory stores, the way {@code DomainConfig} wires them in
 * the application.
 */
public final class MeteringFixture {

    public static final Set<String> NAMESPACES =
            Set.of("usage", "policy", "alert", "member", "tenant", "billing", "internal");

    public final MutableClock clock;
    public final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    public final MetricFactory metrics;
    public final TierDefaults tiers;

    public final InMemoryMembershipStore membershipStore = new InMemoryMembershipStore();
    public final InMemoryInvitationStore invitationStore = new InMemoryInvitationStore();
    public final InMemoryQuotaCounterStore counterStore = new InMemoryQuotaCounterStore();
    public final InMemoryRateLimitPolicyStore policyStore = new InMemoryRateLimitPolicyStore();
    public final InMemoryBudgetAlertStore alertStore = new InMemoryBudgetAlertStore();
    public final InMemoryProcessedEventStore processedEvents = new InMemoryProcessedEventStore();
    public final InMemorySessionUsageStore sessionUsage = new InMemorySessionUsageStore();
    public final InMemoryAuditLedgerStore auditStore;

    public final AuditLedger auditLedger;
    public final MembershipService membership;
    public final InvitationService invitations;
    public final RateLimitPolicyResolver resolver;
    public final QuotaService quota;
    public final RateLimitPolicyService policies;
    public final BudgetAlertEvaluator alertEvaluator;
    public final BudgetAlertService alerts;
    public final ExternalEventGuard guard;
    public final BillingAuditHandler billingAudit;
    public final BillingEventService billing;
    public final UsageMeteringService usage;
    public final UsageAnalyticsService analytics;

    public MeteringFixture() {
        this(MutableClock.at("2026-03-15T10:30:00Z"), new InMemoryAuditLedgerStore());
    }

    public MeteringFixture(MutableClock clock) {
        this(clock, new InMemoryAuditLedgerStore());
    }

    public MeteringFixture(MutableClock clock, InMemoryAuditLedgerStore auditStore) {
        this.clock = clock;
        this.auditStore = auditStore;
        this.metrics = new MetricFactory(registry, "metering-service-test");
        this.tiers = new MeteringProperties(null, null, null, null, null).toTierDefaults();

        auditLedger =
                new AuditLedger(
                        auditStore,
                        new AuditActionTypes(NAMESPACES),
                        new SensitiveDataRedactor(),
                        new ObjectMapper(),
                        metrics,
                        clock,
                        Duration.ofDays(2555));
        membership = new MembershipService(membershipStore, auditLedger, tiers, ZoneOffset.UTC, clock);
        invitations =
                new InvitationService(
                        invitationStore,
                        membershipStore,
                        membership,
                        auditLedger,
                        clock,
                        Duration.ofDays(7),
                        Duration.ofDays(30));
        resolver = new RateLimitPolicyResolver(policyStore, tiers);
        quota = new QuotaService(counterStore, resolver, membership, CounterRetention.DEFAULT, metrics, clock);
        alertEvaluator = new BudgetAlertEvaluator(alertStore, metrics, clock);
        policies =
                new RateLimitPolicyService(
                        policyStore, resolver, quota, alertEvaluator, membership, auditLedger, clock);
        alerts = new BudgetAlertService(alertStore, membership, clock);
        guard = new ExternalEventGuard(processedEvents, metrics, clock);
        billingAudit = new BillingAuditHandler(auditLedger);
        billing =
                new BillingEventService(
                        guard,
                        List.of(billingAudit, new SubscriptionTierHandler(membership, tiers, billingAudit)),
                        billingAudit);
        usage = new UsageMeteringService(quota, alertEvaluator, sessionUsage, auditLedger, membership, clock);
        analytics = new UsageAnalyticsService(sessionUsage, quota, membership, clock);
    }

    /** Creates a tenant owned by {@code ownerId}. */
    public Tenant tenant(String ownerId) {
        return tenant(ownerId, "free", null);
    }

    public Tenant tenant(String ownerId, String tier, String timeZone) {
        return membership.createTenant(TestCallers.user(ownerId), new NewTenant("Acme " + ownerId, tier, timeZone));
    }

    /** Adds {@code userId} to the tenant through an invitation issued by the owner. */
    public void join(Tenant tenant, String ownerId, String userId, Role role) {
        var invitation =
                invitations.createInvitation(
                        tenant.id(), TestCallers.user(ownerId), userId + "@example.com", role, null);
        invitations.acceptInvitation(invitation.token(), TestCallers.user(userId));
    }

    public static CallerContext user(String userId) {
        return TestCallers.user(userId);
    }

    public double counter(String name) {
        var counter = registry.find(name).counter();
        return counter == null ? 0 : counter.count();
    }
}
