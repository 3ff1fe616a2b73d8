package com.tally.metering.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tally.metering.domain.alert.BudgetAlertEvaluator;
import com.tally.metering.domain.alert.BudgetAlertService;
import com.tally.metering.domain.alert.BudgetAlertStore;
import com.tally.metering.domain.audit.AuditActionTypes;
import com.tally.metering.domain.audit.AuditLedger;
import com.tally.metering.domain.audit.AuditLedgerStore;
import com.tally.metering.domain.billing.BillingAuditHandler;
import com.tally.metering.domain.billing.BillingEventService;
import com.tally.metering.domain.billing.SubscriptionTierHandler;
import com.tally.metering.domain.idempotency.ExternalEventGuard;
import com.tally.metering.domain.idempotency.ExternalEventHandler;
import com.tally.metering.domain.idempotency.ProcessedEventStore;
import com.tally.metering.domain.membership.InvitationService;
import com.tally.metering.domain.membership.InvitationStore;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.metering.domain.membership.MembershipStore;
import com.tally.metering.domain.quota.QuotaCounterStore;
import com.tally.metering.domain.quota.QuotaService;
import com.tally.metering.domain.quota.RateLimitPolicyResolver;
import com.tally.metering.domain.quota.RateLimitPolicyService;
import com.tally.metering.domain.quota.RateLimitPolicyStore;
import com.tally.metering.domain.quota.TierDefaults;
import com.tally.metering.domain.usage.SessionUsageStore;
import com.tally.metering.domain.usage.UsageAnalyticsService;
import com.tally.metering.domain.usage.UsageMeteringService;
import com.tally.observability.MetricFactory;
import com.tally.observability.SensitiveDataRedactor;
import com.tally.observability.SpanHelper;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the domain services. They are plain classes with constructor dependencies; storage
 * ports come from {@link JdbcStorageConfig} or {@link MemoryStorageConfig}.
 */
@Configuration(proxyBeanMethods = false)
public class DomainConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    /** Backed by whatever SDK or agent registered globally; a no-op tracer otherwise. */
    @Bean
    public SpanHelper spanHelper(ServiceProperties service) {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(service.name()));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public TierDefaults tierDefaults(MeteringProperties metering) {
        return metering.toTierDefaults();
    }

    @Bean
    public AuditLedger auditLedger(
            AuditLedgerStore store,
            AuditProperties audit,
            SensitiveDataRedactor redactor,
            ObjectMapper objectMapper,
            MetricFactory metrics,
            Clock clock) {
        return new AuditLedger(
                store,
                new AuditActionTypes(audit.allowedNamespaces()),
                redactor,
                objectMapper,
                metrics,
                clock,
                audit.retention());
    }

    @Bean
    public MembershipService membershipService(
            MembershipStore store, AuditLedger auditLedger, TierDefaults tierDefaults, MeteringProperties metering, Clock clock) {
        return new MembershipService(store, auditLedger, tierDefaults, metering.defaultZone(), clock);
    }

    @Bean
    public InvitationService invitationService(
            InvitationStore invitations,
            MembershipStore members,
            MembershipService membershipService,
            AuditLedger auditLedger,
            MembershipProperties membership,
            Clock clock) {
        return new InvitationService(
                invitations,
                members,
                membershipService,
                auditLedger,
                clock,
                membership.invitationTtl(),
                membership.maxInvitationTtl());
    }

    @Bean
    public RateLimitPolicyResolver rateLimitPolicyResolver(RateLimitPolicyStore store, TierDefaults tierDefaults) {
        return new RateLimitPolicyResolver(store, tierDefaults);
    }

    @Bean
    public QuotaService quotaService(
            QuotaCounterStore counters,
            RateLimitPolicyResolver resolver,
            MembershipService membershipService,
            MeteringProperties metering,
            MetricFactory metrics,
            Clock clock) {
        return new QuotaService(
                counters, resolver, membershipService, metering.retention().toCounterRetention(), metrics, clock);
    }

    @Bean
    public RateLimitPolicyService rateLimitPolicyService(
            RateLimitPolicyStore store,
            RateLimitPolicyResolver resolver,
            QuotaService quotaService,
            BudgetAlertEvaluator alertEvaluator,
            MembershipService membershipService,
            AuditLedger auditLedger,
            Clock clock) {
        return new RateLimitPolicyService(
                store, resolver, quotaService, alertEvaluator, membershipService, auditLedger, clock);
    }

    @Bean
    public BudgetAlertEvaluator budgetAlertEvaluator(BudgetAlertStore store, MetricFactory metrics, Clock clock) {
        return new BudgetAlertEvaluator(store, metrics, clock);
    }

    @Bean
    public BudgetAlertService budgetAlertService(
            BudgetAlertStore store, MembershipService membershipService, Clock clock) {
        return new BudgetAlertService(store, membershipService, clock);
    }

    @Bean
    public ExternalEventGuard externalEventGuard(ProcessedEventStore store, MetricFactory metrics, Clock clock) {
        return new ExternalEventGuard(store, metrics, clock);
    }

    @Bean
    public BillingAuditHandler billingAuditHandler(AuditLedger auditLedger) {
        return new BillingAuditHandler(auditLedger);
    }

    @Bean
    public SubscriptionTierHandler subscriptionTierHandler(
            MembershipService membershipService, TierDefaults tierDefaults, BillingAuditHandler auditHandler) {
        return new SubscriptionTierHandler(membershipService, tierDefaults, auditHandler);
    }

    @Bean
    public BillingEventService billingEventService(
            ExternalEventGuard guard, List<ExternalEventHandler> handlers, BillingAuditHandler fallback) {
        return new BillingEventService(guard, handlers, fallback);
    }

    @Bean
    public UsageMeteringService usageMeteringService(
            QuotaService quotaService,
            BudgetAlertEvaluator alertEvaluator,
            SessionUsageStore sessionUsage,
            AuditLedger auditLedger,
            MembershipService membershipService,
            Clock clock) {
        return new UsageMeteringService(quotaService, alertEvaluator, sessionUsage, auditLedger, membershipService, clock);
    }

    @Bean
    public UsageAnalyticsService usageAnalyticsService(
            SessionUsageStore sessionUsage, QuotaService quotaService, MembershipService membershipService, Clock clock) {
        return new UsageAnalyticsService(sessionUsage, quotaService, membershipService, clock);
    }
}
