package com.tally.metering.domain.billing;

import com.tally.eventmodel.ExternalEvent;
import com.tally.metering.domain.idempotency.ExternalEventHandler;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.metering.domain.quota.TierDefaults;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps a tenant's tier in step with its subscription.
 *
 * <ul>
 *   <li>{@code checkout.session.completed} and {@code customer.subscription.updated} move the
 *       tenant to the tier named by the {@code tier_id} metadata
 *   <li>{@code customer.subscription.deleted} moves it back to the free tier
 * </ul>
 */
public class SubscriptionTierHandler implements ExternalEventHandler {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionTierHandler.class);

    static final String CHECKOUT_COMPLETED = "checkout.session.completed";
    static final String SUBSCRIPTION_UPDATED = "customer.subscription.updated";
    static final String SUBSCRIPTION_DELETED = "customer.subscription.deleted";
    static final String TIER_KEY = "tier_id";
    static final String FREE_TIER = "free";

    private final MembershipService membershipService;
    private final TierDefaults tierDefaults;
    private final BillingAuditHandler auditHandler;

    public SubscriptionTierHandler(
            MembershipService membershipService, TierDefaults tierDefaults, BillingAuditHandler auditHandler) {
        this.membershipService = membershipService;
        this.tierDefaults = tierDefaults;
        this.auditHandler = auditHandler;
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of(CHECKOUT_COMPLETED, SUBSCRIPTION_UPDATED, SUBSCRIPTION_DELETED);
    }

    @Override
    public void handle(ExternalEvent event) {
        auditHandler.handle(event);
        Optional<String> tenantId = event.tenantId();
        if (tenantId.isEmpty()) {
            return;
        }
        if (membershipService.findTenant(tenantId.get()).isEmpty()) {
            log.warn("Event {} names unknown tenant {}; tier unchanged", event.eventId(), tenantId.get());
            return;
        }
        Optional<String> tier =
                SUBSCRIPTION_DELETED.equals(event.eventType())
                        ? Optional.of(FREE_TIER)
                        : event.metadataValue(TIER_KEY);
        if (tier.isEmpty()) {
            log.info("Event {} carries no tier for tenant {}", event.eventId(), tenantId.get());
            return;
        }
        if (tierDefaults.forTier(tier.get()).isEmpty() && !MembershipService.CUSTOM_TIER.equals(tier.get())) {
            // acknowledged anyway: a redelivery would carry the same unknown tier
            log.warn("Event {} names unknown tier '{}' for tenant {}; tier unchanged", event.eventId(), tier.get(), tenantId.get());
            return;
        }
        membershipService.changeTier(tenantId.get(), tier.get(), BillingAuditHandler.BILLING_ACTOR);
    }
}
