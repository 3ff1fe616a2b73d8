package com.tally.metering.domain.billing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tally.eventmodel.ExternalEvent;
import com.tally.metering.domain.audit.AuditEntry;
import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.domain.idempotency.ExternalEventHandler;
import com.tally.metering.domain.idempotency.ProcessingOutcome;
import com.tally.metering.domain.membership.Tenant;
import com.tally.metering.support.MeteringFixture;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BillingEventService")
class BillingEventServiceTest {

    private MeteringFixture fx;
    private Tenant tenant;

    @BeforeEach
    void setUp() {
        fx = new MeteringFixture();
        tenant = fx.tenant("alice");
    }

    private ExternalEvent event(String id, String type, Map<String, String> metadata) {
        return new ExternalEvent(id, type, null, Map.of(), metadata);
    }

    private List<AuditEntry> entries(String actionType) {
        var found = new ArrayList<AuditEntry>();
        fx.auditStore.forEachByTenant(
                tenant.id(),
                entry -> {
                    if (entry.actionType().equals(actionType)) {
                        found.add(entry);
                    }
                });
        return found;
    }

    @Nested
    @DisplayName("subscription events")
    class Subscriptions {

        @Test
        @DisplayName("move the tenant to the purchased tier")
        void checkout() {
            fx.billing.processExternalEvent(
                    event("evt_1", "checkout.session.completed", Map.of("tenant_id", tenant.id(), "tier_id", "pro")));

            assertThat(fx.membership.getTenant(tenant.id()).tier()).isEqualTo("pro");
            assertThat(entries("tenant:tier_changed")).hasSize(1);
            assertThat(entries("billing:checkout.session.completed")).hasSize(1);
        }

        @Test
        @DisplayName("move the tenant back to free when the subscription ends")
        void deleted() {
            fx.membership.changeTier(tenant.id(), "enterprise", "billing-provider");

            fx.billing.processExternalEvent(
                    event("evt_2", "customer.subscription.deleted", Map.of("tenant_id", tenant.id())));

            assertThat(fx.membership.getTenant(tenant.id()).tier()).isEqualTo("free");
        }

        @Test
        @DisplayName("leave the tier alone for an unknown tier")
        void unknownTier() {
            ProcessingOutcome outcome =
                    fx.billing.processExternalEvent(
                            event("evt_3", "customer.subscription.updated", Map.of("tenant_id", tenant.id(), "tier_id", "platinum")));

            assertThat(outcome.alreadyProcessed()).isFalse();
            assertThat(fx.membership.getTenant(tenant.id()).tier()).isEqualTo("free");
        }

        @Test
        @DisplayName("are acknowledged for unknown tenants")
        void unknownTenant() {
            ProcessingOutcome outcome =
                    fx.billing.processExternalEvent(
                            event("evt_4", "checkout.session.completed", Map.of("tenant_id", "ghost", "tier_id", "pro")));

            assertThat(outcome.alreadyProcessed()).isFalse();
        }
    }

    @Nested
    @DisplayName("replay")
    class Replay {

        @Test
        @DisplayName("applies a redelivered event once")
        void once() {
            ExternalEvent paid = event("evt_9", "invoice.paid", Map.of("tenant_id", tenant.id(), "status", "paid"));

            ProcessingOutcome first = fx.billing.processExternalEvent(paid);
            ProcessingOutcome second = fx.billing.processExternalEvent(paid);
            ProcessingOutcome third = fx.billing.processExternalEvent(paid);

            assertThat(first.alreadyProcessed()).isFalse();
            assertThat(second.alreadyProcessed()).isTrue();
            assertThat(third.alreadyProcessed()).isTrue();
            assertThat(entries("billing:invoice.paid")).hasSize(1);
        }

        @Test
        @DisplayName("marks events nobody handles as processed")
        void unhandled() {
            fx.billing.processExternalEvent(event("evt_10", "payment_method.attached", Map.of()));

            assertThat(fx.processedEvents.isProcessed("evt_10")).isTrue();
        }
    }

    @Nested
    @DisplayName("validation and dispatch")
    class Dispatch {

        @Test
        @DisplayName("rejects events without an id")
        void missingId() {
            assertThatThrownBy(() -> fx.billing.processExternalEvent(event(null, "invoice.paid", Map.of())))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("refuses two handlers for one event type")
        void duplicateRegistration() {
            ExternalEventHandler a = stub("invoice.paid");
            ExternalEventHandler b = stub("invoice.paid");

            assertThatThrownBy(() -> new BillingEventService(fx.guard, List.of(a, b), fx.billingAudit))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("maps provider types onto the audit action grammar")
        void actionType() {
            assertThat(BillingAuditHandler.actionType("Invoice.Payment_Failed")).isEqualTo("billing:invoice.payment_failed");
            assertThat(BillingAuditHandler.actionType("a:b")).isEqualTo("billing:a.b");
        }

        private ExternalEventHandler stub(String type) {
            return new ExternalEventHandler() {
                @Override
                public Set<String> eventTypes() {
                    return Set.of(type);
                }

                @Override
                public void handle(ExternalEvent event) {}
            };
        }
    }
}
