package com.tally.metering.domain.billing;

import com.tally.eventmodel.ExternalEvent;
import com.tally.metering.domain.audit.AuditEvent;
import com.tally.metering.domain.audit.AuditLedger;
import com.tally.metering.domain.idempotency.ExternalEventHandler;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback handler: records a {@code billing:<type>} audit entry for events that name a tenant.
 * Events without a tenant are only logged.
 */
public class BillingAuditHandler implements ExternalEventHandler {

    private static final Logger log = LoggerFactory.getLogger(BillingAuditHandler.class);

    static final String BILLING_ACTOR = "billing-provider";

    private final AuditLedger auditLedger;

    public BillingAuditHandler(AuditLedger auditLedger) {
        this.auditLedger = auditLedger;
    }

    @Override
    public Set<String> eventTypes() {
        return Set.of();
    }

    @Override
    public void handle(ExternalEvent event) {
        var tenantId = event.tenantId();
        if (tenantId.isEmpty()) {
            log.info("Billing event {} ({}) names no tenant; nothing to record", event.eventId(), event.eventType());
            return;
        }
        var details = new LinkedHashMap<String, Object>();
        details.put("eventId", event.eventId());
        event.metadataValue("status").ifPresent(status -> details.put("status", status));
        auditLedger.record(
                new AuditEvent(
                        tenantId.get(),
                        BILLING_ACTOR,
                        actionType(event.eventType()),
                        "billing-event/" + event.eventId(),
                        "Billing event " + event.eventType(),
                        null,
                        details));
    }

    /** Maps a provider event type onto the audit action grammar. */
    static String actionType(String eventType) {
        return "billing:" + eventType.toLowerCase(Locale.ROOT).replace(':', '.');
    }
}
