package com.tally.metering.api;

import com.tally.eventmodel.EventSerializer;
import com.tally.eventmodel.ExternalEvent;
import com.tally.metering.api.dto.WebhookResponse;
import com.tally.metering.domain.billing.BillingEventService;
import com.tally.observability.SpanHelper;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives billing provider events. Redeliveries answer 200 with {@code alreadyProcessed=true} so
 * the provider stops retrying.
 *
 * <p>Signature verification happens at the ingress in front of this service.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class BillingWebhookController {

    private final BillingEventService billingEventService;
    private final SpanHelper spans;

    public BillingWebhookController(BillingEventService billingEventService, SpanHelper spans) {
        this.billingEventService = billingEventService;
        this.spans = spans;
    }

    @PostMapping(path = "/billing", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WebhookResponse receive(@RequestBody String payload) {
        ExternalEvent event = EventSerializer.parse(payload);
        return spans.inSpan(
                "billing.webhook",
                Map.of("event.id", String.valueOf(event.eventId()), "event.type", String.valueOf(event.eventType())),
                () -> WebhookResponse.from(billingEventService.processExternalEvent(event)));
    }
}
