package com.tally.metering.api.dto;

import com.tally.metering.domain.idempotency.ProcessingOutcome;

public record WebhookResponse(String eventId, String eventType, boolean alreadyProcessed) {

    public static WebhookResponse from(ProcessingOutcome outcome) {
        return new WebhookResponse(outcome.eventId(), outcome.eventType(), outcome.alreadyProcessed());
    }
}
