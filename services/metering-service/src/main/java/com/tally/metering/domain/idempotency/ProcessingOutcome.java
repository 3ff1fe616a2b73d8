package com.tally.metering.domain.idempotency;

/**
 * Result of offering an event to the guard.
 *
 * @param eventId the event
 * @param eventType its type
 * @param alreadyProcessed true if an earlier delivery already applied it
 */
public record ProcessingOutcome(String eventId, String eventType, boolean alreadyProcessed) {

    public static ProcessingOutcome applied(String eventId, String eventType) {
        return new ProcessingOutcome(eventId, eventType, false);
    }

    public static ProcessingOutcome duplicate(String eventId, String eventType) {
        return new ProcessingOutcome(eventId, eventType, true);
    }
}
