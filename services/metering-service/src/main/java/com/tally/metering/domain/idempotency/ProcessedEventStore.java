package com.tally.metering.domain.idempotency;

import java.time.Instant;

/**
 * Ids of external events whose side effects have been applied.
 *
 * <p>{@link #markProcessed} is a single conditional insert on a unique event id; it is the only
 * thing that decides whether an event runs.
 */
public interface ProcessedEventStore {

    /**
     * Claims an event id.
     *
     * @return true if this call inserted the id, false if it was already present
     */
    boolean markProcessed(String eventId, String eventType, Instant at);

    /** Removes a claim so a failed event can be retried. */
    void release(String eventId);

    boolean isProcessed(String eventId);
}
