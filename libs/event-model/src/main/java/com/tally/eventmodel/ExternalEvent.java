package com.tally.eventmodel;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * An event delivered by an external system (typically a billing provider webhook).
 *
 * <p>Delivery is at-least-once: the same {@code eventId} can arrive any number of times, and the
 * consumer is responsible for applying its side effects once. The payload is kept opaque; only
 * the identifying fields and the string metadata are interpreted.
 *
 * @param eventId provider-assigned unique event id (e.g. "evt_1")
 * @param eventType provider event type (e.g. "invoice.paid")
 * @param createdAt when the provider created the event, if it said so
 * @param payload the event's data object, unparsed beyond JSON
 * @param metadata string metadata attached to the event (e.g. {@code tenant_id})
 */
public record ExternalEvent(
        String eventId,
        String eventType,
        Instant createdAt,
        Map<String, Object> payload,
        Map<String, String> metadata) {

    /** Metadata key naming the tenant an event belongs to. */
    public static final String TENANT_ID_KEY = "tenant_id";

    public ExternalEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    /** The tenant named in the metadata, if any. */
    public Optional<String> tenantId() {
        return metadataValue(TENANT_ID_KEY);
    }

    /** A non-blank metadata value. */
    public Optional<String> metadataValue(String key) {
        String value = metadata.get(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
