package com.tally.metering.infrastructure.persistence.memory;

import com.tally.metering.domain.idempotency.ProcessedEventStore;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryProcessedEventStore implements ProcessedEventStore {

    private final ConcurrentMap<String, Instant> processed = new ConcurrentHashMap<>();

    @Override
    public boolean markProcessed(String eventId, String eventType, Instant at) {
        return processed.putIfAbsent(eventId, at) == null;
    }

    @Override
    public void release(String eventId) {
        processed.remove(eventId);
    }

    @Override
    public boolean isProcessed(String eventId) {
        return processed.containsKey(eventId);
    }
}
