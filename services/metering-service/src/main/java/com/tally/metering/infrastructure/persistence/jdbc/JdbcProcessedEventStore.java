package com.tally.metering.infrastructure.persistence.jdbc;

import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.toDb;

import com.tally.metering.domain.idempotency.ProcessedEventStore;
import java.time.Instant;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Processed event ids in {@code processed_external_events}; the primary key does the dedup. */
public class JdbcProcessedEventStore implements ProcessedEventStore {

    private static final String CLAIM =
            """
            INSERT INTO processed_external_events (event_id, event_type, processed_at)
            VALUES (:eventId, :eventType, :at)
            ON CONFLICT (event_id) DO NOTHING
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcProcessedEventStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean markProcessed(String eventId, String eventType, Instant at) {
        return jdbc.update(
                        CLAIM,
                        new MapSqlParameterSource()
                                .addValue("eventId", eventId)
                                .addValue("eventType", eventType)
                                .addValue("at", toDb(at)))
                == 1;
    }

    @Override
    public void release(String eventId) {
        jdbc.update("DELETE FROM processed_external_events WHERE event_id = :eventId", Map.of("eventId", eventId));
    }

    @Override
    public boolean isProcessed(String eventId) {
        Boolean exists =
                jdbc.queryForObject(
                        "SELECT EXISTS (SELECT 1 FROM processed_external_events WHERE event_id = :eventId)",
                        Map.of("eventId", eventId),
                        Boolean.class);
        return Boolean.TRUE.equals(exists);
    }
}
