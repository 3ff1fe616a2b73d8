package com.tally.metering.infrastructure.persistence.jdbc;

import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.toDb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tally.metering.domain.usage.DailyUsage;
import com.tally.metering.domain.usage.SessionUsageRecord;
import com.tally.metering.domain.usage.SessionUsageStore;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Usage detail rows in {@code session_usage_records}; the model breakdown is stored as JSONB. */
public class JdbcSessionUsageStore implements SessionUsageStore {

    private static final String INSERT =
            """
            INSERT INTO session_usage_records (id, tenant_id, actor_id, conversation_ref, session_type, sessions,
                                               tokens_input, tokens_output, cost_cents, model_breakdown, recorded_at)
            VALUES (:id, :tenantId, :actorId, :conversationRef, :sessionType, :sessions,
                    :tokensInput, :tokensOutput, :costCents, CAST(:breakdown AS jsonb), :recordedAt)
            """;

    private static final String DAILY =
            """
            SELECT (recorded_at AT TIME ZONE :zone)::date AS day,
                   sum(sessions) AS sessions,
                   sum(tokens_input) AS tokens_input,
                   sum(tokens_output) AS tokens_output,
                   sum(cost_cents) AS cost_cents
              FROM session_usage_records
             WHERE tenant_id = :tenantId AND recorded_at >= :from
             GROUP BY 1
             ORDER BY 1
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public JdbcSessionUsageStore(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insert(SessionUsageRecord record) {
        String breakdown;
        try {
            breakdown = objectMapper.writeValueAsString(record.modelBreakdown());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("model breakdown is not serializable", e);
        }
        jdbc.update(
                INSERT,
                new MapSqlParameterSource()
                        .addValue("id", record.id())
                        .addValue("tenantId", record.tenantId())
                        .addValue("actorId", record.actorId())
                        .addValue("conversationRef", record.conversationRef())
                        .addValue("sessionType", record.sessionType().name())
                        .addValue("sessions", record.sessions())
                        .addValue("tokensInput", record.tokensInput())
                        .addValue("tokensOutput", record.tokensOutput())
                        .addValue("costCents", record.costCents())
                        .addValue("breakdown", breakdown)
                        .addValue("recordedAt", toDb(record.recordedAt())));
    }

    @Override
    public List<DailyUsage> dailyTotals(String tenantId, Instant from, ZoneId zone) {
        return jdbc.query(
                DAILY,
                new MapSqlParameterSource()
                        .addValue("tenantId", tenantId)
                        .addValue("from", toDb(from))
                        .addValue("zone", zone.getId()),
                (rs, rowNum) ->
                        new DailyUsage(
                                rs.getObject("day", LocalDate.class),
                                rs.getLong("sessions"),
                                rs.getLong("tokens_input"),
                                rs.getLong("tokens_output"),
                                rs.getLong("cost_cents")));
    }
}
