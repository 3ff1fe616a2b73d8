package com.tally.metering.infrastructure.persistence.jdbc;

import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.toDb;

import com.tally.metering.domain.quota.RateLimitPolicy;
import com.tally.metering.domain.quota.RateLimitPolicyStore;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public class JdbcRateLimitPolicyStore implements RateLimitPolicyStore {

    private static final String FIND =
            """
            SELECT sessions_per_hour, sessions_per_day, tokens_per_month, budget_cents_per_month,
                   alert_threshold_percent
              FROM rate_limit_policies
             WHERE tenant_id = :tenantId
            """;

    private static final String UPSERT =
            """
            INSERT INTO rate_limit_policies (tenant_id, sessions_per_hour, sessions_per_day, tokens_per_month,
                                             budget_cents_per_month, alert_threshold_percent, updated_by, updated_at)
            VALUES (:tenantId, :perHour, :perDay, :tokens, :budget, :threshold, :updatedBy, :updatedAt)
            ON CONFLICT (tenant_id) DO UPDATE
               SET sessions_per_hour       = EXCLUDED.sessions_per_hour,
                   sessions_per_day        = EXCLUDED.sessions_per_day,
                   tokens_per_month        = EXCLUDED.tokens_per_month,
                   budget_cents_per_month  = EXCLUDED.budget_cents_per_month,
                   alert_threshold_percent = EXCLUDED.alert_threshold_percent,
                   updated_by              = EXCLUDED.updated_by,
                   updated_at              = EXCLUDED.updated_at
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcRateLimitPolicyStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<RateLimitPolicy> find(String tenantId) {
        return jdbc.query(
                        FIND,
                        Map.of("tenantId", tenantId),
                        (rs, rowNum) ->
                                new RateLimitPolicy(
                                        rs.getInt("sessions_per_hour"),
                                        rs.getInt("sessions_per_day"),
                                        rs.getLong("tokens_per_month"),
                                        rs.getLong("budget_cents_per_month"),
                                        rs.getInt("alert_threshold_percent")))
                .stream()
                .findFirst();
    }

    @Override
    public void save(String tenantId, RateLimitPolicy policy, String updatedBy, Instant updatedAt) {
        jdbc.update(
                UPSERT,
                new MapSqlParameterSource()
                        .addValue("tenantId", tenantId)
                        .addValue("perHour", policy.sessionsPerHour())
                        .addValue("perDay", policy.sessionsPerDay())
                        .addValue("tokens", policy.tokensPerMonth())
                        .addValue("budget", policy.budgetCentsPerMonth())
                        .addValue("threshold", policy.alertThresholdPercent())
                        .addValue("updatedBy", updatedBy)
                        .addValue("updatedAt", toDb(updatedAt)));
    }
}
