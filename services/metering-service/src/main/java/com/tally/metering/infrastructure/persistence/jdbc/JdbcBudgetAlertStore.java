package com.tally.metering.infrastructure.persistence.jdbc;

import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.fromDb;
import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.toDb;

import com.tally.metering.domain.alert.AlertType;
import com.tally.metering.domain.alert.BudgetAlert;
import com.tally.metering.domain.alert.BudgetAlertStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Budget alerts in {@code budget_alerts}. The unique (tenant, type, period) constraint makes the
 * insert conditional; acknowledgement only ever fills null columns.
 */
public class JdbcBudgetAlertStore implements BudgetAlertStore {

    private static final String COLUMNS =
            "id, tenant_id, alert_type, period_start, current_value, limit_value, raised_at, acknowledged_at, acknowledged_by";

    private static final String INSERT =
            """
            INSERT INTO budget_alerts (id, tenant_id, alert_type, period_start, current_value, limit_value, raised_at)
            VALUES (:id, :tenantId, :alertType, :periodStart, :currentValue, :limitValue, :raisedAt)
            ON CONFLICT (tenant_id, alert_type, period_start) DO NOTHING
            """;

    private static final String ACKNOWLEDGE =
            """
            UPDATE budget_alerts
               SET acknowledged_at = :at, acknowledged_by = :userId
             WHERE id = :id AND tenant_id = :tenantId AND acknowledged_at IS NULL
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcBudgetAlertStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Optional<BudgetAlert> insertIfAbsent(BudgetAlert alert) {
        int inserted =
                jdbc.update(
                        INSERT,
                        new MapSqlParameterSource()
                                .addValue("id", alert.id())
                                .addValue("tenantId", alert.tenantId())
                                .addValue("alertType", alert.alertType().name())
                                .addValue("periodStart", toDb(alert.periodStart()))
                                .addValue("currentValue", alert.currentValue())
                                .addValue("limitValue", alert.limitValue())
                                .addValue("raisedAt", toDb(alert.raisedAt())));
        return inserted == 1 ? Optional.of(alert) : Optional.empty();
    }

    @Override
    public List<BudgetAlert> list(String tenantId, Boolean acknowledged, int limit) {
        String filter =
                acknowledged == null
                        ? ""
                        : acknowledged ? " AND acknowledged_at IS NOT NULL" : " AND acknowledged_at IS NULL";
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM budget_alerts WHERE tenant_id = :tenantId" + filter
                        + " ORDER BY raised_at DESC, id LIMIT :limit",
                new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("limit", limit),
                JdbcBudgetAlertStore::mapRow);
    }

    @Override
    public List<BudgetAlert> pending(int limit) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM budget_alerts WHERE acknowledged_at IS NULL"
                        + " ORDER BY raised_at, id LIMIT :limit",
                new MapSqlParameterSource("limit", limit),
                JdbcBudgetAlertStore::mapRow);
    }

    @Override
    public Optional<BudgetAlert> find(String tenantId, UUID alertId) {
        return jdbc.query(
                        "SELECT " + COLUMNS + " FROM budget_alerts WHERE id = :id AND tenant_id = :tenantId",
                        new MapSqlParameterSource().addValue("id", alertId).addValue("tenantId", tenantId),
                        JdbcBudgetAlertStore::mapRow)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<BudgetAlert> acknowledge(String tenantId, UUID alertId, String userId, Instant at) {
        jdbc.update(
                ACKNOWLEDGE,
                new MapSqlParameterSource()
                        .addValue("id", alertId)
                        .addValue("tenantId", tenantId)
                        .addValue("userId", userId)
                        .addValue("at", toDb(at)));
        return find(tenantId, alertId);
    }

    private static BudgetAlert mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new BudgetAlert(
                rs.getObject("id", UUID.class),
                rs.getString("tenant_id"),
                AlertType.valueOf(rs.getString("alert_type")),
                fromDb(rs, "period_start"),
                rs.getLong("current_value"),
                rs.getLong("limit_value"),
                fromDb(rs, "raised_at"),
                fromDb(rs, "acknowledged_at"),
                rs.getString("acknowledged_by"));
    }
}
