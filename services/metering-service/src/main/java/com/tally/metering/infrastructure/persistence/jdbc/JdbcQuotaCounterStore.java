package com.tally.metering.infrastructure.persistence.jdbc;

import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.toDb;

import com.tally.metering.domain.quota.CounterTotals;
import com.tally.metering.domain.quota.QuotaCounterStore;
import com.tally.metering.domain.quota.UsageDelta;
import com.tally.metering.domain.quota.UsageTotals;
import com.tally.metering.domain.window.WindowKeys;
import com.tally.metering.domain.window.WindowType;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Window counters in {@code quota_counters}.
 *
 * <p>One statement upserts all three windows. Rows are always listed HOUR, DAY, MONTH, so two
 * concurrent increments for a tenant lock them in the same order.
 */
public class JdbcQuotaCounterStore implements QuotaCounterStore {

    private static final String INCREMENT =
            """
            INSERT INTO quota_counters (tenant_id, window_type, window_start, session_count, token_count, cost_cents)
            VALUES (:tenantId, 'HOUR', :hourStart, :sessions, :tokens, :cost),
                   (:tenantId, 'DAY', :dayStart, :sessions, :tokens, :cost),
                   (:tenantId, 'MONTH', :monthStart, :sessions, :tokens, :cost)
            ON CONFLICT (tenant_id, window_type, window_start) DO UPDATE
               SET session_count = quota_counters.session_count + EXCLUDED.session_count,
                   token_count   = quota_counters.token_count + EXCLUDED.token_count,
                   cost_cents    = quota_counters.cost_cents + EXCLUDED.cost_cents,
                   updated_at    = now()
            RETURNING window_type, session_count, token_count, cost_cents
            """;

    private static final String READ =
            """
            SELECT window_type, session_count, token_count, cost_cents
              FROM quota_counters
             WHERE tenant_id = :tenantId
               AND ((window_type = 'HOUR' AND window_start = :hourStart)
                 OR (window_type = 'DAY' AND window_start = :dayStart)
                 OR (window_type = 'MONTH' AND window_start = :monthStart))
            """;

    private static final String EVICT =
            "DELETE FROM quota_counters WHERE window_type = :windowType AND window_start < :cutoff";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcQuotaCounterStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public UsageTotals increment(String tenantId, WindowKeys windows, UsageDelta delta) {
        var params =
                windowParams(tenantId, windows)
                        .addValue("sessions", delta.sessions())
                        .addValue("tokens", delta.tokens())
                        .addValue("cost", delta.costCents());
        return collect(windows, INCREMENT, params);
    }

    @Override
    public UsageTotals read(String tenantId, WindowKeys windows) {
        return collect(windows, READ, windowParams(tenantId, windows));
    }

    @Override
    public int evictOlderThan(WindowType type, Instant cutoff) {
        return jdbc.update(
                EVICT,
                new MapSqlParameterSource()
                        .addValue("windowType", type.name())
                        .addValue("cutoff", toDb(cutoff)));
    }

    private UsageTotals collect(WindowKeys windows, String sql, MapSqlParameterSource params) {
        Map<WindowType, CounterTotals> byType = new EnumMap<>(WindowType.class);
        jdbc.query(
                sql,
                params,
                rs -> {
                    byType.put(
                            WindowType.valueOf(rs.getString("window_type")),
                            new CounterTotals(
                                    rs.getLong("session_count"), rs.getLong("token_count"), rs.getLong("cost_cents")));
                });
        return new UsageTotals(
                windows,
                byType.getOrDefault(WindowType.HOUR, CounterTotals.ZERO),
                byType.getOrDefault(WindowType.DAY, CounterTotals.ZERO),
                byType.getOrDefault(WindowType.MONTH, CounterTotals.ZERO));
    }

    private static MapSqlParameterSource windowParams(String tenantId, WindowKeys windows) {
        return new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("hourStart", toDb(windows.hourStart()))
                .addValue("dayStart", toDb(windows.dayStart()))
                .addValue("monthStart", toDb(windows.monthStart()));
    }
}
