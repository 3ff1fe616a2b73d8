package com.tally.metering.infrastructure.persistence.jdbc;

import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.fromDb;
import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.toDb;

import com.tally.metering.domain.audit.AuditEntry;
import com.tally.metering.domain.audit.AuditLedgerStore;
import com.tally.metering.domain.error.IntegrityViolationException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Audit entries in {@code audit_log_entries}.
 *
 * <p>Database triggers reject every UPDATE and TRUNCATE, and every DELETE unless the
 * transaction-local setting {@code tally.audit_retention_purge} is {@code on}. Only
 * {@link #purgeOlderThan} sets it.
 */
public class JdbcAuditLedgerStore implements AuditLedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditLedgerStore.class);

    static final int FETCH_SIZE = 500;

    private static final String COLUMNS =
            "id, tenant_id, actor_id, action_type, target_ref, description, before_value, after_value, occurred_at, integrity_hash";

    private static final String INSERT =
            """
            INSERT INTO audit_log_entries (id, tenant_id, actor_id, action_type, target_ref, description,
                                           before_value, after_value, occurred_at, integrity_hash)
            VALUES (:id, :tenantId, :actorId, :actionType, :targetRef, :description,
                    :beforeValue, :afterValue, :occurredAt, :integrityHash)
            """;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcAuditLedgerStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void insert(AuditEntry entry) {
        jdbc.update(
                INSERT,
                new MapSqlParameterSource()
                        .addValue("id", entry.id())
                        .addValue("tenantId", entry.tenantId())
                        .addValue("actorId", entry.actorId())
                        .addValue("actionType", entry.actionType())
                        .addValue("targetRef", entry.targetRef())
                        .addValue("description", entry.description())
                        .addValue("beforeValue", entry.beforeValue())
                        .addValue("afterValue", entry.afterValue())
                        .addValue("occurredAt", toDb(entry.occurredAt()))
                        .addValue("integrityHash", entry.integrityHash()));
    }

    @Override
    public Optional<AuditEntry> find(UUID id) {
        return jdbc.query(
                        "SELECT " + COLUMNS + " FROM audit_log_entries WHERE id = :id",
                        new MapSqlParameterSource("id", id),
                        (rs, rowNum) -> mapRow(rs))
                .stream()
                .findFirst();
    }

    @Override
    public void forEachByTenant(String tenantId, Consumer<AuditEntry> consumer) {
        JdbcTemplate plain = jdbc.getJdbcTemplate();
        plain.query(
                con -> {
                    var ps =
                            con.prepareStatement(
                                    "SELECT " + COLUMNS
                                            + " FROM audit_log_entries WHERE tenant_id = ? ORDER BY occurred_at, id");
                    ps.setFetchSize(FETCH_SIZE);
                    ps.setString(1, tenantId);
                    return ps;
                },
                rs -> {
                    consumer.accept(mapRow(rs));
                });
    }

    /**
     * Deletes expired entries under the purge flag.
     *
     * @throws IllegalStateException when called outside a transaction, since the flag is
     *     transaction-local
     */
    @Override
    public int purgeOlderThan(Instant cutoff) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("audit purge must run inside a transaction");
        }
        JdbcTemplate plain = jdbc.getJdbcTemplate();
        try {
            plain.queryForObject("SELECT set_config('tally.audit_retention_purge', 'on', true)", String.class);
            int removed =
                    jdbc.update(
                            "DELETE FROM audit_log_entries WHERE occurred_at < :cutoff",
                            new MapSqlParameterSource("cutoff", toDb(cutoff)));
            plain.queryForObject("SELECT set_config('tally.audit_retention_purge', 'off', true)", String.class);
            return removed;
        } catch (DataIntegrityViolationException e) {
            log.error("Audit purge rejected by the ledger guard", e);
            throw new IntegrityViolationException("audit purge rejected: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static AuditEntry mapRow(ResultSet rs) throws SQLException {
        return new AuditEntry(
                rs.getObject("id", UUID.class),
                rs.getString("tenant_id"),
                rs.getString("actor_id"),
                rs.getString("action_type"),
                rs.getString("target_ref"),
                rs.getString("description"),
                rs.getString("before_value"),
                rs.getString("after_value"),
                fromDb(rs, "occurred_at"),
                rs.getString("integrity_hash"));
    }
}
