package com.tally.metering.infrastructure.persistence.jdbc;

import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.fromDb;
import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.toDb;

import com.tally.metering.domain.membership.Invitation;
import com.tally.metering.domain.membership.InvitationStatus;
import com.tally.metering.domain.membership.InvitationStore;
import com.tally.security.Role;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Invitations in {@code tenant_invitations}. Status changes are conditional on PENDING. */
public class JdbcInvitationStore implements InvitationStore {

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcInvitationStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void save(Invitation invitation) {
        jdbc.update(
                """
                INSERT INTO tenant_invitations (token, tenant_id, email, target_role, status, invited_by, created_at, expires_at)
                VALUES (:token, :tenantId, :email, :role, :status, :invitedBy, :createdAt, :expiresAt)
                """,
                new MapSqlParameterSource()
                        .addValue("token", invitation.token())
                        .addValue("tenantId", invitation.tenantId())
                        .addValue("email", invitation.email())
                        .addValue("role", invitation.targetRole().name())
                        .addValue("status", invitation.status().name())
                        .addValue("invitedBy", invitation.invitedBy())
                        .addValue("createdAt", toDb(invitation.createdAt()))
                        .addValue("expiresAt", toDb(invitation.expiresAt())));
    }

    @Override
    public Optional<Invitation> find(UUID token) {
        return jdbc.query(
                        """
                        SELECT token, tenant_id, email, target_role, status, invited_by, created_at, expires_at,
                               accepted_by, accepted_at
                          FROM tenant_invitations
                         WHERE token = :token
                        """,
                        new MapSqlParameterSource("token", token),
                        (rs, rowNum) ->
                                new Invitation(
                                        rs.getObject("token", UUID.class),
                                        rs.getString("tenant_id"),
                                        rs.getString("email"),
                                        Role.valueOf(rs.getString("target_role")),
                                        InvitationStatus.valueOf(rs.getString("status")),
                                        rs.getString("invited_by"),
                                        fromDb(rs, "created_at"),
                                        fromDb(rs, "expires_at"),
                                        rs.getString("accepted_by"),
                                        fromDb(rs, "accepted_at")))
                .stream()
                .findFirst();
    }

    @Override
    public boolean markAccepted(UUID token, String userId, Instant at) {
        return jdbc.update(
                        """
                        UPDATE tenant_invitations
                           SET status = 'ACCEPTED', accepted_by = :userId, accepted_at = :at
                         WHERE token = :token AND status = 'PENDING'
                        """,
                        new MapSqlParameterSource()
                                .addValue("token", token)
                                .addValue("userId", userId)
                                .addValue("at", toDb(at)))
                == 1;
    }

    @Override
    public boolean markExpired(UUID token) {
        return jdbc.update(
                        "UPDATE tenant_invitations SET status = 'EXPIRED' WHERE token = :token AND status = 'PENDING'",
                        new MapSqlParameterSource("token", token))
                == 1;
    }
}
