package com.tally.metering.infrastructure.persistence.jdbc;

import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.fromDb;
import static com.tally.metering.infrastructure.persistence.jdbc.JdbcTimestamps.toDb;

import com.tally.metering.domain.error.InvariantViolationException;
import com.tally.metering.domain.error.NotAMemberException;
import com.tally.metering.domain.membership.Member;
import com.tally.metering.domain.membership.MembershipStore;
import com.tally.metering.domain.membership.Tenant;
import com.tally.security.Role;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * Tenants and members in {@code tenants} and {@code tenant_members}.
 *
 * <p>The partial unique index {@code uq_tenant_members_single_owner} is what guarantees a single
 * owner. Duplicate-key failures on it are reported as {@link InvariantViolationException}.
 * Callers run multi-statement operations inside a transaction.
 */
public class JdbcMembershipStore implements MembershipStore {

    private static final String MEMBER_COLUMNS = "tenant_id, user_id, role, joined_at";

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcMembershipStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public void createTenant(Tenant tenant, Member owner) {
        jdbc.update(
                "INSERT INTO tenants (id, name, tier, time_zone, created_at) VALUES (:id, :name, :tier, :zone, :createdAt)",
                new MapSqlParameterSource()
                        .addValue("id", tenant.id())
                        .addValue("name", tenant.name())
                        .addValue("tier", tenant.tier())
                        .addValue("zone", tenant.timeZone() == null ? null : tenant.timeZone().getId())
                        .addValue("createdAt", toDb(tenant.createdAt())));
        insertMember(owner);
    }

    @Override
    public Optional<Tenant> findTenant(String tenantId) {
        return jdbc.query(
                        "SELECT id, name, tier, time_zone, created_at FROM tenants WHERE id = :id",
                        new MapSqlParameterSource("id", tenantId),
                        (rs, rowNum) -> {
                            String zone = rs.getString("time_zone");
                            return new Tenant(
                                    rs.getString("id"),
                                    rs.getString("name"),
                                    rs.getString("tier"),
                                    zone == null ? null : ZoneId.of(zone),
                                    fromDb(rs, "created_at"));
                        })
                .stream()
                .findFirst();
    }

    @Override
    public boolean updateTier(String tenantId, String tier) {
        return jdbc.update(
                        "UPDATE tenants SET tier = :tier WHERE id = :id",
                        new MapSqlParameterSource().addValue("tier", tier).addValue("id", tenantId))
                == 1;
    }

    @Override
    public Optional<Member> findMember(String tenantId, String userId) {
        return jdbc.query(
                        "SELECT " + MEMBER_COLUMNS + " FROM tenant_members WHERE tenant_id = :tenantId AND user_id = :userId",
                        memberKey(tenantId, userId),
                        JdbcMembershipStore::mapMember)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<Member> findOwner(String tenantId) {
        return jdbc.query(
                        "SELECT " + MEMBER_COLUMNS + " FROM tenant_members WHERE tenant_id = :tenantId AND role = 'OWNER'",
                        new MapSqlParameterSource("tenantId", tenantId),
                        JdbcMembershipStore::mapMember)
                .stream()
                .findFirst();
    }

    @Override
    public List<Member> listMembers(String tenantId) {
        return jdbc.query(
                "SELECT " + MEMBER_COLUMNS + " FROM tenant_members WHERE tenant_id = :tenantId ORDER BY joined_at, user_id",
                new MapSqlParameterSource("tenantId", tenantId),
                JdbcMembershipStore::mapMember);
    }

    @Override
    public boolean addMember(Member member) {
        try {
            return jdbc.update(
                            """
                            INSERT INTO tenant_members (tenant_id, user_id, role, joined_at, updated_at)
                            VALUES (:tenantId, :userId, :role, :joinedAt, :joinedAt)
                            ON CONFLICT (tenant_id, user_id) DO NOTHING
                            """,
                            memberParams(member))
                    == 1;
        } catch (DuplicateKeyException e) {
            throw secondOwner(member.tenantId(), e);
        }
    }

    @Override
    public boolean transferOwnership(String tenantId, String currentOwnerId, String newOwnerId, Instant at) {
        int demoted =
                jdbc.update(
                        """
                        UPDATE tenant_members SET role = 'ADMIN', updated_at = :at
                         WHERE tenant_id = :tenantId AND user_id = :userId AND role = 'OWNER'
                        """,
                        memberKey(tenantId, currentOwnerId).addValue("at", toDb(at)));
        if (demoted == 0) {
            return false;
        }
        try {
            int promoted =
                    jdbc.update(
                            """
                            UPDATE tenant_members SET role = 'OWNER', updated_at = :at
                             WHERE tenant_id = :tenantId AND user_id = :userId AND role <> 'OWNER'
                            """,
                            memberKey(tenantId, newOwnerId).addValue("at", toDb(at)));
            if (promoted == 0) {
                // the transaction rolls back the demotion
                throw new NotAMemberException(tenantId, newOwnerId);
            }
        } catch (DuplicateKeyException e) {
            throw secondOwner(tenantId, e);
        }
        return true;
    }

    @Override
    public boolean changeRole(String tenantId, String userId, Role newRole, Instant at) {
        try {
            return jdbc.update(
                            """
                            UPDATE tenant_members SET role = :role, updated_at = :at
                             WHERE tenant_id = :tenantId AND user_id = :userId AND role <> 'OWNER'
                            """,
                            memberKey(tenantId, userId).addValue("role", newRole.name()).addValue("at", toDb(at)))
                    == 1;
        } catch (DuplicateKeyException e) {
            throw secondOwner(tenantId, e);
        }
    }

    @Override
    public boolean removeMember(String tenantId, String userId) {
        return jdbc.update(
                        "DELETE FROM tenant_members WHERE tenant_id = :tenantId AND user_id = :userId AND role <> 'OWNER'",
                        memberKey(tenantId, userId))
                == 1;
    }

    private void insertMember(Member member) {
        try {
            jdbc.update(
                    """
                    INSERT INTO tenant_members (tenant_id, user_id, role, joined_at, updated_at)
                    VALUES (:tenantId, :userId, :role, :joinedAt, :joinedAt)
                    """,
                    memberParams(member));
        } catch (DuplicateKeyException e) {
            throw secondOwner(member.tenantId(), e);
        }
    }

    private static InvariantViolationException secondOwner(String tenantId, DuplicateKeyException cause) {
        return new InvariantViolationException("tenant " + tenantId + " already has an owner", cause);
    }

    private static MapSqlParameterSource memberKey(String tenantId, String userId) {
        return new MapSqlParameterSource().addValue("tenantId", tenantId).addValue("userId", userId);
    }

    private static MapSqlParameterSource memberParams(Member member) {
        return memberKey(member.tenantId(), member.userId())
                .addValue("role", member.role().name())
                .addValue("joinedAt", toDb(member.joinedAt()));
    }

    private static Member mapMember(ResultSet rs, int rowNum) throws SQLException {
        return new Member(
                rs.getString("tenant_id"),
                rs.getString("user_id"),
                Role.valueOf(rs.getString("role")),
                fromDb(rs, "joined_at"));
    }
}
