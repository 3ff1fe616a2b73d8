package com.tally.metering.domain.membership;

import com.tally.metering.domain.error.InvariantViolationException;
import com.tally.metering.domain.error.NotAMemberException;
import com.tally.security.Role;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Tenants and their members.
 *
 * <p>Implementations enforce "at most one OWNER row per tenant" in storage: any write that would
 * create a second owner fails with {@link InvariantViolationException}, whatever the caller
 * checked beforehand.
 */
public interface MembershipStore {

    /** Inserts a tenant and its owner row as one unit. */
    void createTenant(Tenant tenant, Member owner);

    Optional<Tenant> findTenant(String tenantId);

    /** @return false if the tenant does not exist */
    boolean updateTier(String tenantId, String tier);

    Optional<Member> findMember(String tenantId, String userId);

    Optional<Member> findOwner(String tenantId);

    List<Member> listMembers(String tenantId);

    /**
     * Inserts a member unless the user already belongs to the tenant.
     *
     * @return false if the user was already a member
     * @throws InvariantViolationException if the row would be a second owner
     */
    boolean addMember(Member member);

    /**
     * Demotes the current owner to ADMIN and promotes the new owner, atomically. No other reader
     * ever sees zero or two owners.
     *
     * @return false if {@code currentOwnerId} is not the owner (nothing changes)
     * @throws NotAMemberException if {@code newOwnerId} is not a member (nothing changes)
     */
    boolean transferOwnership(String tenantId, String currentOwnerId, String newOwnerId, Instant at);

    /**
     * Changes the role of a non-owner member. Never touches the owner row.
     *
     * @return false if no non-owner member matched
     */
    boolean changeRole(String tenantId, String userId, Role newRole, Instant at);

    /**
     * Removes a non-owner member. Never touches the owner row.
     *
     * @return false if no non-owner member matched
     */
    boolean removeMember(String tenantId, String userId);
}
