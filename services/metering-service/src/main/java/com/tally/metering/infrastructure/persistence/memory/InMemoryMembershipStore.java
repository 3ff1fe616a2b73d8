package com.tally.metering.infrastructure.persistence.memory;

import com.tally.metering.domain.error.InvariantViolationException;
import com.tally.metering.domain.error.NotAMemberException;
import com.tally.metering.domain.membership.Member;
import com.tally.metering.domain.membership.MembershipStore;
import com.tally.metering.domain.membership.Tenant;
import com.tally.security.Role;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Tenants and members in memory.
 *
 * <p>All member writes of a tenant run under that tenant's lock and replace the tenant's member
 * map with a new immutable copy, so readers see either the state before or after a change,
 * never an intermediate one. Every write re-checks the single-owner rule itself.
 */
public class InMemoryMembershipStore implements MembershipStore {

    private final ConcurrentMap<String, Tenant> tenants = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Map<String, Member>> members = new ConcurrentHashMap<>();
    private final TenantLocks locks = new TenantLocks();

    @Override
    public void createTenant(Tenant tenant, Member owner) {
        if (owner.role() != Role.OWNER) {
            throw new IllegalArgumentException("a tenant is created with its owner");
        }
        locks.withLock(
                tenant.id(),
                () -> {
                    if (tenants.putIfAbsent(tenant.id(), tenant) != null) {
                        throw new InvariantViolationException("tenant " + tenant.id() + " already exists");
                    }
                    members.put(tenant.id(), Map.of(owner.userId(), owner));
                });
    }

    @Override
    public Optional<Tenant> findTenant(String tenantId) {
        return Optional.ofNullable(tenants.get(tenantId));
    }

    @Override
    public boolean updateTier(String tenantId, String tier) {
        return tenants.computeIfPresent(tenantId, (id, tenant) -> tenant.withTier(tier)) != null;
    }

    @Override
    public Optional<Member> findMember(String tenantId, String userId) {
        return Optional.ofNullable(snapshot(tenantId).get(userId));
    }

    @Override
    public Optional<Member> findOwner(String tenantId) {
        return snapshot(tenantId).values().stream().filter(Member::isOwner).findFirst();
    }

    @Override
    public List<Member> listMembers(String tenantId) {
        return snapshot(tenantId).values().stream()
                .sorted(Comparator.comparing(Member::joinedAt).thenComparing(Member::userId))
                .toList();
    }

    @Override
    public boolean addMember(Member member) {
        return locks.withLock(
                member.tenantId(),
                () -> {
                    Map<String, Member> current = snapshot(member.tenantId());
                    if (current.containsKey(member.userId())) {
                        return false;
                    }
                    if (member.isOwner() && current.values().stream().anyMatch(Member::isOwner)) {
                        throw new InvariantViolationException("tenant " + member.tenantId() + " already has an owner");
                    }
                    var next = new LinkedHashMap<>(current);
                    next.put(member.userId(), member);
                    members.put(member.tenantId(), Map.copyOf(next));
                    return true;
                });
    }

    @Override
    public boolean transferOwnership(String tenantId, String currentOwnerId, String newOwnerId, Instant at) {
        return locks.withLock(
                tenantId,
                () -> {
                    Map<String, Member> current = snapshot(tenantId);
                    Member owner = current.get(currentOwnerId);
                    if (owner == null || !owner.isOwner()) {
                        return false;
                    }
                    Member target = current.get(newOwnerId);
                    if (target == null || target.isOwner()) {
                        throw new NotAMemberException(tenantId, newOwnerId);
                    }
                    var next = new LinkedHashMap<>(current);
                    next.put(currentOwnerId, new Member(tenantId, currentOwnerId, Role.ADMIN, owner.joinedAt()));
                    next.put(newOwnerId, new Member(tenantId, newOwnerId, Role.OWNER, target.joinedAt()));
                    members.put(tenantId, Map.copyOf(next));
                    return true;
                });
    }

    @Override
    public boolean changeRole(String tenantId, String userId, Role newRole, Instant at) {
        if (newRole == Role.OWNER) {
            throw new InvariantViolationException("ownership changes only through transfer");
        }
        return locks.withLock(
                tenantId,
                () -> {
                    Map<String, Member> current = snapshot(tenantId);
                    Member member = current.get(userId);
                    if (member == null || member.isOwner()) {
                        return false;
                    }
                    var next = new LinkedHashMap<>(current);
                    next.put(userId, new Member(tenantId, userId, newRole, member.joinedAt()));
                    members.put(tenantId, Map.copyOf(next));
                    return true;
                });
    }

    @Override
    public boolean removeMember(String tenantId, String userId) {
        return locks.withLock(
                tenantId,
                () -> {
                    Map<String, Member> current = snapshot(tenantId);
                    Member member = current.get(userId);
                    if (member == null || member.isOwner()) {
                        return false;
                    }
                    var next = new LinkedHashMap<>(current);
                    next.remove(userId);
                    members.put(tenantId, Map.copyOf(next));
                    return true;
                });
    }

    private Map<String, Member> snapshot(String tenantId) {
        return members.getOrDefault(tenantId, Map.of());
    }
}
