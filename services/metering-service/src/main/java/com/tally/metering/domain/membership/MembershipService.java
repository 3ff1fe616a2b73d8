package com.tally.metering.domain.membership;

import com.tally.metering.domain.audit.AuditEvent;
import com.tally.metering.domain.audit.AuditLedger;
import com.tally.metering.domain.error.InvariantViolationException;
import com.tally.metering.domain.error.NotAMemberException;
import com.tally.metering.domain.error.NotFoundException;
import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.domain.quota.TierDefaults;
import com.tally.security.AccessDeniedException;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import com.tally.security.RoleChecker;
import com.tally.security.TenantIsolationEnforcer;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tenant lifecycle and membership administration.
 *
 * <p>Every path that creates or changes an owner row goes through {@link MembershipStore}, whose
 * storage constraint is what keeps a tenant at exactly one owner. The checks here produce
 * readable errors; they are not what makes the invariant hold under concurrency.
 */
public class MembershipService {

    private static final Logger log = LoggerFactory.getLogger(MembershipService.class);

    /** Tier name accepted for tenants whose limits are negotiated individually. */
    public static final String CUSTOM_TIER = "custom";

    private final MembershipStore store;
    private final AuditLedger auditLedger;
    private final TierDefaults tierDefaults;
    private final ZoneId defaultZone;
    private final Clock clock;

    public MembershipService(
            MembershipStore store,
            AuditLedger auditLedger,
            TierDefaults tierDefaults,
            ZoneId defaultZone,
            Clock clock) {
        this.store = store;
        this.auditLedger = auditLedger;
        this.tierDefaults = tierDefaults;
        this.defaultZone = defaultZone;
        this.clock = clock;
    }

    /** Creates a tenant with the caller as its sole owner. */
    @Transactional
    public Tenant createTenant(CallerContext caller, NewTenant request) {
        var errors = new ArrayList<String>();
        if (request.name() == null || request.name().isBlank()) {
            errors.add("name must not be blank");
        } else if (request.name().length() > 200) {
            errors.add("name must be at most 200 characters");
        }
        String tier = request.tier() == null ? tierDefaults.defaultTier() : request.tier();
        if (tierDefaults.forTier(tier).isEmpty() && !CUSTOM_TIER.equals(tier)) {
            errors.add("unknown tier '" + tier + "'");
        }
        ZoneId zone = null;
        if (request.timeZone() != null) {
            try {
                zone = ZoneId.of(request.timeZone());
            } catch (DateTimeException e) {
                errors.add("unknown time zone '" + request.timeZone() + "'");
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        Instant now = clock.instant();
        Tenant tenant = new Tenant(UUID.randomUUID().toString(), request.name().trim(), tier, zone, now);
        store.createTenant(tenant, new Member(tenant.id(), caller.userId(), Role.OWNER, now));
        auditLedger.record(
                new AuditEvent(
                        tenant.id(),
                        caller.userId(),
                        "tenant:created",
                        "tenant/" + tenant.id(),
                        "Tenant created",
                        null,
                        Map.of("name", tenant.name(), "tier", tier, "owner", caller.userId())));
        log.info("Tenant {} created with owner {} on tier {}", tenant.id(), caller.userId(), tier);
        return tenant;
    }

    public Optional<Tenant> findTenant(String tenantId) {
        return store.findTenant(tenantId);
    }

    public Tenant getTenant(String tenantId) {
        return store.findTenant(tenantId).orElseThrow(() -> new NotFoundException("tenant", tenantId));
    }

    /** Zone used for the tenant's day and month windows. */
    public ZoneId zoneOf(String tenantId) {
        return zoneOf(getTenant(tenantId));
    }

    public ZoneId zoneOf(Tenant tenant) {
        return tenant.timeZone() != null ? tenant.timeZone() : defaultZone;
    }

    public Optional<Role> roleOf(String tenantId, String userId) {
        return store.findMember(tenantId, userId).map(Member::role);
    }

    public Optional<Member> ownerOf(String tenantId) {
        return store.findOwner(tenantId);
    }

    /**
     * Checks that the caller may act on the tenant with at least {@code required}.
     *
     * <p>System callers act on any tenant. Everyone else needs membership with a sufficient role.
     *
     * @return the caller's role (OWNER for system callers)
     * @throws NotFoundException if the tenant does not exist
     * @throws AccessDeniedException if the role is insufficient
     */
    public Role requireRole(String tenantId, CallerContext caller, Role required, String action) {
        TenantIsolationEnforcer.enforce(caller, tenantId);
        getTenant(tenantId);
        if (caller.isSystem()) {
            return Role.OWNER;
        }
        Role held = roleOf(tenantId, caller.userId()).orElse(null);
        try {
            RoleChecker.require(caller, held, required, action);
        } catch (AccessDeniedException e) {
            log.warn("Denied {} on tenant {} for {}: {}", action, tenantId, caller.userId(), e.getMessage());
            throw e;
        }
        return held;
    }

    /**
     * Hands ownership to an existing member. The caller becomes ADMIN.
     *
     * @throws AccessDeniedException unless the caller is the current owner
     * @throws NotAMemberException if the new owner is not a member
     */
    @Transactional
    public Member transferOwnership(String tenantId, CallerContext caller, String newOwnerId) {
        TenantIsolationEnforcer.enforce(caller, tenantId);
        getTenant(tenantId);
        Role callerRole = roleOf(tenantId, caller.userId()).orElse(null);
        if (callerRole != Role.OWNER) {
            log.warn("Ownership transfer on {} refused: {} is not the owner", tenantId, caller.userId());
            throw new AccessDeniedException(caller.userId(), "transfer ownership", "only the owner may transfer ownership");
        }
        if (caller.userId().equals(newOwnerId)) {
            throw new ValidationException("new owner must differ from the current owner");
        }
        if (store.findMember(tenantId, newOwnerId).isEmpty()) {
            throw new NotAMemberException(tenantId, newOwnerId);
        }

        Instant now = clock.instant();
        if (!store.transferOwnership(tenantId, caller.userId(), newOwnerId, now)) {
            log.warn("Ownership transfer on {} lost a race: {} is no longer the owner", tenantId, caller.userId());
            throw new AccessDeniedException(caller.userId(), "transfer ownership", "caller is no longer the owner");
        }
        auditLedger.record(
                new AuditEvent(
                        tenantId,
                        caller.userId(),
                        "member:ownership_transferred",
                        "tenant/" + tenantId,
                        "Ownership transferred",
                        Map.of("owner", caller.userId()),
                        Map.of("owner", newOwnerId)));
        log.info("Ownership of tenant {} transferred from {} to {}", tenantId, caller.userId(), newOwnerId);
        return store.findMember(tenantId, newOwnerId).orElseThrow(() -> new NotAMemberException(tenantId, newOwnerId));
    }

    public List<Member> listMembers(String tenantId, CallerContext caller) {
        requireRole(tenantId, caller, Role.MEMBER, "list members");
        return store.listMembers(tenantId);
    }

    /**
     * Changes a member's role between ADMIN and MEMBER. Only the owner may change an admin.
     */
    @Transactional
    public Member changeMemberRole(String tenantId, CallerContext caller, String userId, Role newRole) {
        if (newRole == null) {
            throw new ValidationException("role must not be null");
        }
        if (newRole == Role.OWNER) {
            throw new ValidationException("ownership can only be granted by ownership transfer");
        }
        Role callerRole = requireRole(tenantId, caller, Role.ADMIN, "change member role");
        Member target = store.findMember(tenantId, userId).orElseThrow(() -> new NotAMemberException(tenantId, userId));
        if (target.isOwner()) {
            throw new InvariantViolationException("the owner's role changes only through ownership transfer");
        }
        if ((target.role() == Role.ADMIN || newRole == Role.ADMIN) && callerRole != Role.OWNER) {
            throw new AccessDeniedException(caller.userId(), "change member role", "only the owner may grant or revoke admin");
        }
        if (target.role() == newRole) {
            return target;
        }
        if (!store.changeRole(tenantId, userId, newRole, clock.instant())) {
            throw new InvariantViolationException("member " + userId + " changed concurrently; retry");
        }
        auditLedger.record(
                new AuditEvent(
                        tenantId,
                        caller.userId(),
                        "member:role_changed",
                        "member/" + userId,
                        "Member role changed",
                        Map.of("role", target.role().value()),
                        Map.of("role", newRole.value())));
        log.info("Role of {} in tenant {} changed from {} to {}", userId, tenantId, target.role(), newRole);
        return new Member(tenantId, userId, newRole, target.joinedAt());
    }

    /**
     * Removes a member. The owner row can never be removed; members may remove themselves.
     */
    @Transactional
    public void removeMember(String tenantId, CallerContext caller, String userId) {
        boolean selfRemoval = caller.userId().equals(userId);
        Role callerRole =
                requireRole(tenantId, caller, selfRemoval ? Role.MEMBER : Role.ADMIN, "remove member");
        Member target = store.findMember(tenantId, userId).orElseThrow(() -> new NotAMemberException(tenantId, userId));
        if (target.isOwner()) {
            throw new InvariantViolationException("the owner cannot be removed; transfer ownership first");
        }
        if (!selfRemoval && target.role() == Role.ADMIN && callerRole != Role.OWNER) {
            throw new AccessDeniedException(caller.userId(), "remove member", "only the owner may remove an admin");
        }
        if (!store.removeMember(tenantId, userId)) {
            throw new NotAMemberException(tenantId, userId);
        }
        auditLedger.record(
                new AuditEvent(
                        tenantId,
                        caller.userId(),
                        "member:removed",
                        "member/" + userId,
                        selfRemoval ? "Member left" : "Member removed",
                        Map.of("role", target.role().value()),
                        null));
        log.info("Member {} removed from tenant {} by {}", userId, tenantId, caller.userId());
    }

    /** Moves a tenant to another tier, e.g. after a subscription change. */
    @Transactional
    public Tenant changeTier(String tenantId, String tier, String actorId) {
        Tenant before = getTenant(tenantId);
        if (tier.equals(before.tier())) {
            return before;
        }
        store.updateTier(tenantId, tier);
        auditLedger.record(
                new AuditEvent(
                        tenantId,
                        actorId,
                        "tenant:tier_changed",
                        "tenant/" + tenantId,
                        "Tenant tier changed",
                        Map.of("tier", before.tier()),
                        Map.of("tier", tier)));
        log.info("Tenant {} moved from tier {} to {}", tenantId, before.tier(), tier);
        return before.withTier(tier);
    }
}
