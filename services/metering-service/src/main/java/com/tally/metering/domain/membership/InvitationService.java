package com.tally.metering.domain.membership;

import com.tally.metering.domain.audit.AuditEvent;
import com.tally.metering.domain.audit.AuditLedger;
import com.tally.metering.domain.error.InvitationUnavailableException;
import com.tally.metering.domain.error.NotFoundException;
import com.tally.metering.domain.error.ValidationException;
import com.tally.security.AccessDeniedException;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

/**
 * Invitation issue and redemption. Ownership is never granted by an invitation.
 */
public class InvitationService {

    private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private final InvitationStore invitations;
    private final MembershipStore members;
    private final MembershipService membershipService;
    private final AuditLedger auditLedger;
    private final Clock clock;
    private final Duration defaultTtl;
    private final Duration maxTtl;

    public InvitationService(
            InvitationStore invitations,
            MembershipStore members,
            MembershipService membershipService,
            AuditLedger auditLedger,
            Clock clock,
            Duration defaultTtl,
            Duration maxTtl) {
        this.invitations = invitations;
        this.members = members;
        this.membershipService = membershipService;
        this.auditLedger = auditLedger;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.maxTtl = maxTtl;
    }

    @Transactional
    public Invitation createInvitation(
            String tenantId, CallerContext caller, String email, Role role, Duration ttl) {
        if (email == null || !EMAIL.matcher(email).matches()) {
            throw new ValidationException("email must be a valid address");
        }
        Role target = role == null ? Role.MEMBER : role;
        if (target == Role.OWNER) {
            throw new ValidationException("invitations cannot grant ownership");
        }
        Duration validity = ttl == null ? defaultTtl : ttl;
        if (validity.isNegative() || validity.isZero() || validity.compareTo(maxTtl) > 0) {
            throw new ValidationException("ttl must be positive and at most " + maxTtl);
        }
        Role callerRole = membershipService.requireRole(tenantId, caller, Role.ADMIN, "invite member");
        if (target == Role.ADMIN && callerRole != Role.OWNER) {
            throw new AccessDeniedException(caller.userId(), "invite member", "only the owner may invite an admin");
        }

        Instant now = clock.instant();
        Invitation invitation =
                new Invitation(
                        UUID.randomUUID(),
                        tenantId,
                        email.trim(),
                        target,
                        InvitationStatus.PENDING,
                        caller.userId(),
                        now,
                        now.plus(validity),
                        null,
                        null);
        invitations.save(invitation);
        auditLedger.record(
                new AuditEvent(
                        tenantId,
                        caller.userId(),
                        "member:invited",
                        "invitation/" + invitation.token(),
                        "Invitation created",
                        null,
                        Map.of("email", invitation.email(), "role", target.value())));
        log.info("Invitation {} to tenant {} created by {} for role {}", invitation.token(), tenantId, caller.userId(), target);
        return invitation;
    }

    /**
     * Redeems an invitation for the caller.
     *
     * <p>An expired invitation is marked EXPIRED even though the call fails, so that change is
     * kept on rollback of everything else.
     *
     * @return the caller's membership after acceptance
     * @throws NotFoundException if no invitation has this token
     * @throws InvitationUnavailableException if it is expired, revoked or already used
     */
    @Transactional(noRollbackFor = InvitationUnavailableException.class)
    public Member acceptInvitation(UUID token, CallerContext caller) {
        Invitation invitation =
                invitations.find(token).orElseThrow(() -> new NotFoundException("invitation", String.valueOf(token)));
        if (invitation.status() != InvitationStatus.PENDING) {
            throw new InvitationUnavailableException(token, invitation.status().name().toLowerCase(Locale.ROOT));
        }
        Instant now = clock.instant();
        if (invitation.isExpiredAt(now)) {
            invitations.markExpired(token);
            log.info("Invitation {} expired at {}", token, invitation.expiresAt());
            throw new InvitationUnavailableException(token, "expired");
        }

        Role role = invitation.targetRole();
        if (role == Role.OWNER) {
            log.warn("Invitation {} targets owner; granting admin instead", token);
            role = Role.ADMIN;
        }
        if (!invitations.markAccepted(token, caller.userId(), now)) {
            throw new InvitationUnavailableException(token, "already used");
        }

        Optional<Member> existing = members.findMember(invitation.tenantId(), caller.userId());
        if (existing.isPresent()) {
            log.info("User {} accepted invitation {} but already belongs to tenant {}", caller.userId(), token, invitation.tenantId());
            return existing.get();
        }
        Member member = new Member(invitation.tenantId(), caller.userId(), role, now);
        if (!members.addMember(member)) {
            return members.findMember(invitation.tenantId(), caller.userId()).orElse(member);
        }
        auditLedger.record(
                new AuditEvent(
                        invitation.tenantId(),
                        caller.userId(),
                        "member:joined",
                        "member/" + caller.userId(),
                        "Invitation accepted",
                        null,
                        Map.of("role", role.value(), "invitation", token.toString())));
        log.info("User {} joined tenant {} as {}", caller.userId(), invitation.tenantId(), role);
        return member;
    }
}
