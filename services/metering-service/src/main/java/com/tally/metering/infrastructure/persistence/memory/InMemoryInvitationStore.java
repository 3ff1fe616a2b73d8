package com.tally.metering.infrastructure.persistence.memory;

import com.tally.metering.domain.membership.Invitation;
import com.tally.metering.domain.membership.InvitationStatus;
import com.tally.metering.domain.membership.InvitationStore;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryInvitationStore implements InvitationStore {

    private final ConcurrentMap<UUID, Invitation> invitations = new ConcurrentHashMap<>();

    @Override
    public void save(Invitation invitation) {
        invitations.put(invitation.token(), invitation);
    }

    @Override
    public Optional<Invitation> find(UUID token) {
        return Optional.ofNullable(invitations.get(token));
    }

    @Override
    public boolean markAccepted(UUID token, String userId, Instant at) {
        return transition(token, InvitationStatus.ACCEPTED, userId, at);
    }

    @Override
    public boolean markExpired(UUID token) {
        return transition(token, InvitationStatus.EXPIRED, null, null);
    }

    private boolean transition(UUID token, InvitationStatus status, String acceptedBy, Instant acceptedAt) {
        var changed = new boolean[1];
        invitations.computeIfPresent(
                token,
                (key, current) -> {
                    if (current.status() != InvitationStatus.PENDING) {
                        return current;
                    }
                    changed[0] = true;
                    return new Invitation(
                            current.token(),
                            current.tenantId(),
                            current.email(),
                            current.targetRole(),
                            status,
                            current.invitedBy(),
                            current.createdAt(),
                            current.expiresAt(),
                            acceptedBy,
                            acceptedAt);
                });
        return changed[0];
    }
}
