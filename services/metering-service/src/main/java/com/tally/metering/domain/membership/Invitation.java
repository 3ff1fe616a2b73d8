package com.tally.metering.domain.membership;

import com.tally.security.Role;
import java.time.Instant;
import java.util.UUID;

/**
 * An invitation to join a tenant, redeemable once by its token.
 *
 * @param token secret redemption token
 * @param tenantId tenant to join
 * @param email address the invitation was sent to
 * @param targetRole role granted on acceptance (OWNER is downgraded to ADMIN)
 * @param status lifecycle state
 * @param invitedBy who created it
 * @param createdAt creation time
 * @param expiresAt end of validity
 * @param acceptedBy who redeemed it, once accepted
 * @param acceptedAt when it was redeemed, once accepted
 */
public record Invitation(
        UUID token,
        String tenantId,
        String email,
        Role targetRole,
        InvitationStatus status,
        String invitedBy,
        Instant createdAt,
        Instant expiresAt,
        String acceptedBy,
        Instant acceptedAt) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
