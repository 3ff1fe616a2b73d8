package com.tally.metering.api.dto;

import com.tally.metering.domain.membership.Invitation;
import java.time.Instant;
import java.util.UUID;

public record InvitationResponse(
        UUID token, String tenantId, String email, String role, String status, Instant expiresAt) {

    public static InvitationResponse from(Invitation invitation) {
        return new InvitationResponse(
                invitation.token(),
                invitation.tenantId(),
                invitation.email(),
                invitation.targetRole().value(),
                invitation.status().name(),
                invitation.expiresAt());
    }
}
