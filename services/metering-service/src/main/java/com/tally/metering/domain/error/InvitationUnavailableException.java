package com.tally.metering.domain.error;

import java.util.UUID;

/** The invitation exists but is expired, revoked or already used. Maps to 410. */
public class InvitationUnavailableException extends RuntimeException {

    private final UUID token;

    public InvitationUnavailableException(UUID token, String reason) {
        super("Invitation %s is no longer available: %s".formatted(token, reason));
        this.token = token;
    }

    public UUID token() {
        return token;
    }
}
