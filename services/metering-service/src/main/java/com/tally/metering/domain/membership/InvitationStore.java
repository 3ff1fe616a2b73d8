package com.tally.metering.domain.membership;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface InvitationStore {

    void save(Invitation invitation);

    Optional<Invitation> find(UUID token);

    /**
     * Claims a PENDING invitation for {@code userId}.
     *
     * @return false if it was no longer pending
     */
    boolean markAccepted(UUID token, String userId, Instant at);

    /** @return false if it was no longer pending */
    boolean markExpired(UUID token);
}
