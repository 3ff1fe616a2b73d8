package com.tally.metering.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Invitation settings, bound from {@code tally.membership.*}.
 *
 * @param invitationTtl validity of an invitation when the request names none (default 7 days)
 * @param maxInvitationTtl longest validity a request may ask for (default 30 days)
 */
@ConfigurationProperties(prefix = "tally.membership")
public record MembershipProperties(Duration invitationTtl, Duration maxInvitationTtl) {

    public MembershipProperties {
        if (invitationTtl == null) {
            invitationTtl = Duration.ofDays(7);
        }
        if (maxInvitationTtl == null) {
            maxInvitationTtl = Duration.ofDays(30);
        }
        if (invitationTtl.compareTo(maxInvitationTtl) > 0) {
            throw new IllegalArgumentException("tally.membership.invitation-ttl exceeds max-invitation-ttl");
        }
    }
}
