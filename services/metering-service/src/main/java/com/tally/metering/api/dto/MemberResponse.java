package com.tally.metering.api.dto;

import com.tally.metering.domain.membership.Member;
import java.time.Instant;

public record MemberResponse(String tenantId, String userId, String role, Instant joinedAt) {

    public static MemberResponse from(Member member) {
        return new MemberResponse(member.tenantId(), member.userId(), member.role().value(), member.joinedAt());
    }
}
