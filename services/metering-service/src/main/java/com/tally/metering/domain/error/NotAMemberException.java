package com.tally.metering.domain.error;

/** The target of a membership operation is not a member of the tenant. Maps to 422. */
public class NotAMemberException extends RuntimeException {

    private final String tenantId;
    private final String userId;

    public NotAMemberException(String tenantId, String userId) {
        super("User '%s' is not a member of tenant '%s'".formatted(userId, tenantId));
        this.tenantId = tenantId;
        this.userId = userId;
    }

    public String tenantId() {
        return tenantId;
    }

    public String userId() {
        return userId;
    }
}
