package com.tally.security;

/**
 * Thrown when a caller lacks the tenant role an operation requires.
 *
 * <p>Unchecked: the caller cannot recover by retrying, and web layers map it to 403.
 */
public class AccessDeniedException extends RuntimeException {

    private final String userId;
    private final String action;

    public AccessDeniedException(String userId, String action, String reason) {
        super("Access denied for '%s' to %s: %s".formatted(userId, action, reason));
        this.userId = userId;
        this.action = action;
    }

    public String userId() {
        return userId;
    }

    public String action() {
        return action;
    }
}
