package com.tally.security;

/**
 * Role checks with hierarchy support.
 *
 * <p>Example: a caller holding OWNER passes {@code hasRole(OWNER, ADMIN)} because OWNER implies
 * ADMIN.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /** Checks if the held role satisfies the required role. A null held role satisfies nothing. */
    public static boolean hasRole(Role held, Role required) {
        return held != null && held.implies(required);
    }

    /** Checks if the held role satisfies ANY of the required roles. */
    public static boolean hasAnyRole(Role held, Role... required) {
        for (Role role : required) {
            if (hasRole(held, role)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Requires the held role to satisfy {@code required}.
     *
     * @param caller who is acting
     * @param held the caller's role in the tenant, or null if not a member
     * @param required minimum role
     * @param action description used in the denial message
     * @throws AccessDeniedException if the role is insufficient
     */
    public static void require(CallerContext caller, Role held, Role required, String action) {
        if (!hasRole(held, required)) {
            throw new AccessDeniedException(
                    caller.userId(),
                    action,
                    held == null
                            ? "not a member of the tenant"
                            : "requires %s, has %s".formatted(required.value(), held.value()));
        }
    }
}
