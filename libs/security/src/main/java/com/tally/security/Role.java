package com.tally.security;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Tenant membership roles.
 *
 * <p>The hierarchy (OWNER implies ADMIN implies MEMBER) is encoded once here so services check
 * "at least ADMIN" instead of listing roles. Exactly one member of a tenant holds OWNER at any
 * time; that rule is enforced by storage, not by this enum.
 */
public enum Role {
    OWNER("owner"),
    ADMIN("admin"),
    MEMBER("member");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical lower-case representation (e.g., "admin"). */
    public String value() {
        return value;
    }

    /**
     * Returns the set of roles that this role implies.
     *
     * <ul>
     *   <li>OWNER implies ADMIN and MEMBER
     *   <li>ADMIN implies MEMBER
     *   <li>MEMBER implies nothing
     * </ul>
     */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case OWNER -> EnumSet.of(ADMIN, MEMBER);
            case ADMIN -> EnumSet.of(MEMBER);
            case MEMBER -> EnumSet.noneOf(Role.class);
        };
    }

    /** Checks whether this role implies the given role (directly or through the hierarchy). */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a Role by name, case-insensitively. "regular" is accepted as an alias of MEMBER.
     *
     * @param value the string to match (e.g., "admin", "OWNER")
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("regular".equals(normalized)) {
            return Optional.of(MEMBER);
        }
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known role. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
