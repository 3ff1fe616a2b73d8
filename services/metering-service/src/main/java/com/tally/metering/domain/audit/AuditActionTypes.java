package com.tally.metering.domain.audit;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates action types of the form {@code namespace:action}.
 *
 * <p>The action part is open: new actions need no schema change. Only the namespace is checked
 * against the configured allow-list.
 */
public final class AuditActionTypes {

    private static final Pattern FORMAT = Pattern.compile("^([a-z][a-z0-9_-]*):[a-z0-9_.-]+$");

    private final Set<String> allowedNamespaces;

    public AuditActionTypes(Set<String> allowedNamespaces) {
        this.allowedNamespaces = Set.copyOf(allowedNamespaces);
    }

    /**
     * Returns the reason an action type is rejected, or empty if it is acceptable.
     */
    public Optional<String> rejectionReason(String actionType) {
        if (actionType == null || actionType.isBlank()) {
            return Optional.of("actionType must not be blank");
        }
        if (actionType.length() > 128) {
            return Optional.of("actionType must be at most 128 characters");
        }
        Matcher matcher = FORMAT.matcher(actionType);
        if (!matcher.matches()) {
            return Optional.of("actionType must look like 'namespace:action', got '" + actionType + "'");
        }
        String namespace = matcher.group(1);
        if (!allowedNamespaces.contains(namespace)) {
            return Optional.of("actionType namespace '" + namespace + "' is not allowed");
        }
        return Optional.empty();
    }

    public Set<String> allowedNamespaces() {
        return allowedNamespaces;
    }
}
