package com.tally.security;

import java.util.ArrayList;

/**
 * Validates that a {@link CallerContext} carries a usable identity.
 */
public final class CallerContextValidator {

    /** Longest user id the membership tables accept. */
    public static final int MAX_USER_ID_LENGTH = 128;

    private CallerContextValidator() {
        // utility class
    }

    /**
     * Validates the caller identity fields.
     *
     * @param caller the context to validate (may be null)
     * @return a {@link SecurityValidationResult} with any errors found
     */
    public static SecurityValidationResult validate(CallerContext caller) {
        var errors = new ArrayList<String>();

        if (caller == null) {
            errors.add("caller must not be null");
        } else if (caller.userId() == null || caller.userId().isBlank()) {
            errors.add("userId must not be null or blank");
        } else if (caller.userId().length() > MAX_USER_ID_LENGTH) {
            errors.add("userId must be at most " + MAX_USER_ID_LENGTH + " characters");
        }

        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }
}
