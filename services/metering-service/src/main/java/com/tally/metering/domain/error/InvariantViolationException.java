package com.tally.metering.domain.error;

/**
 * A write was rejected by a storage-level invariant, such as a second owner row for a tenant.
 * Maps to 409.
 */
public class InvariantViolationException extends RuntimeException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
