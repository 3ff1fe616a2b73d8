package com.tally.metering.domain.error;

/**
 * An attempt to modify or remove an immutable audit entry outside the retention purge. Maps to
 * 409. Hash mismatches found by verification are reported as data, not thrown.
 */
public class IntegrityViolationException extends RuntimeException {

    public IntegrityViolationException(String message) {
        super(message);
    }

    public IntegrityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
