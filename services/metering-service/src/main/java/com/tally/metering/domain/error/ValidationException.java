package com.tally.metering.domain.error;

import java.util.List;

/** Malformed tenant, policy, usage or audit input. Maps to 400. */
public class ValidationException extends RuntimeException {

    private final List<String> errors;

    public ValidationException(String message) {
        this(List.of(message));
    }

    public ValidationException(List<String> errors) {
        super(String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> errors() {
        return errors;
    }
}
