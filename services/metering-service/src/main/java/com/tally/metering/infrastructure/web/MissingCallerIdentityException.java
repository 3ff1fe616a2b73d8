package com.tally.metering.infrastructure.web;

/** The request does not identify its caller. Maps to 401. */
public class MissingCallerIdentityException extends RuntimeException {

    public MissingCallerIdentityException(String message) {
        super(message);
    }
}
