package com.tally.security;

/** Who is acting: a signed-in person, a background job, or an API client. */
public enum ActorType {
    USER,
    SYSTEM,
    API
}
