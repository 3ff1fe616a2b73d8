package com.tally.metering.domain.usage;

/** What kind of AI session produced the usage. */
public enum SessionType {
    COUNCIL,
    CHAT,
    TRIAGE,
    DOCUMENT
}
