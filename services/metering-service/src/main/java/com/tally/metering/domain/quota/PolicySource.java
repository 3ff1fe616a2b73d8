package com.tally.metering.domain.quota;

/** Where an effective policy came from. */
public enum PolicySource {
    TENANT_OVERRIDE,
    TIER_DEFAULT
}
