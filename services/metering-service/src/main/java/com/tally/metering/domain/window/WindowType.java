package com.tally.metering.domain.window;

/** Granularity of a quota counter window. */
public enum WindowType {
    HOUR,
    DAY,
    MONTH
}
