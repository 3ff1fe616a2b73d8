package com.tally.metering.domain.quota;

import java.time.Instant;

/**
 * Advisory state of one metric. Returned alongside successful results; never thrown.
 *
 * @param metric the metric
 * @param current usage in the current window
 * @param limit the ceiling
 * @param exceeded {@code current >= limit}
 * @param warning {@code current} reached the alert threshold
 * @param windowStart start of the window the usage was counted in
 */
public record LimitAdvisory(
        Metric metric, long current, long limit, boolean exceeded, boolean warning, Instant windowStart) {

    /** Whether this metric needs attention. */
    public boolean flagged() {
        return exceeded || warning;
    }
}
