package com.tally.metering.domain.quota;

import com.tally.metering.domain.window.WindowType;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * How long stale window counters are kept before the sweep removes them.
 *
 * @param hourly age after which an hour counter is stale
 * @param daily age after which a day counter is stale
 * @param monthlyMonths number of whole months a month counter is kept
 */
public record CounterRetention(Duration hourly, Duration daily, int monthlyMonths) {

    public static final CounterRetention DEFAULT = new CounterRetention(Duration.ofHours(24), Duration.ofDays(7), 3);

    public CounterRetention {
        if (hourly.isNegative() || daily.isNegative() || monthlyMonths < 1) {
            throw new IllegalArgumentException("counter retention must be positive");
        }
    }

    /** Window starts before this instant are stale for the given type. */
    public Instant cutoff(WindowType type, Instant now) {
        return switch (type) {
            case HOUR -> hourlyCutoff(now);
            case DAY -> dailyCutoff(now);
            case MONTH -> monthlyCutoff(now);
        };
    }

    public Instant hourlyCutoff(Instant now) {
        return now.minus(hourly);
    }

    public Instant dailyCutoff(Instant now) {
        return now.minus(daily);
    }

    /**
     * Start of the UTC month {@code monthlyMonths} before now, less a day so that month windows
     * of zones ahead of UTC starting on the boundary are kept.
     */
    public Instant monthlyCutoff(Instant now) {
        return now.atZone(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.DAYS)
                .withDayOfMonth(1)
                .minusMonths(monthlyMonths)
                .minusDays(1)
                .toInstant();
    }
}
