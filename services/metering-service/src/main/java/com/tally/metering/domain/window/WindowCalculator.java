package com.tally.metering.domain.window;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Maps instants to canonical window starts.
 *
 * <p>Windows are truncated in the tenant's zone: a day starts at local midnight and a month on
 * the first at local midnight. Hour windows follow the zone's offset, so an hour starting inside
 * a DST transition is still keyed by its real start instant.
 */
public final class WindowCalculator {

    private WindowCalculator() {
        // utility class
    }

    /**
     * Computes the hour, day and month window starts containing {@code at}.
     *
     * @param at the instant to bucket
     * @param zone zone used to find local boundaries
     * @return the three window keys
     */
    public static WindowKeys keysFor(Instant at, ZoneId zone) {
        ZonedDateTime local = at.atZone(zone);
        ZonedDateTime hour = local.truncatedTo(ChronoUnit.HOURS);
        ZonedDateTime day = local.truncatedTo(ChronoUnit.DAYS);
        ZonedDateTime month = day.withDayOfMonth(1);
        return new WindowKeys(hour.toInstant(), day.toInstant(), month.toInstant(), zone);
    }

    /** Start of the window of the given type containing {@code at}. */
    public static Instant startOf(WindowType type, Instant at, ZoneId zone) {
        return keysFor(at, zone).start(type);
    }
}
