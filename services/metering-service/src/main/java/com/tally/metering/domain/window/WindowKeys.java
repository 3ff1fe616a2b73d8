package com.tally.metering.domain.window;

import java.time.Instant;
import java.time.ZoneId;

/**
 * The three window starts a single instant falls into, for one time zone.
 *
 * @param hourStart start of the hour
 * @param dayStart start of the local day
 * @param monthStart start of the local month
 * @param zone zone the windows were computed in
 */
public record WindowKeys(Instant hourStart, Instant dayStart, Instant monthStart, ZoneId zone) {

    /** Start of the window of the given type. */
    public Instant start(WindowType type) {
        return switch (type) {
            case HOUR -> hourStart;
            case DAY -> dayStart;
            case MONTH -> monthStart;
        };
    }
}
