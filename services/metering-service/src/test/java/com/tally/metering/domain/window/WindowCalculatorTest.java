package com.tally.metering.domain.window;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WindowCalculator")
class WindowCalculatorTest {

    @Nested
    @DisplayName("in UTC")
    class Utc {

        @Test
        @DisplayName("truncates to the hour, day and first of the month")
        void truncates() {
            WindowKeys keys = WindowCalculator.keysFor(Instant.parse("2026-03-15T10:30:45Z"), ZoneOffset.UTC);

            assertThat(keys.hourStart()).isEqualTo(Instant.parse("2026-03-15T10:00:00Z"));
            assertThat(keys.dayStart()).isEqualTo(Instant.parse("2026-03-15T00:00:00Z"));
            assertThat(keys.monthStart()).isEqualTo(Instant.parse("2026-03-01T00:00:00Z"));
        }

        @Test
        @DisplayName("puts the last second of an hour and the first of the next in different windows")
        void hourBoundary() {
            Instant before = Instant.parse("2026-03-15T10:59:59Z");
            Instant after = Instant.parse("2026-03-15T11:00:00Z");

            assertThat(WindowCalculator.startOf(WindowType.HOUR, before, ZoneOffset.UTC))
                    .isNotEqualTo(WindowCalculator.startOf(WindowType.HOUR, after, ZoneOffset.UTC));
            assertThat(WindowCalculator.startOf(WindowType.DAY, before, ZoneOffset.UTC))
                    .isEqualTo(WindowCalculator.startOf(WindowType.DAY, after, ZoneOffset.UTC));
        }

        @Test
        @DisplayName("rolls the month at midnight of the first")
        void monthBoundary() {
            Instant lastOfFebruary = Instant.parse("2026-02-28T23:59:59Z");
            Instant firstOfMarch = Instant.parse("2026-03-01T00:00:00Z");

            assertThat(WindowCalculator.startOf(WindowType.MONTH, lastOfFebruary, ZoneOffset.UTC))
                    .isEqualTo(Instant.parse("2026-02-01T00:00:00Z"));
            assertThat(WindowCalculator.startOf(WindowType.MONTH, firstOfMarch, ZoneOffset.UTC))
                    .isEqualTo(firstOfMarch);
        }
    }

    @Nested
    @DisplayName("in a tenant zone")
    class TenantZone {

        @Test
        @DisplayName("starts the day at local midnight")
        void localMidnight() {
            ZoneId tokyo = ZoneId.of("Asia/Tokyo");
            WindowKeys keys = WindowCalculator.keysFor(Instant.parse("2026-03-31T16:30:00Z"), tokyo);

            // 01:30 on April 1st in Tokyo
            assertThat(keys.dayStart()).isEqualTo(Instant.parse("2026-03-31T15:00:00Z"));
            assertThat(keys.monthStart()).isEqualTo(Instant.parse("2026-03-31T15:00:00Z"));
            assertThat(keys.zone()).isEqualTo(tokyo);
        }

        @Test
        @DisplayName("keys a DST day by its real start instant")
        void daylightSaving() {
            ZoneId newYork = ZoneId.of("America/New_York");
            // 2026-03-08 is the spring-forward day in New York
            WindowKeys keys = WindowCalculator.keysFor(Instant.parse("2026-03-08T12:00:00Z"), newYork);

            assertThat(keys.dayStart()).isEqualTo(Instant.parse("2026-03-08T05:00:00Z"));
            assertThat(keys.hourStart()).isEqualTo(Instant.parse("2026-03-08T12:00:00Z"));
        }
    }
}
