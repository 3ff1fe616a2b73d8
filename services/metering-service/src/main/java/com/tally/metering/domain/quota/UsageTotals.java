package com.tally.metering.domain.quota;

import com.tally.metering.domain.window.WindowKeys;
import com.tally.metering.domain.window.WindowType;

/**
 * Counter totals of the current hour, day and month windows for one tenant.
 *
 * @param windows the window keys the totals belong to
 * @param hour totals of the hour window
 * @param day totals of the day window
 * @param month totals of the month window
 */
public record UsageTotals(WindowKeys windows, CounterTotals hour, CounterTotals day, CounterTotals month) {

    public static UsageTotals empty(WindowKeys windows) {
        return new UsageTotals(windows, CounterTotals.ZERO, CounterTotals.ZERO, CounterTotals.ZERO);
    }

    public CounterTotals of(WindowType type) {
        return switch (type) {
            case HOUR -> hour;
            case DAY -> day;
            case MONTH -> month;
        };
    }

    public long hourlySessions() {
        return hour.sessions();
    }

    public long dailySessions() {
        return day.sessions();
    }

    public long monthlyTokens() {
        return month.tokens();
    }

    public long monthlyCostCents() {
        return month.costCents();
    }
}
