package com.tally.metering.domain.quota;

import com.tally.metering.domain.alert.AlertType;
import com.tally.metering.domain.window.WindowType;

/** A quota-limited quantity, the window it is counted in and the alerts it can raise. */
public enum Metric {
    HOURLY_SESSIONS(WindowType.HOUR, AlertType.HOURLY_SESSIONS_WARNING, AlertType.HOURLY_SESSIONS_LIMIT),
    DAILY_SESSIONS(WindowType.DAY, AlertType.DAILY_SESSIONS_WARNING, AlertType.DAILY_SESSIONS_LIMIT),
    MONTHLY_TOKENS(WindowType.MONTH, AlertType.MONTHLY_TOKENS_WARNING, AlertType.MONTHLY_TOKENS_LIMIT),
    MONTHLY_COST(WindowType.MONTH, AlertType.MONTHLY_BUDGET_WARNING, AlertType.MONTHLY_BUDGET_LIMIT);

    private final WindowType window;
    private final AlertType warningAlert;
    private final AlertType limitAlert;

    Metric(WindowType window, AlertType warningAlert, AlertType limitAlert) {
        this.window = window;
        this.warningAlert = warningAlert;
        this.limitAlert = limitAlert;
    }

    public WindowType window() {
        return window;
    }

    public AlertType warningAlert() {
        return warningAlert;
    }

    public AlertType limitAlert() {
        return limitAlert;
    }

    /** Reads this metric's value out of a set of totals. */
    public long currentValue(UsageTotals totals) {
        CounterTotals counter = totals.of(window);
        return switch (this) {
            case HOURLY_SESSIONS, DAILY_SESSIONS -> counter.sessions();
            case MONTHLY_TOKENS -> counter.tokens();
            case MONTHLY_COST -> counter.costCents();
        };
    }
}
