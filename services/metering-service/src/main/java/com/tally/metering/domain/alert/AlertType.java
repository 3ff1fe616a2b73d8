package com.tally.metering.domain.alert;

/** Kinds of budget alert. Each metric has a warning and a limit variant. */
public enum AlertType {
    HOURLY_SESSIONS_WARNING,
    HOURLY_SESSIONS_LIMIT,
    DAILY_SESSIONS_WARNING,
    DAILY_SESSIONS_LIMIT,
    MONTHLY_TOKENS_WARNING,
    MONTHLY_TOKENS_LIMIT,
    MONTHLY_BUDGET_WARNING,
    MONTHLY_BUDGET_LIMIT
}
