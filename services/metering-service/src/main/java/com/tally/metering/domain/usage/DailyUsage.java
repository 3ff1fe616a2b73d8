package com.tally.metering.domain.usage;

import java.time.LocalDate;

/**
 * Usage of one tenant-local day.
 *
 * @param day the local date
 * @param sessions sessions started
 * @param tokensInput prompt tokens
 * @param tokensOutput completion tokens
 * @param costCents cost in minor currency units
 */
public record DailyUsage(LocalDate day, long sessions, long tokensInput, long tokensOutput, long costCents) {

    public long totalTokens() {
        return tokensInput + tokensOutput;
    }
}
