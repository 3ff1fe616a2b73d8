package com.tally.metering.domain.quota;

/**
 * Running totals of one window counter.
 *
 * @param sessions session count
 * @param tokens token count
 * @param costCents cost in minor currency units
 */
public record CounterTotals(long sessions, long tokens, long costCents) {

    public static final CounterTotals ZERO = new CounterTotals(0, 0, 0);

    public CounterTotals plus(UsageDelta delta) {
        return new CounterTotals(
                sessions + delta.sessions(), tokens + delta.tokens(), costCents + delta.costCents());
    }
}
