package com.tally.metering.domain.usage;

/**
 * One model's contribution to a session.
 *
 * @param tokensInput prompt tokens
 * @param tokensOutput completion tokens
 * @param costCents estimated cost in minor currency units
 */
public record ModelUsage(long tokensInput, long tokensOutput, long costCents) {

    public boolean hasNegative() {
        return tokensInput < 0 || tokensOutput < 0 || costCents < 0;
    }
}
