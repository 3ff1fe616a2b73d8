package com.tally.metering.api.dto;

import com.tally.metering.domain.usage.ModelUsage;
import jakarta.validation.constraints.PositiveOrZero;

public record ModelUsageRequest(
        @PositiveOrZero long tokensInput, @PositiveOrZero long tokensOutput, @PositiveOrZero long costCents) {

    public ModelUsage toModelUsage() {
        return new ModelUsage(tokensInput, tokensOutput, costCents);
    }
}
