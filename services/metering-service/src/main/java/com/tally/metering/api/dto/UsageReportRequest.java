package com.tally.metering.api.dto;

import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.domain.usage.ModelUsage;
import com.tally.metering.domain.usage.SessionType;
import com.tally.metering.domain.usage.UsageReport;
import jakarta.validation.Valid;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Usage of one AI invocation.
 *
 * @param sessions sessions started
 * @param tokensInput prompt tokens
 * @param tokensOutput completion tokens
 * @param costCents estimated cost in minor currency units
 * @param sessionType council, chat (default), triage or document
 * @param conversationRef conversation the usage belongs to
 * @param models per-model breakdown
 */
public record UsageReportRequest(
        @PositiveOrZero long sessions,
        @PositiveOrZero long tokensInput,
        @PositiveOrZero long tokensOutput,
        @PositiveOrZero long costCents,
        String sessionType,
        @Size(max = 128) String conversationRef,
        Map<String, @Valid ModelUsageRequest> models) {

    public UsageReport toReport() {
        var breakdown = new LinkedHashMap<String, ModelUsage>();
        if (models != null) {
            models.forEach((model, usage) -> {
                if (usage != null) {
                    breakdown.put(model, usage.toModelUsage());
                }
            });
        }
        return new UsageReport(
                sessions, tokensInput, tokensOutput, costCents, parseSessionType(), conversationRef, breakdown);
    }

    private SessionType parseSessionType() {
        if (sessionType == null || sessionType.isBlank()) {
            return SessionType.CHAT;
        }
        try {
            return SessionType.valueOf(sessionType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown sessionType '" + sessionType + "'");
        }
    }
}
