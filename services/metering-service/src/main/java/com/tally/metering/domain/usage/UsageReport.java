package com.tally.metering.domain.usage;

import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.domain.quota.UsageDelta;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Usage reported after an AI invocation.
 *
 * @param sessions sessions started (usually 0 or 1)
 * @param tokensInput prompt tokens
 * @param tokensOutput completion tokens
 * @param costCents estimated cost in minor currency units
 * @param sessionType kind of session, defaults to CHAT
 * @param conversationRef the conversation the usage belongs to, if any
 * @param models per-model breakdown, may be empty
 */
public record UsageReport(
        long sessions,
        long tokensInput,
        long tokensOutput,
        long costCents,
        SessionType sessionType,
        String conversationRef,
        Map<String, ModelUsage> models) {

    static final int MAX_CONVERSATION_REF_LENGTH = 128;

    public UsageReport {
        if (sessionType == null) {
            sessionType = SessionType.CHAT;
        }
        models = models == null ? Map.of() : Map.copyOf(models);
    }

    public static UsageReport of(long sessions, long tokens, long costCents) {
        return new UsageReport(sessions, tokens, 0, costCents, SessionType.CHAT, null, Map.of());
    }

    public List<String> violations() {
        var errors = new ArrayList<String>();
        if (sessions < 0 || tokensInput < 0 || tokensOutput < 0 || costCents < 0) {
            errors.add("sessions, tokens and cost must be >= 0");
        }
        if (conversationRef != null && conversationRef.length() > MAX_CONVERSATION_REF_LENGTH) {
            errors.add("conversationRef must be at most " + MAX_CONVERSATION_REF_LENGTH + " characters");
        }
        models.forEach(
                (model, usage) -> {
                    if (model.isBlank()) {
                        errors.add("model names must not be blank");
                    } else if (usage.hasNegative()) {
                        errors.add("usage of model '" + model + "' must be >= 0");
                    }
                });
        return errors;
    }

    /** The counter delta for this report. */
    public UsageDelta toDelta() {
        List<String> errors = violations();
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return new UsageDelta(sessions, Math.addExact(tokensInput, tokensOutput), costCents);
    }
}
