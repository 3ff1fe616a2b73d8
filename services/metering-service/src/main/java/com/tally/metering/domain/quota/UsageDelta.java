package com.tally.metering.domain.quota;

import com.tally.metering.domain.error.ValidationException;
import java.util.ArrayList;

/**
 * Amounts added to every window counter by one usage report.
 *
 * @param sessions sessions started
 * @param tokens tokens consumed (input plus output)
 * @param costCents cost in minor currency units
 */
public record UsageDelta(long sessions, long tokens, long costCents) {

    public UsageDelta {
        var errors = new ArrayList<String>();
        if (sessions < 0) {
            errors.add("sessions must be >= 0");
        }
        if (tokens < 0) {
            errors.add("tokens must be >= 0");
        }
        if (costCents < 0) {
            errors.add("costCents must be >= 0");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    public boolean isZero() {
        return sessions == 0 && tokens == 0 && costCents == 0;
    }
}
