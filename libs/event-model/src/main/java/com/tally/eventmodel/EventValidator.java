package com.tally.eventmodel;

import java.util.ArrayList;
import java.util.regex.Pattern;

/**
 * Validates {@link ExternalEvent} instances before they reach the idempotency guard.
 *
 * <p>Returns every problem at once in a {@link ValidationResult} rather than failing on the first.
 */
public final class EventValidator {

    /** Longest event id the processed-events table accepts. */
    public static final int MAX_EVENT_ID_LENGTH = 255;

    /** Longest event type the processed-events table accepts. */
    public static final int MAX_EVENT_TYPE_LENGTH = 128;

    private static final Pattern EVENT_TYPE = Pattern.compile("^[A-Za-z0-9_.:-]+$");

    private EventValidator() {
        // utility class
    }

    /**
     * Validates the identifying fields of an external event.
     *
     * @param event the event to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(ExternalEvent event) {
        var errors = new ArrayList<String>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        } else if (event.eventId().length() > MAX_EVENT_ID_LENGTH) {
            errors.add("eventId must be at most " + MAX_EVENT_ID_LENGTH + " characters");
        }

        if (isBlank(event.eventType())) {
            errors.add("eventType must not be null or blank");
        } else if (event.eventType().length() > MAX_EVENT_TYPE_LENGTH) {
            errors.add("eventType must be at most " + MAX_EVENT_TYPE_LENGTH + " characters");
        } else if (!EVENT_TYPE.matcher(event.eventType()).matches()) {
            errors.add("eventType contains unsupported characters: " + event.eventType());
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
