package com.tally.metering.domain.idempotency;

import com.tally.eventmodel.ExternalEvent;
import java.util.Set;

/** Applies the side effects of one or more external event types. */
public interface ExternalEventHandler {

    /** Event types this handler is registered for. Empty for a fallback handler. */
    Set<String> eventTypes();

    void handle(ExternalEvent event);
}
