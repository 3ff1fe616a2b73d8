package com.tally.metering.domain.billing;

import com.tally.eventmodel.EventValidator;
import com.tally.eventmodel.ExternalEvent;
import com.tally.eventmodel.ValidationResult;
import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.domain.idempotency.ExternalEventGuard;
import com.tally.metering.domain.idempotency.ExternalEventHandler;
import com.tally.metering.domain.idempotency.ProcessingOutcome;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.transaction.annotation.Transactional;

/**
 * Entry point for billing provider callbacks.
 *
 * <p>Events are dispatched by type to registered handlers; types nobody handles go to the
 * fallback handler. Either way the event id is claimed, so a redelivery is a no-op.
 */
public class BillingEventService {

    private final ExternalEventGuard guard;
    private final Map<String, ExternalEventHandler> handlers = new HashMap<>();
    private final ExternalEventHandler fallback;

    public BillingEventService(
            ExternalEventGuard guard, List<ExternalEventHandler> handlers, ExternalEventHandler fallback) {
        this.guard = guard;
        this.fallback = fallback;
        for (ExternalEventHandler handler : handlers) {
            for (String type : handler.eventTypes()) {
                ExternalEventHandler previous = this.handlers.putIfAbsent(type, handler);
                if (previous != null && previous != handler) {
                    throw new IllegalStateException("two handlers registered for event type " + type);
                }
            }
        }
    }

    /**
     * Applies an event once.
     *
     * @throws ValidationException if the event has no usable id or type
     */
    @Transactional
    public ProcessingOutcome processExternalEvent(ExternalEvent event) {
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            throw new ValidationException(validation.errors());
        }
        return guard.process(event, handlerFor(event.eventType()));
    }

    ExternalEventHandler handlerFor(String eventType) {
        return handlers.getOrDefault(eventType, fallback);
    }
}
