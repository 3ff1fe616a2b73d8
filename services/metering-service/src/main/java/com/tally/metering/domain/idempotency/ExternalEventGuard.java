package com.tally.metering.domain.idempotency;

import com.tally.eventmodel.ExternalEvent;
import com.tally.observability.MetricFactory;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a handler at most once per successfully completed event id.
 *
 * <p>The id is claimed before the handler runs. A handler failure releases the claim and
 * rethrows, so a redelivery can still succeed. Inside a database transaction the rollback undoes
 * the claim as well.
 */
public class ExternalEventGuard {

    private static final Logger log = LoggerFactory.getLogger(ExternalEventGuard.class);

    private final ProcessedEventStore store;
    private final MetricFactory metrics;
    private final Clock clock;

    public ExternalEventGuard(ProcessedEventStore store, MetricFactory metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ProcessingOutcome process(ExternalEvent event, ExternalEventHandler handler) {
        if (!store.markProcessed(event.eventId(), event.eventType(), clock.instant())) {
            log.warn("Event {} ({}) already processed; skipping", event.eventId(), event.eventType());
            metrics.counter("tally.events.duplicates", "Redelivered external events skipped").increment();
            return ProcessingOutcome.duplicate(event.eventId(), event.eventType());
        }
        try {
            handler.handle(event);
        } catch (RuntimeException e) {
            store.release(event.eventId());
            log.error("Handler failed for event {} ({}); released for retry", event.eventId(), event.eventType(), e);
            throw e;
        }
        metrics.counter("tally.events.processed", "External events applied")
                .increment();
        log.info("Event {} ({}) processed", event.eventId(), event.eventType());
        return ProcessingOutcome.applied(event.eventId(), event.eventType());
    }
}
