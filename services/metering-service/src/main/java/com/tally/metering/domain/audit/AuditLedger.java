package com.tally.metering.domain.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tally.metering.domain.error.NotFoundException;
import com.tally.metering.domain.error.ValidationException;
import com.tally.observability.MetricFactory;
import com.tally.observability.SensitiveDataRedactor;
import com.tally.security.AccessDeniedException;
import com.tally.security.CallerContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only audit ledger with per-entry integrity hashes.
 *
 * <p>Entries are hashed once, at write time, by {@link AuditHasher}. Nothing in this class can
 * change a stored entry; removal is limited to {@link #purgeExpired}, which only system callers
 * may run. Verification reports mismatches and never repairs them.
 */
public class AuditLedger {

    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

    static final int MAX_TARGET_REF_LENGTH = 256;

    private final AuditLedgerStore store;
    private final AuditActionTypes actionTypes;
    private final SensitiveDataRedactor redactor;
    private final ObjectMapper objectMapper;
    private final MetricFactory metrics;
    private final Clock clock;
    private final Duration retention;

    public AuditLedger(
            AuditLedgerStore store,
            AuditActionTypes actionTypes,
            SensitiveDataRedactor redactor,
            ObjectMapper objectMapper,
            MetricFactory metrics,
            Clock clock,
            Duration retention) {
        this.store = store;
        this.actionTypes = actionTypes;
        this.redactor = redactor;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.clock = clock;
        this.retention = retention;
    }

    /**
     * Writes an entry and returns its id.
     *
     * @throws ValidationException if the event is malformed or its namespace is not allowed
     */
    public UUID record(AuditEvent event) {
        validate(event);
        AuditEntry entry =
                new AuditEntry(
                        UUID.randomUUID(),
                        event.tenantId(),
                        event.actorId(),
                        event.actionType(),
                        event.targetRef(),
                        event.description(),
                        toJson(event.before()),
                        toJson(event.after()),
                        // timestamptz precision
                        clock.instant().truncatedTo(ChronoUnit.MICROS),
                        null);
        AuditEntry hashed = entry.withHash(AuditHasher.hash(entry));
        store.insert(hashed);
        metrics.counter("tally.audit.entries", "Audit entries written").increment();
        log.debug("Audit entry {} recorded: {} on {}", hashed.id(), hashed.actionType(), hashed.targetRef());
        return hashed.id();
    }

    /** Recomputes one entry's hash. */
    @Transactional(readOnly = true)
    public EntryVerification verifyEntry(UUID entryId) {
        AuditEntry entry =
                store.find(entryId).orElseThrow(() -> new NotFoundException("audit entry", String.valueOf(entryId)));
        return report(entry);
    }

    /** As {@link #verifyEntry(UUID)}, treating entries of other tenants as missing. */
    @Transactional(readOnly = true)
    public EntryVerification verifyEntry(String tenantId, UUID entryId) {
        AuditEntry entry =
                store.find(entryId)
                        .filter(found -> found.tenantId().equals(tenantId))
                        .orElseThrow(() -> new NotFoundException("audit entry", String.valueOf(entryId)));
        return report(entry);
    }

    private EntryVerification report(AuditEntry entry) {
        UUID entryId = entry.id();
        EntryVerification result = verify(entry);
        if (!result.valid()) {
            log.warn(
                    "Audit entry {} failed verification (stored={}, computed={})",
                    entryId, result.storedHash(), result.computedHash());
            metrics.counter("tally.audit.integrity.mismatches", "Audit entries failing verification")
                    .increment();
        }
        return result;
    }

    /** Streams and re-hashes every entry of a tenant. */
    @Transactional(readOnly = true)
    public LedgerVerification verifyTenantLedger(String tenantId) {
        var total = new AtomicLong();
        var valid = new AtomicLong();
        var invalid = new AtomicLong();
        var missing = new AtomicLong();
        store.forEachByTenant(
                tenantId,
                entry -> {
                    total.incrementAndGet();
                    if (entry.integrityHash() == null || entry.integrityHash().isBlank()) {
                        missing.incrementAndGet();
                    } else if (verify(entry).valid()) {
                        valid.incrementAndGet();
                    } else {
                        invalid.incrementAndGet();
                    }
                });
        var result =
                new LedgerVerification(tenantId, total.get(), valid.get(), invalid.get(), missing.get());
        if (result.intact()) {
            log.info("Ledger of tenant {} verified: {} entries intact", tenantId, result.total());
        } else {
            log.warn(
                    "Ledger of tenant {} has {} invalid and {} unhashed entries out of {}",
                    tenantId, result.invalid(), result.missingHash(), result.total());
            metrics.counter("tally.audit.integrity.mismatches", "Audit entries failing verification")
                    .increment(result.invalid());
        }
        return result;
    }

    /**
     * Deletes entries older than the retention horizon.
     *
     * @param caller must be a system caller
     * @return number of entries removed
     * @throws AccessDeniedException for any non-system caller
     */
    @Transactional
    public int purgeExpired(CallerContext caller) {
        if (!caller.isSystem()) {
            log.warn("Audit purge refused for non-system caller {}", caller.userId());
            throw new AccessDeniedException(
                    caller.userId(), "purge audit ledger", "retention purge is restricted to system callers");
        }
        Instant cutoff = clock.instant().minus(retention);
        int removed = store.purgeOlderThan(cutoff);
        log.info("Audit retention purge removed {} entries older than {}", removed, cutoff);
        return removed;
    }

    private EntryVerification verify(AuditEntry entry) {
        String computed = AuditHasher.hash(entry);
        String stored = entry.integrityHash();
        return new EntryVerification(entry.id(), stored != null && stored.equals(computed), stored, computed);
    }

    private void validate(AuditEvent event) {
        var errors = new ArrayList<String>();
        if (event.tenantId() == null || event.tenantId().isBlank()) {
            errors.add("tenantId must not be blank");
        }
        if (event.actorId() == null || event.actorId().isBlank()) {
            errors.add("actorId must not be blank");
        }
        actionTypes.rejectionReason(event.actionType()).ifPresent(errors::add);
        if (event.targetRef() != null && event.targetRef().length() > MAX_TARGET_REF_LENGTH) {
            errors.add("targetRef must be at most " + MAX_TARGET_REF_LENGTH + " characters");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private String toJson(Map<String, ?> value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(redactor.redact(value));
        } catch (JsonProcessingException e) {
            throw new ValidationException("audit value is not serializable: " + e.getOriginalMessage());
        }
    }
}
