package com.tally.metering.infrastructure.persistence.memory;

import com.tally.metering.domain.audit.AuditEntry;
import com.tally.metering.domain.audit.AuditLedgerStore;
import com.tally.metering.domain.error.IntegrityViolationException;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

/** Append-only audit entries. An id can be written once; there is no update path. */
public class InMemoryAuditLedgerStore implements AuditLedgerStore {

    private final ConcurrentMap<UUID, AuditEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void insert(AuditEntry entry) {
        if (entries.putIfAbsent(entry.id(), entry) != null) {
            throw new IntegrityViolationException("audit entry " + entry.id() + " already exists");
        }
    }

    @Override
    public Optional<AuditEntry> find(UUID id) {
        return Optional.ofNullable(entries.get(id));
    }

    @Override
    public void forEachByTenant(String tenantId, Consumer<AuditEntry> consumer) {
        entries.values().stream()
                .filter(entry -> entry.tenantId().equals(tenantId))
                .sorted(Comparator.comparing(AuditEntry::occurredAt).thenComparing(AuditEntry::id))
                .forEach(consumer);
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        for (AuditEntry entry : entries.values()) {
            if (entry.occurredAt().isBefore(cutoff) && entries.remove(entry.id(), entry)) {
                removed++;
            }
        }
        return removed;
    }
}
