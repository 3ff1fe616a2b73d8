package com.tally.metering.domain.audit;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Append-only storage for audit entries. There is deliberately no update operation.
 */
public interface AuditLedgerStore {

    void insert(AuditEntry entry);

    Optional<AuditEntry> find(UUID id);

    /** Streams a tenant's entries in time order without loading them all at once. */
    void forEachByTenant(String tenantId, Consumer<AuditEntry> consumer);

    /**
     * Privileged retention path: deletes entries that occurred before {@code cutoff}.
     *
     * @return number of entries removed
     */
    int purgeOlderThan(Instant cutoff);
}
