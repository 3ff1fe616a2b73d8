package com.tally.metering.domain.audit;

/**
 * Aggregate verification of a tenant's ledger. {@code total = valid + invalid + missingHash}.
 */
public record LedgerVerification(
        String tenantId, long total, long valid, long invalid, long missingHash) {

    public boolean intact() {
        return invalid == 0 && missingHash == 0;
    }
}
