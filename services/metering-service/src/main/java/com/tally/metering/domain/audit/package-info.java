/**
 * Append-only, tamper-evident audit ledger.
 *
 * <p>Every entry is hashed with SHA-256 at insert time over its identifying fields and its
 * before/after values. {@link com.tally.metering.domain.audit.AuditLedger} recomputes the hash
 * to verify one entry or a tenant's whole ledger. Entries are never updated; only the retention
 * purge, run by a system caller, removes them.
 */
package com.tally.metering.domain.audit;
