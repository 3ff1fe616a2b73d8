package com.tally.metering.domain.audit;

import java.util.UUID;

/**
 * Result of re-hashing a single entry.
 *
 * @param entryId the entry
 * @param valid stored hash is present and equals the recomputed one
 * @param storedHash hash stored at insert time (null if missing)
 * @param computedHash hash recomputed from the stored fields
 */
public record EntryVerification(UUID entryId, boolean valid, String storedHash, String computedHash) {}
