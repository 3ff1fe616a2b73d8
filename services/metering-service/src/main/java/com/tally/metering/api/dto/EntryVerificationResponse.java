package com.tally.metering.api.dto;

import com.tally.metering.domain.audit.EntryVerification;
import java.util.UUID;

public record EntryVerificationResponse(UUID entryId, boolean valid, String storedHash, String computedHash) {

    public static EntryVerificationResponse from(EntryVerification verification) {
        return new EntryVerificationResponse(
                verification.entryId(), verification.valid(), verification.storedHash(), verification.computedHash());
    }
}
