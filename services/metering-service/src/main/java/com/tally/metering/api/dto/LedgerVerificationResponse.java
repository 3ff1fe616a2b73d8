package com.tally.metering.api.dto;

import com.tally.metering.domain.audit.LedgerVerification;

public record LedgerVerificationResponse(
        String tenantId, long total, long valid, long invalid, long missingHash, boolean intact) {

    public static LedgerVerificationResponse from(LedgerVerification verification) {
        return new LedgerVerificationResponse(
                verification.tenantId(),
                verification.total(),
                verification.valid(),
                verification.invalid(),
                verification.missingHash(),
                verification.intact());
    }
}
