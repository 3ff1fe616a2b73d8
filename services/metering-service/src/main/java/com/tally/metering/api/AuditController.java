package com.tally.metering.api;

import com.tally.metering.api.dto.AuditEventRequest;
import com.tally.metering.api.dto.AuditRecordedResponse;
import com.tally.metering.api.dto.EntryVerificationResponse;
import com.tally.metering.api.dto.LedgerVerificationResponse;
import com.tally.metering.domain.audit.AuditEvent;
import com.tally.metering.domain.audit.AuditLedger;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Append-only ledger access. Entries are recorded with the caller as actor and can only be
 * verified, never edited.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/audit")
public class AuditController {

    private final AuditLedger auditLedger;
    private final MembershipService membershipService;

    public AuditController(AuditLedger auditLedger, MembershipService membershipService) {
        this.auditLedger = auditLedger;
        this.membershipService = membershipService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public AuditRecordedResponse record(
            CallerContext caller, @PathVariable String tenantId, @Valid @RequestBody AuditEventRequest request) {
        membershipService.requireRole(tenantId, caller, Role.MEMBER, "record audit event");
        UUID id =
                auditLedger.record(
                        new AuditEvent(
                                tenantId,
                                caller.userId(),
                                request.actionType(),
                                request.targetRef(),
                                request.description(),
                                request.before(),
                                request.after()));
        return new AuditRecordedResponse(id);
    }

    @GetMapping("/{entryId}/verification")
    public EntryVerificationResponse verifyEntry(
            CallerContext caller, @PathVariable String tenantId, @PathVariable UUID entryId) {
        membershipService.requireRole(tenantId, caller, Role.ADMIN, "verify audit entry");
        return EntryVerificationResponse.from(auditLedger.verifyEntry(tenantId, entryId));
    }

    @GetMapping("/verification")
    public LedgerVerificationResponse verifyLedger(CallerContext caller, @PathVariable String tenantId) {
        membershipService.requireRole(tenantId, caller, Role.ADMIN, "verify audit ledger");
        return LedgerVerificationResponse.from(auditLedger.verifyTenantLedger(tenantId));
    }
}
