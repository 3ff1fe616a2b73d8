package com.tally.metering.api;

import com.tally.metering.api.dto.CreateTenantRequest;
import com.tally.metering.api.dto.TenantResponse;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Tenant creation and lookup. The creator becomes the tenant's single owner. */
@RestController
@RequestMapping("/api/v1/tenants")
public class TenantController {

    private final MembershipService membershipService;

    public TenantController(MembershipService membershipService) {
        this.membershipService = membershipService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TenantResponse createTenant(CallerContext caller, @Valid @RequestBody CreateTenantRequest request) {
        return TenantResponse.from(membershipService.createTenant(caller, request.toNewTenant()));
    }

    @GetMapping("/{tenantId}")
    public TenantResponse getTenant(CallerContext caller, @PathVariable String tenantId) {
        membershipService.requireRole(tenantId, caller, Role.MEMBER, "view tenant");
        return TenantResponse.from(membershipService.getTenant(tenantId));
    }
}
