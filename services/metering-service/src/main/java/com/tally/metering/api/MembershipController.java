package com.tally.metering.api;

import com.tally.metering.api.dto.ChangeRoleRequest;
import com.tally.metering.api.dto.MemberResponse;
import com.tally.metering.api.dto.TransferOwnershipRequest;
import com.tally.metering.domain.error.ValidationException;
import com.tally.metering.domain.membership.MembershipService;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
public class MembershipController {

    private final MembershipService membershipService;

    public MembershipController(MembershipService membershipService) {
        this.membershipService = membershipService;
    }

    @GetMapping("/members")
    public List<MemberResponse> listMembers(CallerContext caller, @PathVariable String tenantId) {
        return membershipService.listMembers(tenantId, caller).stream().map(MemberResponse::from).toList();
    }

    @PatchMapping("/members/{userId}")
    public MemberResponse changeRole(
            CallerContext caller,
            @PathVariable String tenantId,
            @PathVariable String userId,
            @Valid @RequestBody ChangeRoleRequest request) {
        return MemberResponse.from(
                membershipService.changeMemberRole(tenantId, caller, userId, parseRole(request.role())));
    }

    @DeleteMapping("/members/{userId}")
    public ResponseEntity<Void> removeMember(
            CallerContext caller, @PathVariable String tenantId, @PathVariable String userId) {
        membershipService.removeMember(tenantId, caller, userId);
        return ResponseEntity.noContent().build();
    }

    /** Owner hands the tenant to an existing member; both rows change in one transaction. */
    @PostMapping("/ownership-transfer")
    public MemberResponse transferOwnership(
            CallerContext caller,
            @PathVariable String tenantId,
            @Valid @RequestBody TransferOwnershipRequest request) {
        return MemberResponse.from(membershipService.transferOwnership(tenantId, caller, request.newOwnerId()));
    }

    static Role parseRole(String value) {
        return Role.fromString(value).orElseThrow(() -> new ValidationException("unknown role '" + value + "'"));
    }
}
