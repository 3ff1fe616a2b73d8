package com.tally.metering.api;

import com.tally.metering.api.dto.CreateInvitationRequest;
import com.tally.metering.api.dto.InvitationResponse;
import com.tally.metering.api.dto.MemberResponse;
import com.tally.metering.domain.membership.InvitationService;
import com.tally.security.CallerContext;
import com.tally.security.Role;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
public class InvitationController {

    private final InvitationService invitationService;

    public InvitationController(InvitationService invitationService) {
        this.invitationService = invitationService;
    }

    @PostMapping("/tenants/{tenantId}/invitations")
    @ResponseStatus(HttpStatus.CREATED)
    public InvitationResponse createInvitation(
            CallerContext caller,
            @PathVariable String tenantId,
            @Valid @RequestBody CreateInvitationRequest request) {
        Role role = request.role() == null ? Role.MEMBER : MembershipController.parseRole(request.role());
        return InvitationResponse.from(
                invitationService.createInvitation(tenantId, caller, request.email(), role, request.ttl()));
    }

    @PostMapping("/invitations/{token}/accept")
    public MemberResponse acceptInvitation(CallerContext caller, @PathVariable UUID token) {
        return MemberResponse.from(invitationService.acceptInvitation(token, caller));
    }
}
