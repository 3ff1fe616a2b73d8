package com.tally.metering.api.dto;

import com.tally.metering.domain.membership.NewTenant;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTenantRequest(@NotBlank @Size(max = 200) String name, String tier, String timeZone) {

    public NewTenant toNewTenant() {
        return new NewTenant(name, tier, timeZone);
    }
}
