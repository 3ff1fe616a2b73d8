package com.tally.metering.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Map;

/**
 * An action to record in the tenant's ledger. The actor is the caller.
 *
 * @param actionType {@code namespace:action}
 */
public record AuditEventRequest(
        @NotBlank @Size(max = 128) String actionType,
        @Size(max = 256) String targetRef,
        String description,
        Map<String, Object> before,
        Map<String, Object> after) {}
