package com.tally.metering.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;

/**
 * @param email address to invite
 * @param role "admin" or "member" (default)
 * @param ttl ISO-8601 validity, e.g. {@code P3D}; the configured default when absent
 */
public record CreateInvitationRequest(@NotBlank @Email @Size(max = 320) String email, String role, Duration ttl) {}
