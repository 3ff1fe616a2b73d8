package com.tally.metering.api.dto;

import jakarta.validation.constraints.NotBlank;

/** @param role "admin" or "member" */
public record ChangeRoleRequest(@NotBlank String role) {}
