package com.tally.metering.api.dto;

import jakarta.validation.constraints.NotBlank;

public record TransferOwnershipRequest(@NotBlank String newOwnerId) {}
