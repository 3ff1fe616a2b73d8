package com.tally.metering.api.dto;

import java.util.UUID;

public record AuditRecordedResponse(UUID entryId) {}
