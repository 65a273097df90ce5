package com.civicdesk.backend.modules.override.presentation.dto;

import java.time.OffsetDateTime;

import com.civicdesk.backend.modules.authorization.domain.OverridePolarity;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record OverrideRequest(
        @NotNull OverridePolarity polarity,
        @NotBlank @Size(max = 500) String reason,
        OffsetDateTime expiresAt
) {
}
