package com.civicdesk.backend.modules.override.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.civicdesk.backend.modules.override.application.OverrideView;

public record OverrideResponse(
        UUID userId,
        String codename,
        String polarity,
        String reason,
        OffsetDateTime expiresAt,
        UUID createdBy,
        boolean effective
) {

    public static OverrideResponse from(OverrideView view) {
        return new OverrideResponse(
                view.userId(),
                view.codename(),
                view.polarity().name(),
                view.reason(),
                view.expiresAt(),
                view.createdBy(),
                view.effective()
        );
    }
}
