package com.civicdesk.backend.modules.transition.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.civicdesk.backend.modules.transition.application.RoleTransitionResult;

public record RoleTransitionResponse(
        UUID userId,
        String previousRole,
        String role,
        UUID changedBy,
        OffsetDateTime changedAt
) {

    public static RoleTransitionResponse from(RoleTransitionResult result) {
        return new RoleTransitionResponse(result.userId(), result.previousRole(), result.newRole(),
                result.changedBy(), result.changedAt());
    }
}
