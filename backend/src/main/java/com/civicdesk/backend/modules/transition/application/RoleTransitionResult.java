package com.civicdesk.backend.modules.transition.application;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RoleTransitionResult(
        UUID userId,
        String previousRole,
        String newRole,
        UUID changedBy,
        OffsetDateTime changedAt
) {
}
