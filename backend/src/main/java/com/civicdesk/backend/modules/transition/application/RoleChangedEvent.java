package com.civicdesk.backend.modules.transition.application;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Published after a role transition has committed.
 */
public record RoleChangedEvent(
        UUID userId,
        String previousRole,
        String newRole,
        UUID changedBy,
        String reason,
        OffsetDateTime changedAt
) {
}
