package com.civicdesk.backend.modules.authorization.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.civicdesk.backend.modules.authorization.application.PermissionExplanation;

public record PermissionExplanationResponse(
        UUID userId,
        String permission,
        String role,
        List<String> roleClosure,
        String decision,
        boolean allowed,
        long snapshotVersion
) {

    public static PermissionExplanationResponse from(PermissionExplanation explanation) {
        return new PermissionExplanationResponse(
                explanation.userId(),
                explanation.codename(),
                explanation.roleCode(),
                explanation.roleClosure().stream().sorted().toList(),
                explanation.decision().name(),
                explanation.allowed(),
                explanation.snapshotVersion()
        );
    }
}
