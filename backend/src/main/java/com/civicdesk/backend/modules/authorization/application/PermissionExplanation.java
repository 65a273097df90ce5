package com.civicdesk.backend.modules.authorization.application;

import java.util.Set;
import java.util.UUID;

import com.civicdesk.backend.modules.authorization.domain.Decision;

public record PermissionExplanation(
        UUID userId,
        String codename,
        String roleCode,
        Set<String> roleClosure,
        Decision decision,
        long snapshotVersion
) {

    public boolean allowed() {
        return decision.allowed();
    }
}
