package com.civicdesk.backend.modules.authorization.presentation.dto;

import java.util.List;
import java.util.UUID;

public record EffectivePermissionsResponse(
        UUID userId,
        List<EffectivePermissionResponse> permissions
) {
}
