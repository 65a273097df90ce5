package com.civicdesk.backend.modules.authorization.presentation.dto;

import com.civicdesk.backend.modules.authorization.domain.PermissionDefinition;

public record EffectivePermissionResponse(
        String codename,
        String name,
        String category
) {

    public static EffectivePermissionResponse from(PermissionDefinition definition) {
        return new EffectivePermissionResponse(definition.codename(), definition.name(), definition.category());
    }
}
