package com.civicdesk.backend.modules.permission.presentation.dto;

import com.civicdesk.backend.modules.authorization.domain.PermissionDefinition;

public record PermissionResponse(
        String codename,
        String name,
        String description,
        String category,
        boolean active,
        boolean builtIn
) {

    public static PermissionResponse from(PermissionDefinition definition) {
        return new PermissionResponse(
                definition.codename(),
                definition.name(),
                definition.description(),
                definition.category(),
                definition.active(),
                definition.builtIn()
        );
    }
}
