package com.civicdesk.backend.modules.authorization.domain;

public record PermissionDefinition(
        String codename,
        String name,
        String description,
        String category,
        boolean active,
        boolean builtIn
) {

    public PermissionDefinition withActive(boolean value) {
        return new PermissionDefinition(codename, name, description, category, value, builtIn);
    }
}
