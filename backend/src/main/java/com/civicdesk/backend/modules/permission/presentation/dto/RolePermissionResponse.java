package com.civicdesk.backend.modules.permission.presentation.dto;

import com.civicdesk.backend.modules.authorization.domain.RoleGrant;

public record RolePermissionResponse(String role, String codename, boolean active, boolean canDelegate) {

    public static RolePermissionResponse from(RoleGrant grant) {
        return new RolePermissionResponse(grant.roleCode(), grant.codename(), grant.active(), grant.canDelegate());
    }
}
