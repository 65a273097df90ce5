package com.civicdesk.backend.modules.permission.presentation.dto;

public record RolePermissionRequest(Boolean active, Boolean canDelegate) {

    public boolean activeOrDefault() {
        return active == null || active;
    }

    public boolean canDelegateOrDefault() {
        return canDelegate != null && canDelegate;
    }
}
