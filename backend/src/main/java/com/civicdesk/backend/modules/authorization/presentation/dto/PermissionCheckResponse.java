package com.civicdesk.backend.modules.authorization.presentation.dto;

public record PermissionCheckResponse(String permission, boolean allowed) {
}
