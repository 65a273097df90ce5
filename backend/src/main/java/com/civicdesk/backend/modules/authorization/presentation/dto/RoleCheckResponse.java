package com.civicdesk.backend.modules.authorization.presentation.dto;

public record RoleCheckResponse(String role, boolean atLeast) {
}
