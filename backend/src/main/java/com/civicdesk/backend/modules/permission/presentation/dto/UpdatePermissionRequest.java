package com.civicdesk.backend.modules.permission.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record UpdatePermissionRequest(@NotNull Boolean active) {
}
