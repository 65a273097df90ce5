package com.civicdesk.backend.modules.permission.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterPermissionRequest(
        @NotBlank @Size(max = 100) String codename,
        @NotBlank @Size(max = 150) String name,
        @Size(max = 500) String description,
        @Size(max = 50) String category
) {
}
