package com.civicdesk.backend.modules.transition.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RoleTransitionRequest(
        @NotBlank @Size(max = 64) String role,
        @Size(max = 500) String reason
) {
}
