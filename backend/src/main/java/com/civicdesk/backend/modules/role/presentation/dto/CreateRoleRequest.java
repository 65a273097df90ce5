package com.civicdesk.backend.modules.role.presentation.dto;

import java.util.Set;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreateRoleRequest(
        @NotBlank @Pattern(regexp = "[a-z][a-z0-9_]{1,63}") String code,
        @NotBlank @Size(max = 100) String name,
        @Size(max = 255) String description,
        @NotNull @Positive Integer level,
        Set<String> parents
) {
}
