package com.civicdesk.backend.modules.role.presentation.dto;

import java.util.List;

import com.civicdesk.backend.modules.role.application.RoleView;

public record RoleResponse(
        String code,
        String name,
        String description,
        int level,
        List<String> parents,
        List<String> closure
) {

    public static RoleResponse from(RoleView view) {
        return new RoleResponse(
                view.code(),
                view.name(),
                view.description(),
                view.level(),
                view.parents().stream().sorted().toList(),
                view.closure().stream().sorted().toList()
        );
    }
}
