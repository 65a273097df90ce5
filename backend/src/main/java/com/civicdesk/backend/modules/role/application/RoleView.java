package com.civicdesk.backend.modules.role.application;

import java.util.Set;

import com.civicdesk.backend.modules.authorization.domain.RoleGraph;
import com.civicdesk.backend.modules.authorization.domain.RoleNode;

public record RoleView(
        String code,
        String name,
        String description,
        int level,
        Set<String> parents,
        Set<String> closure
) {

    public static RoleView of(RoleGraph graph, RoleNode node) {
        return new RoleView(node.code(), node.name(), node.description(), node.level(), node.parents(),
                graph.closure(node.code()));
    }
}
