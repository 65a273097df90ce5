package com.civicdesk.backend.modules.authorization.domain;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

public record RoleNode(String code, String name, String description, int level, Set<String> parents) {

    public RoleNode {
        Objects.requireNonNull(code, "code");
        parents = parents == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(parents));
    }

    public RoleNode withParent(String parent) {
        Set<String> next = new TreeSet<>(parents);
        next.add(parent);
        return new RoleNode(code, name, description, level, next);
    }

    public RoleNode withoutParent(String parent) {
        Set<String> next = new TreeSet<>(parents);
        next.remove(parent);
        return new RoleNode(code, name, description, level, next);
    }
}
