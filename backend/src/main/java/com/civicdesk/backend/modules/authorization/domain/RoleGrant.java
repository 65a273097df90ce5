package com.civicdesk.backend.modules.authorization.domain;

public record RoleGrant(String roleCode, String codename, boolean active, boolean canDelegate) {
}
