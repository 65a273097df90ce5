package com.civicdesk.backend.modules.authorization.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of registered permissions and the grants attached to roles.
 */
public final class PermissionCatalog {

    private static final PermissionCatalog EMPTY = new PermissionCatalog(Map.of(), Map.of());

    private final Map<String, PermissionDefinition> permissions;
    private final Map<String, Map<String, RoleGrant>> grantsByRole;

    private PermissionCatalog(Map<String, PermissionDefinition> permissions,
                              Map<String, Map<String, RoleGrant>> grantsByRole) {
        this.permissions = permissions;
        this.grantsByRole = grantsByRole;
    }

    public static PermissionCatalog empty() {
        return EMPTY;
    }

    public static PermissionCatalog of(Collection<PermissionDefinition> definitions, Collection<RoleGrant> grants) {
        Map<String, PermissionDefinition> byCodename = new HashMap<>();
        for (PermissionDefinition definition : definitions) {
            if (byCodename.putIfAbsent(definition.codename(), definition) != null) {
                throw RbacViolation.DUPLICATE_CODENAME.exception("permission already exists: " + definition.codename());
            }
        }
        Map<String, Map<String, RoleGrant>> byRole = new HashMap<>();
        for (RoleGrant grant : grants) {
            if (!byCodename.containsKey(grant.codename())) {
                throw RbacViolation.UNKNOWN_PERMISSION.exception("unknown permission: " + grant.codename());
            }
            byRole.computeIfAbsent(grant.roleCode(), key -> new HashMap<>()).put(grant.codename(), grant);
        }
        return new PermissionCatalog(freeze(byCodename), freezeGrants(byRole));
    }

    public Optional<PermissionDefinition> find(String codename) {
        return Optional.ofNullable(codename == null ? null : permissions.get(codename));
    }

    public PermissionDefinition require(String codename) {
        return find(codename).orElseThrow(
                () -> RbacViolation.UNKNOWN_PERMISSION.exception("unknown permission: " + codename));
    }

    public boolean contains(String codename) {
        return codename != null && permissions.containsKey(codename);
    }

    public boolean isActive(String codename) {
        PermissionDefinition definition = codename == null ? null : permissions.get(codename);
        return definition != null && definition.active();
    }

    public List<PermissionDefinition> all() {
        List<PermissionDefinition> sorted = new ArrayList<>(permissions.values());
        sorted.sort(Comparator.comparing(PermissionDefinition::codename));
        return sorted;
    }

    public List<PermissionDefinition> listActive() {
        return all().stream().filter(PermissionDefinition::active).toList();
    }

    public Map<String, RoleGrant> grantsFor(String roleCode) {
        return grantsByRole.getOrDefault(roleCode, Map.of());
    }

    public Optional<RoleGrant> findGrant(String roleCode, String codename) {
        return Optional.ofNullable(grantsFor(roleCode).get(codename));
    }

    public boolean hasActiveGrant(Set<String> roleCodes, String codename) {
        for (String roleCode : roleCodes) {
            RoleGrant grant = grantsFor(roleCode).get(codename);
            if (grant != null && grant.active()) {
                return true;
            }
        }
        return false;
    }

    public boolean hasDelegableGrant(Set<String> roleCodes, String codename) {
        for (String roleCode : roleCodes) {
            RoleGrant grant = grantsFor(roleCode).get(codename);
            if (grant != null && grant.active() && grant.canDelegate()) {
                return true;
            }
        }
        return false;
    }

    public PermissionCatalog withPermission(PermissionDefinition definition) {
        if (permissions.containsKey(definition.codename())) {
            throw RbacViolation.DUPLICATE_CODENAME.exception("permission already exists: " + definition.codename());
        }
        Map<String, PermissionDefinition> next = new HashMap<>(permissions);
        next.put(definition.codename(), definition);
        return new PermissionCatalog(freeze(next), grantsByRole);
    }

    public PermissionCatalog withActive(String codename, boolean active) {
        PermissionDefinition current = require(codename);
        if (current.active() == active) {
            return this;
        }
        Map<String, PermissionDefinition> next = new HashMap<>(permissions);
        next.put(codename, current.withActive(active));
        return new PermissionCatalog(freeze(next), grantsByRole);
    }

    public PermissionCatalog withGrant(RoleGrant grant) {
        require(grant.codename());
        Map<String, Map<String, RoleGrant>> next = new HashMap<>();
        grantsByRole.forEach((role, grants) -> next.put(role, new HashMap<>(grants)));
        next.computeIfAbsent(grant.roleCode(), key -> new HashMap<>()).put(grant.codename(), grant);
        return new PermissionCatalog(permissions, freezeGrants(next));
    }

    private static Map<String, PermissionDefinition> freeze(Map<String, PermissionDefinition> source) {
        return Collections.unmodifiableMap(source);
    }

    private static Map<String, Map<String, RoleGrant>> freezeGrants(Map<String, Map<String, RoleGrant>> source) {
        Map<String, Map<String, RoleGrant>> frozen = new HashMap<>();
        source.forEach((role, grants) -> frozen.put(role, Collections.unmodifiableMap(grants)));
        return Collections.unmodifiableMap(frozen);
    }
}
