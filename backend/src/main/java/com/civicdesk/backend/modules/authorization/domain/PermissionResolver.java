package com.civicdesk.backend.modules.authorization.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

import com.civicdesk.backend.global.config.RbacProperties;

import org.springframework.stereotype.Component;

/**
 * Pure decision function over a snapshot, a subject and a point in time.
 *
 * <p>Precedence: unregistered permission, unknown or inactive subject, top-level bypass,
 * inactive permission, deny override, grant override, inherited role grant, default deny.
 */
@Component
public class PermissionResolver {

    private final RbacProperties properties;

    public PermissionResolver(RbacProperties properties) {
        this.properties = properties;
    }

    public Decision decide(AuthorizationSnapshot snapshot, SubjectContext subject, String codename, OffsetDateTime now) {
        PermissionCatalog catalog = snapshot.catalog();
        if (!catalog.contains(codename)) {
            return Decision.UNKNOWN_PERMISSION;
        }
        if (subject == null) {
            return Decision.UNKNOWN_SUBJECT;
        }
        if (!subject.active()) {
            return Decision.INACTIVE_SUBJECT;
        }
        Set<String> closure = closureOf(snapshot.roleGraph(), subject.roleCode());
        if (closure.contains(properties.getTopLevelRole())) {
            return Decision.SUPERUSER_BYPASS;
        }
        if (!catalog.isActive(codename)) {
            return Decision.INACTIVE_PERMISSION;
        }
        boolean granted = false;
        for (OverrideEntry override : subject.overrides()) {
            if (!override.codename().equals(codename) || !override.isEffectiveAt(now)) {
                continue;
            }
            if (override.polarity() == OverridePolarity.DENY) {
                return Decision.DENY_OVERRIDE;
            }
            granted = true;
        }
        if (granted) {
            return Decision.GRANT_OVERRIDE;
        }
        if (catalog.hasActiveGrant(closure, codename)) {
            return Decision.ROLE_GRANT;
        }
        return Decision.DEFAULT_DENY;
    }

    public ResolvedPermissions resolveAll(AuthorizationSnapshot snapshot, SubjectContext subject, OffsetDateTime now) {
        if (subject == null || !subject.active()) {
            return ResolvedPermissions.none();
        }
        Set<String> granted = new LinkedHashSet<>();
        for (PermissionDefinition definition : snapshot.catalog().all()) {
            if (decide(snapshot, subject, definition.codename(), now).allowed()) {
                granted.add(definition.codename());
            }
        }
        boolean topLevel = isTopLevel(snapshot.roleGraph(), subject.roleCode());
        return new ResolvedPermissions(granted, topLevel, nextExpiry(subject, now));
    }

    public boolean isTopLevel(RoleGraph graph, String roleCode) {
        return closureOf(graph, roleCode).contains(properties.getTopLevelRole());
    }

    /**
     * Earliest future expiry among the subject's overrides; a cached result must not outlive it.
     */
    public OffsetDateTime nextExpiry(SubjectContext subject, OffsetDateTime now) {
        OffsetDateTime earliest = null;
        for (OverrideEntry override : subject.overrides()) {
            OffsetDateTime expiresAt = override.expiresAt();
            if (expiresAt != null && expiresAt.isAfter(now) && (earliest == null || expiresAt.isBefore(earliest))) {
                earliest = expiresAt;
            }
        }
        return earliest;
    }

    private Set<String> closureOf(RoleGraph graph, String roleCode) {
        return graph.contains(roleCode) ? graph.closure(roleCode) : Set.of();
    }
}
