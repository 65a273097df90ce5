package com.civicdesk.backend.modules.authorization.domain;

/**
 * Immutable pairing of the role graph and the permission catalog, versioned with the committed
 * catalog version it reflects. Readers take one snapshot and evaluate against it without locking.
 */
public record AuthorizationSnapshot(long version, RoleGraph roleGraph, PermissionCatalog catalog) {

    public static AuthorizationSnapshot empty() {
        return new AuthorizationSnapshot(0L, RoleGraph.empty(), PermissionCatalog.empty());
    }

    public AuthorizationSnapshot next(RoleGraph nextGraph, PermissionCatalog nextCatalog) {
        return new AuthorizationSnapshot(version + 1, nextGraph, nextCatalog);
    }
}
