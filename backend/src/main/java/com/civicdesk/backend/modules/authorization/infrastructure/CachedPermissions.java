package com.civicdesk.backend.modules.authorization.infrastructure;

import java.time.Instant;
import java.util.Set;

/**
 * Resolved permission set of one user, stamped with the catalog and user versions it was computed under.
 */
public record CachedPermissions(long catalogVersion, long userVersion, Set<String> codenames, boolean topLevel,
                                Instant expiresAt) {

    public CachedPermissions {
        codenames = codenames == null ? Set.of() : Set.copyOf(codenames);
    }
}
