package com.civicdesk.backend.modules.authorization.infrastructure;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for cached permission sets. Implementations report connectivity problems as
 * {@link CacheUnavailableException}.
 */
public interface PermissionCacheBackend {

    Optional<CachedPermissions> get(UUID userId);

    void put(UUID userId, CachedPermissions entry, Duration ttl);

    void delete(UUID userId);

    void clear();
}
