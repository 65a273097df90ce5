package com.civicdesk.backend.modules.authorization.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.civicdesk.backend.global.config.RbacProperties;
import com.civicdesk.backend.modules.authorization.domain.ResolvedPermissions;
import com.civicdesk.backend.modules.authorization.infrastructure.CacheUnavailableException;
import com.civicdesk.backend.modules.authorization.infrastructure.CachedPermissions;
import com.civicdesk.backend.modules.authorization.infrastructure.PermissionCacheBackend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Versioned per-user permission cache.
 *
 * <p>Readers take a {@link CacheStamp} from the database before loading any state and publish their
 * result under that stamp. Mutations move the stamped versions inside their own transaction, so once
 * a mutation has committed no instance serves an entry computed before it, whether or not the
 * backend was reachable at the time. Deleting entries on invalidation only reclaims space.
 */
@Component
public class PermissionCache {

    private static final Logger log = LoggerFactory.getLogger(PermissionCache.class);

    private final PermissionCacheBackend backend;
    private final AuthorizationVersions versions;
    private final RbacProperties properties;
    private final Clock clock;

    public PermissionCache(PermissionCacheBackend backend, AuthorizationVersions versions, RbacProperties properties,
                           Clock clock) {
        this.backend = backend;
        this.versions = versions;
        this.properties = properties;
        this.clock = clock;
    }

    public CacheStamp currentStamp(UUID userId) {
        return versions.stampFor(userId);
    }

    public long currentVersion(UUID userId) {
        return currentStamp(userId).userVersion();
    }

    public Optional<CachedPermissions> get(UUID userId) {
        return get(userId, currentStamp(userId));
    }

    public Optional<CachedPermissions> get(UUID userId, CacheStamp stamp) {
        Optional<CachedPermissions> entry = backend.get(userId);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        CachedPermissions cached = entry.get();
        if (cached.catalogVersion() != stamp.catalogVersion() || cached.userVersion() != stamp.userVersion()) {
            log.debug("Ignoring stale permission cache entry for user {}", userId);
            return Optional.empty();
        }
        if (!cached.expiresAt().isAfter(clock.instant())) {
            return Optional.empty();
        }
        return entry;
    }

    /**
     * Stores a permission set computed under {@code stamp}. The entry never outlives the earliest
     * override expiry of the user.
     */
    public void put(UUID userId, CacheStamp stamp, ResolvedPermissions resolved) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(properties.getCache().getTtl());
        if (resolved.validUntil() != null && resolved.validUntil().toInstant().isBefore(expiresAt)) {
            expiresAt = resolved.validUntil().toInstant();
        }
        if (!expiresAt.isAfter(now)) {
            return;
        }
        CachedPermissions entry = new CachedPermissions(stamp.catalogVersion(), stamp.userVersion(),
                resolved.codenames(), resolved.topLevel(), expiresAt);
        backend.put(userId, entry, Duration.between(now, expiresAt));
    }

    public void invalidate(UUID userId) {
        try {
            backend.delete(userId);
        } catch (CacheUnavailableException ex) {
            log.warn("Could not delete cached permissions of user {}, entry stays unreachable by version: {}",
                    userId, ex.getMessage());
        }
    }

    public void invalidateAll() {
        try {
            backend.clear();
        } catch (CacheUnavailableException ex) {
            log.warn("Could not clear permission cache, entries stay unreachable by version: {}", ex.getMessage());
        }
    }
}
