package com.civicdesk.backend.modules.authorization.infrastructure;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "rbac.cache.backend", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryPermissionCacheBackend implements PermissionCacheBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPermissionCacheBackend.class);

    private final ConcurrentHashMap<UUID, CachedPermissions> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPermissionCacheBackend(Clock clock) {
        this.clock = clock;
        log.info("Initialized in-memory permission cache");
    }

    @Override
    public Optional<CachedPermissions> get(UUID userId) {
        return Optional.ofNullable(entries.get(userId));
    }

    @Override
    public void put(UUID userId, CachedPermissions entry, Duration ttl) {
        entries.put(userId, entry);
    }

    @Override
    public void delete(UUID userId) {
        entries.remove(userId);
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Scheduled(fixedRate = 60000)
    public void cleanupExpiredEntries() {
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.expiresAt().isAfter(clock.instant()));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("Cleaned up {} expired permission cache entries", removed);
        }
    }
}
