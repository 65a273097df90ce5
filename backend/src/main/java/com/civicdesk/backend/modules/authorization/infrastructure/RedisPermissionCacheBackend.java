package com.civicdesk.backend.modules.authorization.infrastructure;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.civicdesk.backend.global.config.RbacProperties;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Shares cached permission sets across instances through Redis.
 */
@Component
@ConditionalOnProperty(name = "rbac.cache.backend", havingValue = "redis")
public class RedisPermissionCacheBackend implements PermissionCacheBackend {

    private static final Logger log = LoggerFactory.getLogger(RedisPermissionCacheBackend.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisPermissionCacheBackend(StringRedisTemplate redisTemplate, ObjectMapper objectMapper,
                                       RbacProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = properties.getCache().getKeyPrefix();
        log.info("Initialized Redis permission cache with key prefix {}", keyPrefix);
    }

    @Override
    public Optional<CachedPermissions> get(UUID userId) {
        try {
            String json = redisTemplate.opsForValue().get(entryKey(userId));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, CachedPermissions.class));
        } catch (DataAccessException | JsonProcessingException ex) {
            throw new CacheUnavailableException("Failed to read permission cache entry", ex);
        }
    }

    @Override
    public void put(UUID userId, CachedPermissions entry, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(entryKey(userId), objectMapper.writeValueAsString(entry), ttl);
        } catch (DataAccessException | JsonProcessingException ex) {
            throw new CacheUnavailableException("Failed to write permission cache entry", ex);
        }
    }

    @Override
    public void delete(UUID userId) {
        try {
            redisTemplate.delete(entryKey(userId));
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("Failed to delete permission cache entry", ex);
        }
    }

    @Override
    public void clear() {
        try {
            Set<String> keys = redisTemplate.keys(keyPrefix + "perm:*");
            if (keys != null && !keys.isEmpty()) {
                redisTemplate.delete(keys);
            }
        } catch (DataAccessException ex) {
            throw new CacheUnavailableException("Failed to clear permission cache", ex);
        }
    }

    private String entryKey(UUID userId) {
        return keyPrefix + "perm:" + userId;
    }
}
