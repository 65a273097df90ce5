package com.civicdesk.backend.modules.authorization.application;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.civicdesk.backend.global.config.RbacProperties;
import com.civicdesk.backend.global.error.RetryableProblemException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Serializes writes that affect one user (role transitions, overrides) inside this process.
 */
@Component
public class UserMutationLocks {

    private static final Logger log = LoggerFactory.getLogger(UserMutationLocks.class);
    private static final String BUSY_CODE = "rbac.concurrent_mutation";
    private static final int RETRY_AFTER_SECONDS = 1;

    private final ConcurrentHashMap<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final RbacProperties properties;

    public UserMutationLocks(RbacProperties properties) {
        this.properties = properties;
    }

    public <T> T withLock(UUID userId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(userId, id -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(properties.getLocks().getUserTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw busy(userId);
        }
        if (!acquired) {
            log.warn("Timed out waiting for mutation lock on user {}", userId);
            throw busy(userId);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private RetryableProblemException busy(UUID userId) {
        return new RetryableProblemException(HttpStatus.SERVICE_UNAVAILABLE, BUSY_CODE,
                "another change to user " + userId + " is in progress", RETRY_AFTER_SECONDS);
    }
}
