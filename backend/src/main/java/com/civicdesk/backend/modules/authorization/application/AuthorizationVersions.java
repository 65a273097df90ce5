package com.civicdesk.backend.modules.authorization.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.civicdesk.backend.modules.authorization.infrastructure.persistence.AuthorizationState;
import com.civicdesk.backend.modules.authorization.infrastructure.persistence.AuthorizationStateRepository;

import org.springframework.stereotype.Component;

/**
 * Committed version counters. The catalog version moves with every structural change and the
 * per-user version with every role or override change, both inside the mutating transaction.
 */
@Component
public class AuthorizationVersions {

    static final long NO_USER_VERSION = -1L;

    private final AuthorizationStateRepository authorizationStateRepository;
    private final Clock clock;

    public AuthorizationVersions(AuthorizationStateRepository authorizationStateRepository, Clock clock) {
        this.authorizationStateRepository = authorizationStateRepository;
        this.clock = clock;
    }

    public CacheStamp stampFor(UUID userId) {
        return authorizationStateRepository.findVersions(userId)
                .map(versions -> new CacheStamp(versions.getCatalogVersion(),
                        versions.getUserVersion() == null ? NO_USER_VERSION : versions.getUserVersion()))
                .orElseThrow(() -> new IllegalStateException("authorization_state row is missing"));
    }

    public long catalogVersion() {
        return authorizationStateRepository.findById(AuthorizationState.SINGLETON_ID)
                .map(AuthorizationState::getCatalogVersion)
                .orElseThrow(() -> new IllegalStateException("authorization_state row is missing"));
    }

    /**
     * Row-locks the catalog version for the surrounding transaction.
     */
    public CatalogLock lockCatalog() {
        AuthorizationState state = authorizationStateRepository.findByIdForUpdate(AuthorizationState.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("authorization_state row is missing"));
        return new CatalogLock(state, clock);
    }

    public static final class CatalogLock {

        private final AuthorizationState state;
        private final Clock clock;

        CatalogLock(AuthorizationState state, Clock clock) {
            this.state = state;
            this.clock = clock;
        }

        public long version() {
            return state.getCatalogVersion();
        }

        public long advance() {
            return state.advance(OffsetDateTime.now(clock));
        }
    }
}
