package com.civicdesk.backend.modules.authorization.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.civicdesk.backend.modules.authorization.domain.AuthorizationSnapshot;
import com.civicdesk.backend.modules.authorization.domain.Decision;
import com.civicdesk.backend.modules.authorization.domain.PermissionDefinition;
import com.civicdesk.backend.modules.authorization.domain.PermissionResolver;
import com.civicdesk.backend.modules.authorization.domain.ResolvedPermissions;
import com.civicdesk.backend.modules.authorization.domain.RoleGraph;
import com.civicdesk.backend.modules.authorization.domain.SubjectContext;
import com.civicdesk.backend.modules.authorization.infrastructure.CacheUnavailableException;
import com.civicdesk.backend.modules.authorization.infrastructure.CachedPermissions;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read side of the engine: answers permission checks through the versioned cache and falls back
 * to direct computation when the cache backend is unavailable. Every check first reads the committed
 * versions, so it never evaluates against a catalog older than the last structural commit.
 */
@Service
public class AuthorizationService {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationService.class);
    private static final Logger DECISION_LOG = LoggerFactory.getLogger("RBAC_DECISION");

    private final AuthorizationSnapshotHolder snapshotHolder;
    private final SubjectLoader subjectLoader;
    private final PermissionResolver resolver;
    private final PermissionCache permissionCache;
    private final Clock clock;
    private final Counter cacheUnavailableCounter;

    public AuthorizationService(AuthorizationSnapshotHolder snapshotHolder,
                                SubjectLoader subjectLoader,
                                PermissionResolver resolver,
                                PermissionCache permissionCache,
                                Clock clock,
                                MeterRegistry meterRegistry) {
        this.snapshotHolder = snapshotHolder;
        this.subjectLoader = subjectLoader;
        this.resolver = resolver;
        this.permissionCache = permissionCache;
        this.clock = clock;
        this.cacheUnavailableCounter = Counter.builder("rbac.cache.unavailable")
                .description("Permission checks computed without the cache because its backend failed")
                .register(meterRegistry);
    }

    /**
     * Whether {@code userId} may exercise {@code codename}. Unregistered permissions and unknown
     * users are denied without raising.
     */
    public boolean resolve(UUID userId, String codename) {
        if (userId == null || codename == null) {
            return false;
        }
        CacheStamp stamp = permissionCache.currentStamp(userId);
        AuthorizationSnapshot snapshot = snapshotHolder.currentAt(stamp.catalogVersion());
        if (!snapshot.catalog().contains(codename)) {
            DECISION_LOG.debug("deny user={} permission={} rule={}", userId, codename, Decision.UNKNOWN_PERMISSION);
            return false;
        }
        ResolvedPermissions permissions = permissionsFor(userId, stamp, snapshot);
        boolean allowed = permissions.codenames().contains(codename);
        if (allowed && permissions.topLevel()) {
            DECISION_LOG.info("allow user={} permission={} rule={}", userId, codename, Decision.SUPERUSER_BYPASS);
        } else if (!allowed) {
            DECISION_LOG.debug("deny user={} permission={}", userId, codename);
        }
        return allowed;
    }

    public List<PermissionDefinition> resolveAll(UUID userId) {
        CacheStamp stamp = permissionCache.currentStamp(userId);
        AuthorizationSnapshot snapshot = snapshotHolder.currentAt(stamp.catalogVersion());
        Set<String> codenames = permissionsFor(userId, stamp, snapshot).codenames();
        return codenames.stream()
                .map(codename -> snapshot.catalog().find(codename))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(PermissionDefinition::codename))
                .toList();
    }

    /**
     * Re-evaluates a single check without the cache and reports which rule decided it.
     */
    public PermissionExplanation explain(UUID userId, String codename) {
        AuthorizationSnapshot snapshot = snapshotHolder.fresh();
        SubjectContext subject = subjectLoader.load(userId).orElse(null);
        Decision decision = resolver.decide(snapshot, subject, codename, OffsetDateTime.now(clock));
        String roleCode = subject == null ? null : subject.roleCode();
        RoleGraph graph = snapshot.roleGraph();
        Set<String> closure = roleCode != null && graph.contains(roleCode) ? graph.closure(roleCode) : Set.of();
        return new PermissionExplanation(userId, codename, roleCode, closure, decision, snapshot.version());
    }

    /**
     * Whether the user's role sits at or above {@code roleCode} in the level ordering.
     */
    public boolean hasRoleAtLeast(UUID userId, String roleCode) {
        if (userId == null) {
            return false;
        }
        RoleGraph graph = snapshotHolder.fresh().roleGraph();
        if (!graph.contains(roleCode)) {
            return false;
        }
        return subjectLoader.load(userId)
                .filter(SubjectContext::active)
                .filter(subject -> graph.contains(subject.roleCode()))
                .map(subject -> graph.level(subject.roleCode()) >= graph.level(roleCode))
                .orElse(false);
    }

    private ResolvedPermissions permissionsFor(UUID userId, CacheStamp stamp, AuthorizationSnapshot snapshot) {
        try {
            Optional<CachedPermissions> cached = permissionCache.get(userId, stamp);
            if (cached.isPresent()) {
                return new ResolvedPermissions(cached.get().codenames(), cached.get().topLevel(), null);
            }
            ResolvedPermissions computed = compute(userId, snapshot);
            permissionCache.put(userId, stamp, computed);
            return computed;
        } catch (CacheUnavailableException ex) {
            cacheUnavailableCounter.increment();
            log.warn("Permission cache unavailable, resolving user {} directly: {}", userId, ex.getMessage());
            return compute(userId, snapshot);
        }
    }

    private ResolvedPermissions compute(UUID userId, AuthorizationSnapshot snapshot) {
        SubjectContext subject = subjectLoader.load(userId).orElse(null);
        return resolver.resolveAll(snapshot, subject, OffsetDateTime.now(clock));
    }
}
