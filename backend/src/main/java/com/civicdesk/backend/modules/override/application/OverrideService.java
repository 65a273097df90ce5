package com.civicdesk.backend.modules.override.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.civicdesk.backend.global.config.RbacProperties;
import com.civicdesk.backend.modules.audit.application.AuditLogCommand;
import com.civicdesk.backend.modules.audit.application.AuditLogService;
import com.civicdesk.backend.modules.audit.domain.AuditAction;
import com.civicdesk.backend.modules.audit.domain.AuditResourceType;
import com.civicdesk.backend.modules.authorization.application.AuthorityPolicy;
import com.civicdesk.backend.modules.authorization.application.AuthorizationSnapshotHolder;
import com.civicdesk.backend.modules.authorization.application.PermissionCache;
import com.civicdesk.backend.modules.authorization.application.SubjectLoader;
import com.civicdesk.backend.modules.authorization.application.UserMutationLocks;
import com.civicdesk.backend.modules.authorization.domain.AuthorizationSnapshot;
import com.civicdesk.backend.modules.authorization.domain.OverridePolarity;
import com.civicdesk.backend.modules.authorization.domain.RbacViolation;
import com.civicdesk.backend.modules.authorization.domain.SubjectContext;
import com.civicdesk.backend.modules.override.domain.PermissionOverride;
import com.civicdesk.backend.modules.override.infrastructure.persistence.PermissionOverrideRepository;
import com.civicdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.civicdesk.backend.modules.user.domain.PortalUser;
import com.civicdesk.backend.modules.user.infrastructure.persistence.PortalUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * Per-user grant/deny overrides. Writes run under the user's mutation lock and a row lock on the
 * user, invalidate the user's cached permissions, then record the audit entry.
 */
@Service
public class OverrideService {

    private static final Logger log = LoggerFactory.getLogger(OverrideService.class);
    private static final int MAX_REASON_LENGTH = 500;

    private final AuthorizationSnapshotHolder snapshotHolder;
    private final SubjectLoader subjectLoader;
    private final AuthorityPolicy authorityPolicy;
    private final PermissionCache permissionCache;
    private final UserMutationLocks userMutationLocks;
    private final PortalUserRepository portalUserRepository;
    private final PermissionRepository permissionRepository;
    private final PermissionOverrideRepository permissionOverrideRepository;
    private final AuditLogService auditLogService;
    private final RbacProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public OverrideService(AuthorizationSnapshotHolder snapshotHolder,
                           SubjectLoader subjectLoader,
                           AuthorityPolicy authorityPolicy,
                           PermissionCache permissionCache,
                           UserMutationLocks userMutationLocks,
                           PortalUserRepository portalUserRepository,
                           PermissionRepository permissionRepository,
                           PermissionOverrideRepository permissionOverrideRepository,
                           AuditLogService auditLogService,
                           RbacProperties properties,
                           Clock clock,
                           PlatformTransactionManager transactionManager) {
        this.snapshotHolder = snapshotHolder;
        this.subjectLoader = subjectLoader;
        this.authorityPolicy = authorityPolicy;
        this.permissionCache = permissionCache;
        this.userMutationLocks = userMutationLocks;
        this.portalUserRepository = portalUserRepository;
        this.permissionRepository = permissionRepository;
        this.permissionOverrideRepository = permissionOverrideRepository;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public List<OverrideView> list(UUID userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return transactionTemplate.execute(status -> {
            if (!portalUserRepository.existsById(userId)) {
                throw RbacViolation.UNKNOWN_USER.exception("unknown user: " + userId);
            }
            return permissionOverrideRepository.findByUserId(userId).stream()
                    .map(override -> OverrideView.of(override, now))
                    .toList();
        });
    }

    /**
     * Creates the override or replaces the one already on record for the same permission.
     */
    public OverrideView createOrReplace(UUID actorId, UUID userId, String codename, OverridePolarity polarity,
                                        String reason, OffsetDateTime expiresAt) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        if (polarity == null) {
            throw RbacViolation.INVALID_OVERRIDE.exception("polarity is required");
        }
        if (!StringUtils.hasText(reason) || reason.length() > MAX_REASON_LENGTH) {
            throw RbacViolation.INVALID_OVERRIDE.exception("reason is required (max " + MAX_REASON_LENGTH + " chars)");
        }
        if (expiresAt != null && !expiresAt.isAfter(now)) {
            throw RbacViolation.INVALID_OVERRIDE.exception("expiresAt must be in the future");
        }

        return userMutationLocks.withLock(userId, () -> {
            AuthorizationSnapshot snapshot = snapshotHolder.fresh();
            snapshot.catalog().require(codename);
            SubjectContext actor = subjectLoader.load(actorId).orElse(null);

            Change change = transactionTemplate.execute(status -> {
                PortalUser user = lockUser(userId);
                authorityPolicy.checkOverride(snapshot, actor, SubjectLoader.withoutOverrides(user), codename, polarity);

                PermissionOverride existing = permissionOverrideRepository.findByUserIdAndCodename(userId, codename)
                        .orElse(null);
                Map<String, Object> before = existing == null ? null : OverrideView.of(existing, now).toAuditState();
                PermissionOverride override = existing != null
                        ? existing
                        : new PermissionOverride(user, permissionRepository.getReferenceById(codename));
                override.apply(polarity, reason.trim(), expiresAt, actorId);
                permissionOverrideRepository.save(override);
                user.bumpPermissionVersion();
                return new Change(before, OverrideView.of(override, now));
            });

            permissionCache.invalidate(userId);
            AuditAction action = change.before() == null ? AuditAction.OVERRIDE_CREATED : AuditAction.OVERRIDE_REPLACED;
            log.info("{} override {} for user {} on {} by {}", action, polarity, userId, codename, actorId);
            auditLogService.record(AuditLogCommand.of(action, AuditResourceType.OVERRIDE, overrideKey(userId, codename),
                    actorId, change.before(), change.after().toAuditState()));
            return change.after();
        });
    }

    public void remove(UUID actorId, UUID userId, String codename) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        userMutationLocks.withLock(userId, () -> {
            AuthorizationSnapshot snapshot = snapshotHolder.fresh();
            SubjectContext actor = subjectLoader.load(actorId).orElse(null);

            Map<String, Object> before = transactionTemplate.execute(status -> {
                PortalUser user = lockUser(userId);
                authorityPolicy.checkOverride(snapshot, actor, SubjectLoader.withoutOverrides(user), codename, null);
                PermissionOverride override = requireOverride(userId, codename);
                Map<String, Object> state = OverrideView.of(override, now).toAuditState();
                permissionOverrideRepository.delete(override);
                user.bumpPermissionVersion();
                return state;
            });

            permissionCache.invalidate(userId);
            log.info("Override for user {} on {} removed by {}", userId, codename, actorId);
            auditLogService.record(AuditLogCommand.of(AuditAction.OVERRIDE_REMOVED, AuditResourceType.OVERRIDE,
                    overrideKey(userId, codename), actorId, before, null));
            return null;
        });
    }

    /**
     * Ends an override now while keeping the row for history.
     */
    public OverrideView expire(UUID actorId, UUID userId, String codename) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return userMutationLocks.withLock(userId, () -> {
            AuthorizationSnapshot snapshot = snapshotHolder.fresh();
            SubjectContext actor = subjectLoader.load(actorId).orElse(null);

            Change change = transactionTemplate.execute(status -> {
                PortalUser user = lockUser(userId);
                authorityPolicy.checkOverride(snapshot, actor, SubjectLoader.withoutOverrides(user), codename, null);
                PermissionOverride override = requireOverride(userId, codename);
                if (!override.isEffectiveAt(now)) {
                    throw RbacViolation.INVALID_OVERRIDE.exception("override has already expired");
                }
                Map<String, Object> before = OverrideView.of(override, now).toAuditState();
                override.expireAt(now);
                permissionOverrideRepository.save(override);
                user.bumpPermissionVersion();
                return new Change(before, OverrideView.of(override, now));
            });

            permissionCache.invalidate(userId);
            log.info("Override for user {} on {} expired by {}", userId, codename, actorId);
            auditLogService.record(AuditLogCommand.of(AuditAction.OVERRIDE_EXPIRED, AuditResourceType.OVERRIDE,
                    overrideKey(userId, codename), actorId, change.before(), change.after().toAuditState()));
            return change.after();
        });
    }

    /**
     * Deletes overrides that expired more than {@code rbac.overrides.purge-after} ago. Resolution
     * already ignores them; this only keeps the table small. Each deletion is audited as a removal
     * without an actor.
     *
     * @return number of rows deleted
     */
    public int purgeExpired() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime threshold = now.minus(properties.getOverrides().getPurgeAfter());
        List<PurgeCandidate> candidates = transactionTemplate.execute(status ->
                permissionOverrideRepository.findExpiredBefore(threshold).stream()
                        .map(override -> new PurgeCandidate(override.getId(), override.getUser().getId(),
                                override.getPermission().getCodename()))
                        .toList());

        int purged = 0;
        for (PurgeCandidate candidate : candidates) {
            Map<String, Object> before = userMutationLocks.withLock(candidate.userId(), () ->
                    transactionTemplate.execute(status -> {
                        PortalUser user = lockUser(candidate.userId());
                        return permissionOverrideRepository.findById(candidate.overrideId())
                                .filter(override -> override.getExpiresAt() != null
                                        && override.getExpiresAt().isBefore(threshold))
                                .map(override -> {
                                    Map<String, Object> state = OverrideView.of(override, now).toAuditState();
                                    permissionOverrideRepository.delete(override);
                                    user.bumpPermissionVersion();
                                    return state;
                                })
                                .orElse(null);
                    }));
            if (before == null) {
                continue;
            }
            permissionCache.invalidate(candidate.userId());
            auditLogService.record(AuditLogCommand.of(AuditAction.OVERRIDE_REMOVED, AuditResourceType.OVERRIDE,
                    overrideKey(candidate.userId(), candidate.codename()), null, before, Map.of("purged", true)));
            purged++;
        }
        return purged;
    }

    private PortalUser lockUser(UUID userId) {
        return portalUserRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> RbacViolation.UNKNOWN_USER.exception("unknown user: " + userId));
    }

    private PermissionOverride requireOverride(UUID userId, String codename) {
        return permissionOverrideRepository.findByUserIdAndCodename(userId, codename)
                .orElseThrow(() -> RbacViolation.OVERRIDE_NOT_FOUND.exception(
                        "no override for user " + userId + " on " + codename));
    }

    private static String overrideKey(UUID userId, String codename) {
        return userId + ":" + codename;
    }

    private record Change(Map<String, Object> before, OverrideView after) {
    }

    private record PurgeCandidate(UUID overrideId, UUID userId, String codename) {
    }
}
