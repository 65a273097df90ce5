package com.civicdesk.backend.modules.transition.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
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
import com.civicdesk.backend.modules.authorization.domain.RbacViolation;
import com.civicdesk.backend.modules.authorization.domain.SubjectContext;
import com.civicdesk.backend.modules.user.domain.PortalUser;
import com.civicdesk.backend.modules.user.infrastructure.persistence.PortalUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Changes the role of a user: persist under lock, invalidate cached permissions, audit, then
 * notify. A rejected transition leaves no trace besides the returned error.
 */
@Service
public class RoleTransitionService {

    private static final Logger log = LoggerFactory.getLogger(RoleTransitionService.class);

    private final AuthorizationSnapshotHolder snapshotHolder;
    private final SubjectLoader subjectLoader;
    private final AuthorityPolicy authorityPolicy;
    private final PermissionCache permissionCache;
    private final UserMutationLocks userMutationLocks;
    private final PortalUserRepository portalUserRepository;
    private final AuditLogService auditLogService;
    private final ApplicationEventPublisher eventPublisher;
    private final RbacProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public RoleTransitionService(AuthorizationSnapshotHolder snapshotHolder,
                                 SubjectLoader subjectLoader,
                                 AuthorityPolicy authorityPolicy,
                                 PermissionCache permissionCache,
                                 UserMutationLocks userMutationLocks,
                                 PortalUserRepository portalUserRepository,
                                 AuditLogService auditLogService,
                                 ApplicationEventPublisher eventPublisher,
                                 RbacProperties properties,
                                 Clock clock,
                                 PlatformTransactionManager transactionManager) {
        this.snapshotHolder = snapshotHolder;
        this.subjectLoader = subjectLoader;
        this.authorityPolicy = authorityPolicy;
        this.permissionCache = permissionCache;
        this.userMutationLocks = userMutationLocks;
        this.portalUserRepository = portalUserRepository;
        this.auditLogService = auditLogService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public RoleTransitionResult transition(UUID actorId, UUID targetUserId, String requestedRole, String reason,
                                           String clientIp) {
        String newRole = properties.resolveRoleAlias(requestedRole);

        return userMutationLocks.withLock(targetUserId, () -> {
            AuthorizationSnapshot snapshot = snapshotHolder.fresh();
            SubjectContext actor = subjectLoader.load(actorId).orElse(null);
            OffsetDateTime now = OffsetDateTime.now(clock);

            RoleTransitionResult result = transactionTemplate.execute(status -> {
                PortalUser target = portalUserRepository.findByIdForUpdate(targetUserId)
                        .orElseThrow(() -> RbacViolation.UNKNOWN_USER.exception("unknown user: " + targetUserId));
                authorityPolicy.checkTransition(snapshot, actor, SubjectLoader.withoutOverrides(target), newRole);
                String previousRole = target.getRoleCode();
                target.assignRole(newRole, actorId, now);
                return new RoleTransitionResult(targetUserId, previousRole, newRole, actorId, now);
            });

            permissionCache.invalidate(targetUserId);
            log.info("User {} moved from {} to {} by {}", targetUserId, result.previousRole(), newRole, actorId);
            auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_ASSIGNED, AuditResourceType.USER,
                    targetUserId.toString(), actorId, Map.of("role", result.previousRole()),
                    afterState(newRole, reason, clientIp)));
            eventPublisher.publishEvent(new RoleChangedEvent(targetUserId, result.previousRole(), newRole, actorId,
                    reason, now));
            return result;
        });
    }

    private static Map<String, Object> afterState(String newRole, String reason, String clientIp) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("role", newRole);
        if (reason != null) {
            state.put("reason", reason);
        }
        if (clientIp != null) {
            state.put("clientIp", clientIp);
        }
        return state;
    }
}
