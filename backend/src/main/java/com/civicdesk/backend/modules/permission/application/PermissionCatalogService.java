package com.civicdesk.backend.modules.permission.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

import com.civicdesk.backend.modules.audit.application.AuditLogCommand;
import com.civicdesk.backend.modules.audit.application.AuditLogService;
import com.civicdesk.backend.modules.audit.domain.AuditAction;
import com.civicdesk.backend.modules.audit.domain.AuditResourceType;
import com.civicdesk.backend.modules.authorization.application.AuthorizationSnapshotHolder;
import com.civicdesk.backend.modules.authorization.application.AuthorizationSnapshotHolder.Staged;
import com.civicdesk.backend.modules.authorization.domain.PermissionCatalog;
import com.civicdesk.backend.modules.authorization.domain.PermissionDefinition;
import com.civicdesk.backend.modules.authorization.domain.RbacViolation;
import com.civicdesk.backend.modules.authorization.domain.RoleGrant;
import com.civicdesk.backend.modules.permission.domain.Permission;
import com.civicdesk.backend.modules.permission.domain.RolePermission;
import com.civicdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.civicdesk.backend.modules.permission.infrastructure.persistence.RolePermissionRepository;
import com.civicdesk.backend.modules.role.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

@Service
public class PermissionCatalogService {

    private static final Logger log = LoggerFactory.getLogger(PermissionCatalogService.class);
    private static final Pattern CODENAME_PATTERN = Pattern.compile("[a-z][a-z0-9_.:-]{1,99}");
    private static final String DEFAULT_CATEGORY = "custom";

    private final AuthorizationSnapshotHolder snapshotHolder;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final RoleRepository roleRepository;
    private final AuditLogService auditLogService;
    private final TransactionTemplate transactionTemplate;

    public PermissionCatalogService(AuthorizationSnapshotHolder snapshotHolder,
                                    PermissionRepository permissionRepository,
                                    RolePermissionRepository rolePermissionRepository,
                                    RoleRepository roleRepository,
                                    AuditLogService auditLogService,
                                    PlatformTransactionManager transactionManager) {
        this.snapshotHolder = snapshotHolder;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.roleRepository = roleRepository;
        this.auditLogService = auditLogService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public List<PermissionDefinition> list() {
        return snapshotHolder.fresh().catalog().all();
    }

    public List<PermissionDefinition> listActive() {
        return snapshotHolder.fresh().catalog().listActive();
    }

    public PermissionDefinition register(UUID actorId, String codename, String name, String description,
                                         String category) {
        if (codename == null || !CODENAME_PATTERN.matcher(codename).matches()) {
            throw RbacViolation.INVALID_PERMISSION.exception("codename must match " + CODENAME_PATTERN.pattern());
        }
        if (!StringUtils.hasText(name)) {
            throw RbacViolation.INVALID_PERMISSION.exception("name is required");
        }
        String resolvedCategory = StringUtils.hasText(category) ? category.trim() : DEFAULT_CATEGORY;
        PermissionDefinition definition = new PermissionDefinition(codename, name.trim(), description,
                resolvedCategory, true, false);

        snapshotHolder.mutate(snapshot -> {
            PermissionCatalog next = snapshot.catalog().withPermission(definition);
            transactionTemplate.executeWithoutResult(status -> permissionRepository.save(
                    new Permission(codename, definition.name(), description, resolvedCategory, false)));
            return Staged.of(snapshot.roleGraph(), next, definition);
        });

        log.info("Permission {} registered by {}", codename, actorId);
        auditLogService.record(AuditLogCommand.of(AuditAction.PERMISSION_REGISTERED, AuditResourceType.PERMISSION,
                codename, actorId, null, permissionState(definition)));
        return definition;
    }

    /**
     * Toggles the active flag. Setting the current value again is a no-op and is not audited.
     */
    public PermissionDefinition setActive(UUID actorId, String codename, boolean active) {
        ActivationChange change = snapshotHolder.mutate(snapshot -> {
            PermissionDefinition current = snapshot.catalog().require(codename);
            if (current.active() == active) {
                return Staged.unchanged(new ActivationChange(current, false));
            }
            PermissionCatalog next = snapshot.catalog().withActive(codename, active);
            transactionTemplate.executeWithoutResult(status -> {
                Permission permission = permissionRepository.findById(codename)
                        .orElseThrow(() -> RbacViolation.UNKNOWN_PERMISSION.exception("unknown permission: " + codename));
                permission.setActive(active);
            });
            return Staged.of(snapshot.roleGraph(), next, new ActivationChange(current.withActive(active), true));
        });

        if (change.changed()) {
            log.info("Permission {} {} by {}", codename, active ? "activated" : "deactivated", actorId);
            auditLogService.record(AuditLogCommand.of(AuditAction.PERMISSION_ACTIVATION_CHANGED,
                    AuditResourceType.PERMISSION, codename, actorId,
                    Map.of("active", !active), Map.of("active", active)));
        }
        return change.definition();
    }

    /**
     * Creates or updates the grant of {@code codename} to {@code roleCode}.
     */
    public RoleGrant setRolePermission(UUID actorId, String roleCode, String codename, boolean active,
                                       boolean canDelegate) {
        GrantChange change = snapshotHolder.mutate(snapshot -> {
            snapshot.roleGraph().require(roleCode);
            PermissionCatalog catalog = snapshot.catalog();
            catalog.require(codename);
            Optional<RoleGrant> previous = catalog.findGrant(roleCode, codename);
            RoleGrant grant = new RoleGrant(roleCode, codename, active, canDelegate);
            if (previous.isPresent() && previous.get().equals(grant)) {
                return Staged.unchanged(new GrantChange(null, grant, false));
            }
            transactionTemplate.executeWithoutResult(status -> {
                RolePermission entity = rolePermissionRepository.findGrant(roleCode, codename)
                        .orElseGet(() -> new RolePermission(roleRepository.getReferenceById(roleCode),
                                permissionRepository.getReferenceById(codename)));
                entity.setActive(active);
                entity.setCanDelegate(canDelegate);
                entity.setGrantedBy(actorId);
                rolePermissionRepository.save(entity);
            });
            return Staged.of(snapshot.roleGraph(), catalog.withGrant(grant),
                    new GrantChange(previous.orElse(null), grant, true));
        });

        if (change.changed()) {
            log.info("Grant {} -> {} set to active={} canDelegate={} by {}", roleCode, codename, active,
                    canDelegate, actorId);
            auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_PERMISSION_CHANGED,
                    AuditResourceType.ROLE_PERMISSION, roleCode + ":" + codename, actorId,
                    grantState(change.before()), grantState(change.after())));
        }
        return change.after();
    }

    private static Map<String, Object> permissionState(PermissionDefinition definition) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("codename", definition.codename());
        state.put("name", definition.name());
        state.put("description", definition.description());
        state.put("category", definition.category());
        state.put("active", definition.active());
        return state;
    }

    private static Map<String, Object> grantState(RoleGrant grant) {
        if (grant == null) {
            return null;
        }
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("role", grant.roleCode());
        state.put("codename", grant.codename());
        state.put("active", grant.active());
        state.put("canDelegate", grant.canDelegate());
        return state;
    }

    private record ActivationChange(PermissionDefinition definition, boolean changed) {
    }

    private record GrantChange(RoleGrant before, RoleGrant after, boolean changed) {
    }
}
