package com.civicdesk.backend.modules.role.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.civicdesk.backend.modules.audit.application.AuditLogCommand;
import com.civicdesk.backend.modules.audit.application.AuditLogService;
import com.civicdesk.backend.modules.audit.domain.AuditAction;
import com.civicdesk.backend.modules.audit.domain.AuditResourceType;
import com.civicdesk.backend.modules.authorization.application.AuthorizationSnapshotHolder;
import com.civicdesk.backend.modules.authorization.application.AuthorizationSnapshotHolder.Staged;
import com.civicdesk.backend.modules.authorization.domain.RbacViolation;
import com.civicdesk.backend.modules.authorization.domain.RoleGraph;
import com.civicdesk.backend.modules.authorization.domain.RoleNode;
import com.civicdesk.backend.modules.role.domain.Role;
import com.civicdesk.backend.modules.role.domain.RoleInheritance;
import com.civicdesk.backend.modules.role.infrastructure.persistence.RoleInheritanceRepository;
import com.civicdesk.backend.modules.role.infrastructure.persistence.RoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Structural changes to the role hierarchy. Each change is validated against the proposed graph,
 * persisted, swapped into the live snapshot and audited once committed.
 */
@Service
public class RoleGraphService {

    private static final Logger log = LoggerFactory.getLogger(RoleGraphService.class);

    private final AuthorizationSnapshotHolder snapshotHolder;
    private final RoleRepository roleRepository;
    private final RoleInheritanceRepository roleInheritanceRepository;
    private final AuditLogService auditLogService;
    private final TransactionTemplate transactionTemplate;

    public RoleGraphService(AuthorizationSnapshotHolder snapshotHolder,
                            RoleRepository roleRepository,
                            RoleInheritanceRepository roleInheritanceRepository,
                            AuditLogService auditLogService,
                            PlatformTransactionManager transactionManager) {
        this.snapshotHolder = snapshotHolder;
        this.roleRepository = roleRepository;
        this.roleInheritanceRepository = roleInheritanceRepository;
        this.auditLogService = auditLogService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public List<RoleView> listRoles() {
        RoleGraph graph = snapshotHolder.fresh().roleGraph();
        return graph.roles().stream()
                .map(node -> RoleView.of(graph, node))
                .toList();
    }

    public RoleView getRole(String code) {
        RoleGraph graph = snapshotHolder.fresh().roleGraph();
        return RoleView.of(graph, graph.require(code));
    }

    public RoleView createRole(UUID actorId, String code, String name, String description, int level,
                               Set<String> parents) {
        RoleView created = snapshotHolder.mutate(snapshot -> {
            RoleNode node = new RoleNode(code, name, description, level, parents);
            RoleGraph next = snapshot.roleGraph().withRole(node);
            transactionTemplate.executeWithoutResult(status -> {
                Role role = roleRepository.save(new Role(code, name, description, level));
                for (String parent : node.parents()) {
                    roleInheritanceRepository.save(new RoleInheritance(role, roleRepository.getReferenceById(parent)));
                }
            });
            return Staged.of(next, snapshot.catalog(), RoleView.of(next, node));
        });

        log.info("Role {} created at level {} by {}", code, level, actorId);
        auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_CREATED, AuditResourceType.ROLE, code, actorId,
                null, roleState(created)));
        return created;
    }

    /**
     * Makes {@code child} inherit from {@code parent}. Adding an existing edge changes nothing and is not audited.
     */
    public RoleView addParent(UUID actorId, String child, String parent) {
        boolean added = snapshotHolder.mutate(snapshot -> {
            RoleGraph graph = snapshot.roleGraph();
            RoleGraph next = graph.withEdge(child, parent);
            if (next == graph) {
                return Staged.unchanged(false);
            }
            transactionTemplate.executeWithoutResult(status -> roleInheritanceRepository.save(
                    new RoleInheritance(roleRepository.getReferenceById(child), roleRepository.getReferenceById(parent))));
            return Staged.of(next, snapshot.catalog(), true);
        });

        if (added) {
            log.info("Role {} now inherits from {} (by {})", child, parent, actorId);
            auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_EDGE_ADDED, AuditResourceType.ROLE_EDGE,
                    edgeKey(child, parent), actorId, null, edgeState(child, parent)));
        }
        return getRole(child);
    }

    public RoleView removeParent(UUID actorId, String child, String parent) {
        snapshotHolder.mutate(snapshot -> {
            RoleGraph next = snapshot.roleGraph().withoutEdge(child, parent);
            transactionTemplate.executeWithoutResult(status -> {
                RoleInheritance edge = roleInheritanceRepository.findEdge(child, parent)
                        .orElseThrow(() -> RbacViolation.EDGE_NOT_FOUND.exception(child + " does not inherit from " + parent));
                roleInheritanceRepository.delete(edge);
            });
            return Staged.of(next, snapshot.catalog(), Boolean.TRUE);
        });

        log.info("Role {} no longer inherits from {} (by {})", child, parent, actorId);
        auditLogService.record(AuditLogCommand.of(AuditAction.ROLE_EDGE_REMOVED, AuditResourceType.ROLE_EDGE,
                edgeKey(child, parent), actorId, edgeState(child, parent), null));
        return getRole(child);
    }

    private static String edgeKey(String child, String parent) {
        return child + "->" + parent;
    }

    private static Map<String, Object> edgeState(String child, String parent) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("child", child);
        state.put("parent", parent);
        return state;
    }

    private static Map<String, Object> roleState(RoleView role) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("code", role.code());
        state.put("name", role.name());
        state.put("description", role.description());
        state.put("level", role.level());
        state.put("parents", List.copyOf(role.parents()));
        return state;
    }
}
