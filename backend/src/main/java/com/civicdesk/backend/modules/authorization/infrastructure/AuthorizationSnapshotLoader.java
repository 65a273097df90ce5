package com.civicdesk.backend.modules.authorization.infrastructure;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.civicdesk.backend.modules.authorization.domain.AuthorizationSnapshot;
import com.civicdesk.backend.modules.authorization.domain.PermissionCatalog;
import com.civicdesk.backend.modules.authorization.domain.PermissionDefinition;
import com.civicdesk.backend.modules.authorization.domain.RoleGrant;
import com.civicdesk.backend.modules.authorization.domain.RoleGraph;
import com.civicdesk.backend.modules.authorization.domain.RoleNode;
import com.civicdesk.backend.modules.authorization.infrastructure.persistence.AuthorizationState;
import com.civicdesk.backend.modules.authorization.infrastructure.persistence.AuthorizationStateRepository;
import com.civicdesk.backend.modules.permission.domain.Permission;
import com.civicdesk.backend.modules.permission.domain.RolePermission;
import com.civicdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.civicdesk.backend.modules.permission.infrastructure.persistence.RolePermissionRepository;
import com.civicdesk.backend.modules.role.domain.Role;
import com.civicdesk.backend.modules.role.infrastructure.persistence.RoleInheritanceRepository;
import com.civicdesk.backend.modules.role.infrastructure.persistence.RoleRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Builds an {@link AuthorizationSnapshot} from the role, inheritance, permission and grant tables,
 * versioned with the committed catalog version. The version is read first, so a concurrent commit can
 * only make the loaded tables newer than their version, never older.
 */
@Component
public class AuthorizationSnapshotLoader {

    private final RoleRepository roleRepository;
    private final RoleInheritanceRepository roleInheritanceRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final AuthorizationStateRepository authorizationStateRepository;

    public AuthorizationSnapshotLoader(RoleRepository roleRepository,
                                       RoleInheritanceRepository roleInheritanceRepository,
                                       PermissionRepository permissionRepository,
                                       RolePermissionRepository rolePermissionRepository,
                                       AuthorizationStateRepository authorizationStateRepository) {
        this.roleRepository = roleRepository;
        this.roleInheritanceRepository = roleInheritanceRepository;
        this.permissionRepository = permissionRepository;
        this.rolePermissionRepository = rolePermissionRepository;
        this.authorizationStateRepository = authorizationStateRepository;
    }

    @Transactional(readOnly = true)
    public AuthorizationSnapshot load() {
        long version = authorizationStateRepository.findById(AuthorizationState.SINGLETON_ID)
                .map(AuthorizationState::getCatalogVersion)
                .orElseThrow(() -> new IllegalStateException("authorization_state row is missing"));

        Map<String, Set<String>> parentsByChild = new HashMap<>();
        for (RoleInheritanceRepository.EdgeProjection edge : roleInheritanceRepository.findAllEdges()) {
            parentsByChild.computeIfAbsent(edge.getChildCode(), key -> new HashSet<>()).add(edge.getParentCode());
        }

        List<RoleNode> nodes = new ArrayList<>();
        for (Role role : roleRepository.findAll()) {
            nodes.add(new RoleNode(role.getCode(), role.getName(), role.getDescription(), role.getLevel(),
                    parentsByChild.getOrDefault(role.getCode(), Set.of())));
        }

        List<PermissionDefinition> definitions = permissionRepository.findAll().stream()
                .map(AuthorizationSnapshotLoader::toDefinition)
                .toList();

        List<RoleGrant> grants = rolePermissionRepository.findAllWithRoleAndPermission().stream()
                .map(AuthorizationSnapshotLoader::toGrant)
                .toList();

        return new AuthorizationSnapshot(version, RoleGraph.of(nodes), PermissionCatalog.of(definitions, grants));
    }

    public static PermissionDefinition toDefinition(Permission permission) {
        return new PermissionDefinition(
                permission.getCodename(),
                permission.getName(),
                permission.getDescription(),
                permission.getCategory(),
                permission.isActive(),
                permission.isBuiltIn()
        );
    }

    public static RoleGrant toGrant(RolePermission rolePermission) {
        return new RoleGrant(
                rolePermission.getRole().getCode(),
                rolePermission.getPermission().getCodename(),
                rolePermission.isActive(),
                rolePermission.isCanDelegate()
        );
    }
}
