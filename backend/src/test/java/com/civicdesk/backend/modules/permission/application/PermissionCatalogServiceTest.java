package com.civicdesk.backend.modules.permission.application;

import static com.civicdesk.backend.support.RbacFixtures.CHIEF_OF_STAFF_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import com.civicdesk.backend.modules.audit.application.AuditLogCommand;
import com.civicdesk.backend.modules.audit.application.AuditLogService;
import com.civicdesk.backend.modules.audit.domain.AuditAction;
import com.civicdesk.backend.modules.authorization.application.AuthorizationSnapshotHolder;
import com.civicdesk.backend.modules.authorization.application.AuthorizationVersions;
import com.civicdesk.backend.modules.authorization.application.PermissionCache;
import com.civicdesk.backend.modules.authorization.domain.PermissionDefinition;
import com.civicdesk.backend.modules.authorization.domain.RbacException;
import com.civicdesk.backend.modules.authorization.domain.RbacViolation;
import com.civicdesk.backend.modules.authorization.domain.RoleGrant;
import com.civicdesk.backend.modules.authorization.infrastructure.AuthorizationSnapshotLoader;
import com.civicdesk.backend.modules.authorization.infrastructure.persistence.AuthorizationState;
import com.civicdesk.backend.modules.authorization.infrastructure.persistence.AuthorizationStateRepository;
import com.civicdesk.backend.modules.permission.domain.Permission;
import com.civicdesk.backend.modules.permission.domain.RolePermission;
import com.civicdesk.backend.modules.permission.infrastructure.persistence.PermissionRepository;
import com.civicdesk.backend.modules.permission.infrastructure.persistence.RolePermissionRepository;
import com.civicdesk.backend.modules.role.infrastructure.persistence.RoleRepository;
import com.civicdesk.backend.support.RbacFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class PermissionCatalogServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-01T10:00:00Z");

    @Mock
    private AuthorizationSnapshotLoader loader;

    @Mock
    private AuthorizationStateRepository authorizationStateRepository;

    @Mock
    private PermissionCache permissionCache;

    @Mock
    private PermissionRepository permissionRepository;

    @Mock
    private RolePermissionRepository rolePermissionRepository;

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AuthorizationState state;
    private AuthorizationSnapshotHolder snapshotHolder;
    private PermissionCatalogService service;

    @BeforeEach
    void setUp() {
        state = new AuthorizationState(1L, NOW.minusDays(1));
        lenient().when(authorizationStateRepository.findByIdForUpdate(AuthorizationState.SINGLETON_ID))
                .thenReturn(Optional.of(state));
        when(loader.load()).thenReturn(RbacFixtures.snapshot());
        AuthorizationVersions versions = new AuthorizationVersions(authorizationStateRepository,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        snapshotHolder = new AuthorizationSnapshotHolder(loader, versions, permissionCache, transactionManager);
        snapshotHolder.reload();
        service = new PermissionCatalogService(snapshotHolder, permissionRepository, rolePermissionRepository,
                roleRepository, auditLogService, transactionManager);
    }

    @Test
    void registeredPermissionIsCustomActiveAndAudited() {
        PermissionDefinition registered = service.register(CHIEF_OF_STAFF_ID, "export_casework", " Export casework ",
                "Download casework as CSV", null);

        assertThat(registered.name()).isEqualTo("Export casework");
        assertThat(registered.category()).isEqualTo("custom");
        assertThat(registered.active()).isTrue();
        assertThat(registered.builtIn()).isFalse();
        assertThat(snapshotHolder.current().catalog().contains("export_casework")).isTrue();
        assertThat(state.getCatalogVersion()).isEqualTo(2L);
        verify(permissionRepository).save(any(Permission.class));

        AuditLogCommand audit = recordedAudit();
        assertThat(audit.action()).isEqualTo(AuditAction.PERMISSION_REGISTERED);
        assertThat(audit.resourceKey()).isEqualTo("export_casework");
        assertThat(audit.actorUserId()).isEqualTo(CHIEF_OF_STAFF_ID);
        assertThat(audit.before()).isNull();
        assertThat(audit.after()).containsEntry("category", "custom").containsEntry("active", true);
    }

    @Test
    void malformedCodenameIsRejectedWithoutTouchingCatalog() {
        assertThatThrownBy(() -> service.register(CHIEF_OF_STAFF_ID, "Export Casework", "Export", null, null))
                .isInstanceOf(RbacException.class)
                .extracting(ex -> ((RbacException) ex).getViolation())
                .isEqualTo(RbacViolation.INVALID_PERMISSION);

        assertThat(state.getCatalogVersion()).isEqualTo(1L);
        verifyNoInteractions(permissionRepository, auditLogService);
    }

    @Test
    void existingCodenameIsRejected() {
        assertThatThrownBy(() -> service.register(CHIEF_OF_STAFF_ID, "edit_referral", "Edit referral", null, null))
                .isInstanceOf(RbacException.class)
                .extracting(ex -> ((RbacException) ex).getViolation())
                .isEqualTo(RbacViolation.DUPLICATE_CODENAME);

        verify(permissionRepository, never()).save(any());
        verifyNoInteractions(auditLogService);
    }

    @Test
    void deactivationRecordsPreviousAndNewFlag() {
        Permission entity = new Permission("manage_events", "manage_events", null, "test", true);
        when(permissionRepository.findById("manage_events")).thenReturn(Optional.of(entity));

        PermissionDefinition updated = service.setActive(CHIEF_OF_STAFF_ID, "manage_events", false);

        assertThat(updated.active()).isFalse();
        assertThat(entity.isActive()).isFalse();
        assertThat(snapshotHolder.current().catalog().isActive("manage_events")).isFalse();

        AuditLogCommand audit = recordedAudit();
        assertThat(audit.action()).isEqualTo(AuditAction.PERMISSION_ACTIVATION_CHANGED);
        assertThat(audit.before()).isEqualTo(Map.of("active", true));
        assertThat(audit.after()).isEqualTo(Map.of("active", false));
    }

    @Test
    void settingCurrentActiveFlagIsNotAudited() {
        PermissionDefinition unchanged = service.setActive(CHIEF_OF_STAFF_ID, "manage_events", true);

        assertThat(unchanged.active()).isTrue();
        assertThat(state.getCatalogVersion()).isEqualTo(1L);
        verifyNoInteractions(permissionRepository, auditLogService);
    }

    @Test
    void newGrantIsPersistedWithGrantorAndAudited() {
        when(rolePermissionRepository.findGrant("coordinator", "publish_newsletter")).thenReturn(Optional.empty());
        ArgumentCaptor<RolePermission> saved = ArgumentCaptor.forClass(RolePermission.class);

        RoleGrant grant = service.setRolePermission(CHIEF_OF_STAFF_ID, "coordinator", "publish_newsletter", true, false);

        assertThat(grant).isEqualTo(new RoleGrant("coordinator", "publish_newsletter", true, false));
        verify(rolePermissionRepository).save(saved.capture());
        assertThat(saved.getValue().getGrantedBy()).isEqualTo(CHIEF_OF_STAFF_ID);
        assertThat(snapshotHolder.current().catalog().findGrant("coordinator", "publish_newsletter")).hasValue(grant);

        AuditLogCommand audit = recordedAudit();
        assertThat(audit.action()).isEqualTo(AuditAction.ROLE_PERMISSION_CHANGED);
        assertThat(audit.resourceKey()).isEqualTo("coordinator:publish_newsletter");
        assertThat(audit.before()).isNull();
        assertThat(audit.after()).containsEntry("active", true).containsEntry("canDelegate", false);
    }

    @Test
    void identicalGrantIsNotAudited() {
        RoleGrant grant = service.setRolePermission(CHIEF_OF_STAFF_ID, "staff", "edit_referral", true, true);

        assertThat(grant.canDelegate()).isTrue();
        assertThat(state.getCatalogVersion()).isEqualTo(1L);
        verifyNoInteractions(rolePermissionRepository, auditLogService);
    }

    @Test
    void eachEffectiveChangeWritesExactlyOneEntryInOrder() {
        Permission entity = new Permission("export_casework", "Export casework", null, "custom", false);
        when(permissionRepository.findById("export_casework")).thenReturn(Optional.of(entity));
        when(rolePermissionRepository.findGrant("staff", "export_casework")).thenReturn(Optional.empty());

        service.register(CHIEF_OF_STAFF_ID, "export_casework", "Export casework", null, null);
        service.setRolePermission(CHIEF_OF_STAFF_ID, "staff", "export_casework", true, false);
        service.setRolePermission(CHIEF_OF_STAFF_ID, "staff", "export_casework", true, false);
        service.setActive(CHIEF_OF_STAFF_ID, "export_casework", false);
        service.setActive(CHIEF_OF_STAFF_ID, "export_casework", false);

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService, times(3)).record(captor.capture());
        assertThat(captor.getAllValues()).extracting(AuditLogCommand::action)
                .containsExactly(AuditAction.PERMISSION_REGISTERED, AuditAction.ROLE_PERMISSION_CHANGED,
                        AuditAction.PERMISSION_ACTIVATION_CHANGED);
        assertThat(state.getCatalogVersion()).isEqualTo(4L);
    }

    private AuditLogCommand recordedAudit() {
        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        return captor.getValue();
    }
}
