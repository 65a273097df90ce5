package com.civicdesk.backend.modules.role.application;

import static com.civicdesk.backend.support.RbacFixtures.CHIEF_OF_STAFF_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.civicdesk.backend.modules.audit.application.AuditLogCommand;
import com.civicdesk.backend.modules.audit.application.AuditLogService;
import com.civicdesk.backend.modules.audit.domain.AuditAction;
import com.civicdesk.backend.modules.authorization.application.AuthorizationSnapshotHolder;
import com.civicdesk.backend.modules.authorization.application.AuthorizationVersions;
import com.civicdesk.backend.modules.authorization.application.PermissionCache;
import com.civicdesk.backend.modules.authorization.domain.RbacException;
import com.civicdesk.backend.modules.authorization.domain.RbacViolation;
import com.civicdesk.backend.modules.authorization.infrastructure.AuthorizationSnapshotLoader;
import com.civicdesk.backend.modules.authorization.infrastructure.persistence.AuthorizationState;
import com.civicdesk.backend.modules.authorization.infrastructure.persistence.AuthorizationStateRepository;
import com.civicdesk.backend.modules.role.domain.Role;
import com.civicdesk.backend.modules.role.domain.RoleInheritance;
import com.civicdesk.backend.modules.role.infrastructure.persistence.RoleInheritanceRepository;
import com.civicdesk.backend.modules.role.infrastructure.persistence.RoleRepository;
import com.civicdesk.backend.support.RbacFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class RoleGraphServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-01T10:00:00Z");

    @Mock
    private AuthorizationSnapshotLoader loader;

    @Mock
    private AuthorizationStateRepository authorizationStateRepository;

    @Mock
    private PermissionCache permissionCache;

    @Mock
    private RoleRepository roleRepository;

    @Mock
    private RoleInheritanceRepository roleInheritanceRepository;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AuthorizationState state;
    private AuthorizationSnapshotHolder snapshotHolder;
    private RoleGraphService service;

    @BeforeEach
    void setUp() {
        state = new AuthorizationState(1L, NOW.minusDays(1));
        when(authorizationStateRepository.findByIdForUpdate(AuthorizationState.SINGLETON_ID))
                .thenReturn(Optional.of(state));
        lenient().when(authorizationStateRepository.findById(AuthorizationState.SINGLETON_ID))
                .thenReturn(Optional.of(state));
        when(loader.load()).thenReturn(RbacFixtures.snapshot());
        AuthorizationVersions versions = new AuthorizationVersions(authorizationStateRepository,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        snapshotHolder = new AuthorizationSnapshotHolder(loader, versions, permissionCache, transactionManager);
        snapshotHolder.reload();
        service = new RoleGraphService(snapshotHolder, roleRepository, roleInheritanceRepository, auditLogService,
                transactionManager);
    }

    @Test
    void createdRoleIsPersistedSwappedAndAuditedAfterCommit() {
        when(roleRepository.save(any(Role.class))).thenAnswer(invocation -> invocation.getArgument(0));

        RoleView created = service.createRole(CHIEF_OF_STAFF_ID, "intern", "Intern", null, 1,
                Set.of("registered_user"));

        assertThat(created.closure()).containsExactlyInAnyOrder("intern", "registered_user");
        assertThat(snapshotHolder.current().roleGraph().contains("intern")).isTrue();
        assertThat(state.getCatalogVersion()).isEqualTo(2L);
        verify(roleInheritanceRepository).save(any(RoleInheritance.class));

        InOrder order = inOrder(transactionManager, auditLogService);
        order.verify(transactionManager, times(2)).commit(any());
        order.verify(auditLogService).record(any());
        verify(permissionCache, times(2)).invalidateAll();

        AuditLogCommand audit = recordedAudit();
        assertThat(audit.action()).isEqualTo(AuditAction.ROLE_CREATED);
        assertThat(audit.resourceKey()).isEqualTo("intern");
        assertThat(audit.actorUserId()).isEqualTo(CHIEF_OF_STAFF_ID);
        assertThat(audit.after()).containsEntry("level", 1).containsEntry("parents", List.of("registered_user"));
    }

    @Test
    void roleWithoutPositiveLevelIsRejectedBeforePersisting() {
        assertThatThrownBy(() -> service.createRole(CHIEF_OF_STAFF_ID, "intern", "Intern", null, 0,
                Set.of("staff")))
                .isInstanceOf(RbacException.class)
                .extracting(ex -> ((RbacException) ex).getViolation())
                .isEqualTo(RbacViolation.INVALID_ROLE);

        assertThat(state.getCatalogVersion()).isEqualTo(1L);
        verifyNoInteractions(roleRepository, roleInheritanceRepository, auditLogService);
    }

    @Test
    void takenLevelIsRejected() {
        assertThatThrownBy(() -> service.createRole(CHIEF_OF_STAFF_ID, "deputy", "Deputy", null, 7, Set.of()))
                .isInstanceOf(RbacException.class)
                .extracting(ex -> ((RbacException) ex).getViolation())
                .isEqualTo(RbacViolation.DUPLICATE_LEVEL);
        verifyNoInteractions(roleRepository, auditLogService);
    }

    @Test
    void addingExistingEdgeChangesNothing() {
        RoleView staff = service.addParent(CHIEF_OF_STAFF_ID, "staff", "registered_user");

        assertThat(staff.parents()).containsExactly("registered_user");
        assertThat(state.getCatalogVersion()).isEqualTo(1L);
        verify(roleInheritanceRepository, never()).save(any());
        verify(permissionCache, times(1)).invalidateAll();
        verifyNoInteractions(auditLogService);
    }

    @Test
    void edgeClosingCycleIsRejected() {
        assertThatThrownBy(() -> service.addParent(CHIEF_OF_STAFF_ID, "registered_user", "admin"))
                .isInstanceOf(RbacException.class)
                .extracting(ex -> ((RbacException) ex).getViolation())
                .isEqualTo(RbacViolation.CYCLE_DETECTED);

        assertThat(snapshotHolder.current().roleGraph().hasEdge("registered_user", "admin")).isFalse();
        verify(roleInheritanceRepository, never()).save(any());
        verifyNoInteractions(auditLogService);
    }

    @Test
    void removingMissingEdgeIsReported() {
        assertThatThrownBy(() -> service.removeParent(CHIEF_OF_STAFF_ID, "mp", "staff"))
                .isInstanceOf(RbacException.class)
                .extracting(ex -> ((RbacException) ex).getViolation())
                .isEqualTo(RbacViolation.EDGE_NOT_FOUND);
        verifyNoInteractions(auditLogService);
    }

    @Test
    void eachEffectiveChangeWritesExactlyOneEntryInOrder() {
        when(roleRepository.save(any(Role.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(roleInheritanceRepository.findEdge("intern", "chapter_member"))
                .thenReturn(Optional.of(new RoleInheritance(null, null)));

        service.createRole(CHIEF_OF_STAFF_ID, "intern", "Intern", null, 1, Set.of("registered_user"));
        service.addParent(CHIEF_OF_STAFF_ID, "intern", "chapter_member");
        service.addParent(CHIEF_OF_STAFF_ID, "intern", "chapter_member");
        service.removeParent(CHIEF_OF_STAFF_ID, "intern", "chapter_member");

        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService, times(3)).record(captor.capture());
        assertThat(captor.getAllValues()).extracting(AuditLogCommand::action)
                .containsExactly(AuditAction.ROLE_CREATED, AuditAction.ROLE_EDGE_ADDED, AuditAction.ROLE_EDGE_REMOVED);
        assertThat(captor.getAllValues()).extracting(AuditLogCommand::resourceKey)
                .containsExactly("intern", "intern->chapter_member", "intern->chapter_member");
        assertThat(state.getCatalogVersion()).isEqualTo(4L);
        assertThat(snapshotHolder.current().roleGraph().closure("intern"))
                .containsExactlyInAnyOrder("intern", "registered_user");
    }

    private AuditLogCommand recordedAudit() {
        ArgumentCaptor<AuditLogCommand> captor = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(captor.capture());
        return captor.getValue();
    }
}
