package com.civicdesk.backend.modules.authorization.application;

import static com.civicdesk.backend.support.RbacFixtures.ADMIN_ID;
import static com.civicdesk.backend.support.RbacFixtures.CONSTITUENT_ID;
import static com.civicdesk.backend.support.RbacFixtures.ROOT_ID;
import static com.civicdesk.backend.support.RbacFixtures.STAFF_ID;
import static com.civicdesk.backend.support.RbacFixtures.override;
import static com.civicdesk.backend.support.RbacFixtures.subject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Optional;

import com.civicdesk.backend.global.config.RbacProperties;
import com.civicdesk.backend.modules.authorization.domain.AuthorizationSnapshot;
import com.civicdesk.backend.modules.authorization.domain.Decision;
import com.civicdesk.backend.modules.authorization.domain.OverridePolarity;
import com.civicdesk.backend.modules.authorization.domain.PermissionDefinition;
import com.civicdesk.backend.modules.authorization.domain.PermissionResolver;
import com.civicdesk.backend.modules.authorization.infrastructure.CacheUnavailableException;
import com.civicdesk.backend.modules.authorization.infrastructure.InMemoryPermissionCacheBackend;
import com.civicdesk.backend.modules.authorization.infrastructure.PermissionCacheBackend;
import com.civicdesk.backend.support.MutableClock;
import com.civicdesk.backend.support.RbacFixtures;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthorizationServiceTest {

    @Mock
    private AuthorizationSnapshotHolder snapshotHolder;

    @Mock
    private SubjectLoader subjectLoader;

    @Mock
    private AuthorizationVersions versions;

    private final RbacProperties properties = RbacFixtures.properties();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private long userVersion;
    private PermissionCache permissionCache;
    private AuthorizationService service;

    @BeforeEach
    void setUp() {
        AuthorizationSnapshot snapshot = RbacFixtures.snapshot();
        lenient().when(snapshotHolder.currentAt(anyLong())).thenReturn(snapshot);
        lenient().when(snapshotHolder.fresh()).thenReturn(snapshot);
        lenient().when(versions.stampFor(any()))
                .thenAnswer(invocation -> new CacheStamp(snapshot.version(), userVersion));
        permissionCache = new PermissionCache(new InMemoryPermissionCacheBackend(clock), versions, properties, clock);
        service = newService(permissionCache);
    }

    @Test
    void repeatedChecksHitTheCache() {
        when(subjectLoader.load(STAFF_ID)).thenReturn(Optional.of(subject(STAFF_ID, "staff")));

        assertThat(service.resolve(STAFF_ID, "edit_referral")).isTrue();
        assertThat(service.resolve(STAFF_ID, "view_calendar")).isTrue();
        assertThat(service.resolve(STAFF_ID, "manage_roles")).isFalse();

        verify(subjectLoader, times(1)).load(STAFF_ID);
    }

    @Test
    void committedUserChangeIsVisibleToNextCheck() {
        when(subjectLoader.load(STAFF_ID)).thenReturn(Optional.of(subject(STAFF_ID, "staff")));
        assertThat(service.resolve(STAFF_ID, "edit_referral")).isTrue();

        when(subjectLoader.load(STAFF_ID)).thenReturn(Optional.of(
                subject(STAFF_ID, "staff", override("edit_referral", OverridePolarity.DENY, null))));
        userVersion++;

        assertThat(service.resolve(STAFF_ID, "edit_referral")).isFalse();
    }

    @Test
    void checkEvaluatesAgainstSnapshotAtCommittedCatalogVersion() {
        AuthorizationSnapshot held = RbacFixtures.snapshot();
        AuthorizationSnapshot committed = new AuthorizationSnapshot(held.version() + 1, held.roleGraph(),
                held.catalog().withActive("edit_referral", false));
        when(versions.stampFor(STAFF_ID)).thenReturn(new CacheStamp(committed.version(), 0L));
        when(snapshotHolder.currentAt(committed.version())).thenReturn(committed);
        when(subjectLoader.load(STAFF_ID)).thenReturn(Optional.of(subject(STAFF_ID, "staff")));

        assertThat(service.resolve(STAFF_ID, "edit_referral")).isFalse();
        assertThat(service.resolve(STAFF_ID, "view_calendar")).isTrue();
    }

    @Test
    void unregisteredPermissionIsDeniedWithoutLoadingSubject() {
        assertThat(service.resolve(ROOT_ID, "launch_rockets")).isFalse();
        assertThat(service.resolve(null, "view_calendar")).isFalse();

        verify(subjectLoader, times(0)).load(any());
    }

    @Test
    void unknownUserGetsNothing() {
        when(subjectLoader.load(CONSTITUENT_ID)).thenReturn(Optional.empty());

        assertThat(service.resolve(CONSTITUENT_ID, "view_calendar")).isFalse();
        assertThat(service.resolveAll(CONSTITUENT_ID)).isEmpty();
    }

    @Test
    void resolveAllListsDefinitionsSortedByCodename() {
        when(subjectLoader.load(ADMIN_ID)).thenReturn(Optional.of(subject(ADMIN_ID, "admin")));

        assertThat(service.resolveAll(ADMIN_ID)).extracting(PermissionDefinition::codename)
                .containsExactly("assign_roles", "edit_referral", "manage_overrides", "view_audit_logs",
                        "view_calendar", "view_user_permissions");
    }

    @Test
    void explainReportsDecidingRule() {
        when(subjectLoader.load(STAFF_ID)).thenReturn(Optional.of(subject(STAFF_ID, "staff")));

        PermissionExplanation explanation = service.explain(STAFF_ID, "view_calendar");

        assertThat(explanation.decision()).isEqualTo(Decision.ROLE_GRANT);
        assertThat(explanation.roleClosure()).containsExactlyInAnyOrder("staff", "registered_user");
        assertThat(explanation.allowed()).isTrue();
    }

    @Test
    void hasRoleAtLeastComparesLevels() {
        when(subjectLoader.load(ADMIN_ID)).thenReturn(Optional.of(subject(ADMIN_ID, "admin")));

        assertThat(service.hasRoleAtLeast(ADMIN_ID, "coordinator")).isTrue();
        assertThat(service.hasRoleAtLeast(ADMIN_ID, "chief_of_staff")).isFalse();
        assertThat(service.hasRoleAtLeast(ADMIN_ID, "janitor")).isFalse();
    }

    @Test
    void unavailableCacheFallsBackToDirectComputation() {
        PermissionCacheBackend broken = mock(PermissionCacheBackend.class);
        when(broken.get(STAFF_ID)).thenThrow(new CacheUnavailableException("connection refused", null));
        AuthorizationService degraded = newService(new PermissionCache(broken, versions, properties, clock));
        when(subjectLoader.load(STAFF_ID)).thenReturn(Optional.of(subject(STAFF_ID, "staff")));

        assertThat(degraded.resolve(STAFF_ID, "edit_referral")).isTrue();
        assertThat(meterRegistry.counter("rbac.cache.unavailable").count()).isEqualTo(1.0);
    }

    private AuthorizationService newService(PermissionCache cache) {
        return new AuthorizationService(snapshotHolder, subjectLoader, new PermissionResolver(properties), cache,
                clock, meterRegistry);
    }
}
