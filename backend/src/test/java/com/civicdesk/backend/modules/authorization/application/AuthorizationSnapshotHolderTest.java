package com.civicdesk.backend.modules.authorization.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.civicdesk.backend.modules.authorization.application.AuthorizationSnapshotHolder.Staged;
import com.civicdesk.backend.modules.authorization.application.AuthorizationVersions.CatalogLock;
import com.civicdesk.backend.modules.authorization.domain.AuthorizationSnapshot;
import com.civicdesk.backend.modules.authorization.domain.RbacException;
import com.civicdesk.backend.modules.authorization.domain.RbacViolation;
import com.civicdesk.backend.modules.authorization.infrastructure.AuthorizationSnapshotLoader;
import com.civicdesk.backend.modules.authorization.infrastructure.persistence.AuthorizationState;
import com.civicdesk.backend.support.RbacFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
class AuthorizationSnapshotHolderTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);

    @Mock
    private AuthorizationSnapshotLoader loader;

    @Mock
    private AuthorizationVersions versions;

    @Mock
    private PermissionCache permissionCache;

    @Mock
    private PlatformTransactionManager transactionManager;

    private AuthorizationSnapshotHolder holder;
    private AuthorizationSnapshot v1;

    @BeforeEach
    void setUp() {
        holder = new AuthorizationSnapshotHolder(loader, versions, permissionCache, transactionManager);
        v1 = RbacFixtures.snapshot();
        when(loader.load()).thenReturn(v1);
        holder.reload();
    }

    @Test
    void snapshotAtOrAboveCommittedVersionIsKept() {
        assertThat(holder.currentAt(1L)).isSameAs(v1);
        assertThat(holder.currentAt(0L)).isSameAs(v1);

        verify(loader, times(1)).load();
    }

    @Test
    void snapshotBehindCommittedVersionIsReloaded() {
        AuthorizationSnapshot v2 = new AuthorizationSnapshot(2L, v1.roleGraph(),
                v1.catalog().withActive("edit_referral", false));
        when(loader.load()).thenReturn(v2);

        AuthorizationSnapshot seen = holder.currentAt(2L);

        assertThat(seen).isSameAs(v2);
        assertThat(seen.catalog().require("edit_referral").active()).isFalse();
        assertThat(holder.current()).isSameAs(v2);
    }

    @Test
    void freshReadsCommittedVersion() {
        AuthorizationSnapshot v3 = new AuthorizationSnapshot(3L, v1.roleGraph(), v1.catalog());
        when(versions.catalogVersion()).thenReturn(3L);
        when(loader.load()).thenReturn(v3);

        assertThat(holder.fresh()).isSameAs(v3);
    }

    @Test
    void mutationAdvancesCommittedVersionAndSwaps() {
        AuthorizationState state = new AuthorizationState(1L, NOW.minusDays(1));
        when(versions.lockCatalog()).thenReturn(new CatalogLock(state, CLOCK));

        String value = holder.mutate(base -> Staged.of(base.roleGraph(),
                base.catalog().withActive("manage_events", false), "done"));

        assertThat(value).isEqualTo("done");
        assertThat(state.getCatalogVersion()).isEqualTo(2L);
        assertThat(state.getUpdatedAt()).isEqualTo(NOW);
        assertThat(holder.current().version()).isEqualTo(2L);
        assertThat(holder.current().catalog().require("manage_events").active()).isFalse();
        verify(permissionCache, times(2)).invalidateAll();
    }

    @Test
    void mutationStartsFromLatestCommittedSnapshot() {
        AuthorizationState state = new AuthorizationState(4L, NOW.minusDays(1));
        AuthorizationSnapshot v4 = new AuthorizationSnapshot(4L, v1.roleGraph(),
                v1.catalog().withActive("publish_newsletter", false));
        when(versions.lockCatalog()).thenReturn(new CatalogLock(state, CLOCK));
        when(loader.load()).thenReturn(v4);

        Boolean sawCommitted = holder.mutate(base -> Staged.of(base.roleGraph(), base.catalog(),
                !base.catalog().require("publish_newsletter").active()));

        assertThat(sawCommitted).isTrue();
        assertThat(holder.current().version()).isEqualTo(5L);
        assertThat(state.getCatalogVersion()).isEqualTo(5L);
    }

    @Test
    void unchangedMutationKeepsVersion() {
        AuthorizationState state = new AuthorizationState(1L, NOW.minusDays(1));
        when(versions.lockCatalog()).thenReturn(new CatalogLock(state, CLOCK));

        holder.mutate(base -> Staged.unchanged("noop"));

        assertThat(state.getCatalogVersion()).isEqualTo(1L);
        assertThat(holder.current()).isSameAs(v1);
        verify(permissionCache, times(1)).invalidateAll();
    }

    @Test
    void rejectedMutationChangesNothing() {
        AuthorizationState state = new AuthorizationState(1L, NOW.minusDays(1));
        when(versions.lockCatalog()).thenReturn(new CatalogLock(state, CLOCK));

        assertThatThrownBy(() -> holder.mutate(base -> {
            throw RbacViolation.CYCLE_DETECTED.exception("staff -> admin -> staff");
        })).isInstanceOf(RbacException.class);

        assertThat(state.getCatalogVersion()).isEqualTo(1L);
        assertThat(holder.current()).isSameAs(v1);
        verify(transactionManager).rollback(null);
        verify(transactionManager, never()).commit(null);
    }
}
