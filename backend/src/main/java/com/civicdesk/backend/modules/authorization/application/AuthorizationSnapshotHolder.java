package com.civicdesk.backend.modules.authorization.application;

import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import com.civicdesk.backend.modules.authorization.application.AuthorizationVersions.CatalogLock;
import com.civicdesk.backend.modules.authorization.domain.AuthorizationSnapshot;
import com.civicdesk.backend.modules.authorization.domain.PermissionCatalog;
import com.civicdesk.backend.modules.authorization.domain.RoleGraph;
import com.civicdesk.backend.modules.authorization.infrastructure.AuthorizationSnapshotLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the live {@link AuthorizationSnapshot}. Reads are lock-free. Structural writers serialize on
 * one lock in-process and on the {@code authorization_state} row across instances, persist, then
 * swap in the next version and flush the permission cache. A snapshot older than the committed
 * catalog version is reloaded before it is used.
 */
@Component
public class AuthorizationSnapshotHolder implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationSnapshotHolder.class);

    private final AtomicReference<AuthorizationSnapshot> current = new AtomicReference<>(AuthorizationSnapshot.empty());
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AuthorizationSnapshotLoader loader;
    private final AuthorizationVersions versions;
    private final PermissionCache permissionCache;
    private final TransactionTemplate transactionTemplate;

    public AuthorizationSnapshotHolder(AuthorizationSnapshotLoader loader,
                                       AuthorizationVersions versions,
                                       PermissionCache permissionCache,
                                       PlatformTransactionManager transactionManager) {
        this.loader = loader;
        this.versions = versions;
        this.permissionCache = permissionCache;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public void afterSingletonsInstantiated() {
        reload();
    }

    /**
     * The snapshot this instance holds, without checking for newer commits.
     */
    public AuthorizationSnapshot current() {
        return current.get();
    }

    /**
     * The held snapshot, reloaded first when it is older than {@code committedVersion}.
     */
    public AuthorizationSnapshot currentAt(long committedVersion) {
        AuthorizationSnapshot snapshot = current.get();
        if (snapshot.version() >= committedVersion) {
            return snapshot;
        }
        writeLock.lock();
        try {
            snapshot = current.get();
            if (snapshot.version() < committedVersion) {
                AuthorizationSnapshot stale = snapshot;
                snapshot = loader.load();
                current.set(snapshot);
                log.info("Reloaded authorization snapshot v{} (held v{}, committed v{})",
                        snapshot.version(), stale.version(), committedVersion);
            }
            return snapshot;
        } finally {
            writeLock.unlock();
        }
    }

    public AuthorizationSnapshot fresh() {
        return currentAt(versions.catalogVersion());
    }

    public void reload() {
        AuthorizationSnapshot loaded;
        writeLock.lock();
        try {
            loaded = loader.load();
            current.set(loaded);
        } finally {
            writeLock.unlock();
        }
        permissionCache.invalidateAll();
        log.info("Loaded authorization snapshot v{} ({} roles, {} permissions)",
                loaded.version(), loaded.roleGraph().roles().size(), loaded.catalog().all().size());
    }

    /**
     * Runs {@code mutation} against the latest committed snapshot while holding the writer lock and the
     * catalog version row. The mutation validates, persists and returns the staged graph and catalog;
     * the version moves and the snapshot is swapped only after the transaction commits. Nothing changes
     * if it throws.
     */
    public <T> T mutate(Function<AuthorizationSnapshot, Staged<T>> mutation) {
        Applied<T> applied;
        writeLock.lock();
        try {
            applied = transactionTemplate.execute(status -> {
                CatalogLock lock = versions.lockCatalog();
                AuthorizationSnapshot base = current.get();
                if (base.version() != lock.version()) {
                    base = loader.load();
                    current.set(base);
                    log.info("Reloaded authorization snapshot v{} before structural change", base.version());
                }
                Staged<T> staged = mutation.apply(base);
                if (!staged.changed()) {
                    return new Applied<>(null, staged.value());
                }
                lock.advance();
                return new Applied<>(base.next(staged.roleGraph(), staged.catalog()), staged.value());
            });
            if (applied.snapshot() == null) {
                return applied.value();
            }
            current.set(applied.snapshot());
            log.debug("Swapped authorization snapshot to v{}", applied.snapshot().version());
        } finally {
            writeLock.unlock();
        }
        permissionCache.invalidateAll();
        return applied.value();
    }

    public record Staged<T>(RoleGraph roleGraph, PermissionCatalog catalog, T value, boolean changed) {

        public static <T> Staged<T> of(RoleGraph roleGraph, PermissionCatalog catalog, T value) {
            return new Staged<>(roleGraph, catalog, value, true);
        }

        public static <T> Staged<T> unchanged(T value) {
            return new Staged<>(null, null, value, false);
        }
    }

    private record Applied<T>(AuthorizationSnapshot snapshot, T value) {
    }
}
