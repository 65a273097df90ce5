package com.civicdesk.backend.modules.authorization.infrastructure.persistence;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Single row holding the committed version of the role graph and permission catalog.
 */
@Entity
@Table(name = "authorization_state")
public class AuthorizationState {

    public static final short SINGLETON_ID = 1;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private Short id;

    @Column(name = "catalog_version", nullable = false)
    private long catalogVersion;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected AuthorizationState() {
    }

    public AuthorizationState(long catalogVersion, OffsetDateTime updatedAt) {
        this.id = SINGLETON_ID;
        this.catalogVersion = catalogVersion;
        this.updatedAt = updatedAt;
    }

    public long getCatalogVersion() {
        return catalogVersion;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public long advance(OffsetDateTime now) {
        this.catalogVersion++;
        this.updatedAt = now;
        return catalogVersion;
    }
}
