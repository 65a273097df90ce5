package com.civicdesk.backend.modules.role.domain;

import java.util.UUID;

import com.civicdesk.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * Edge of the role DAG: {@code child} inherits every permission granted to {@code parent}.
 */
@Entity
@Table(name = "role_inheritance",
        uniqueConstraints = @UniqueConstraint(name = "uq_role_inheritance_edge", columnNames = {"child_code", "parent_code"}))
public class RoleInheritance extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "child_code", nullable = false)
    private Role child;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "parent_code", nullable = false)
    private Role parent;

    protected RoleInheritance() {
    }

    public RoleInheritance(Role child, Role parent) {
        this.child = child;
        this.parent = parent;
    }

    public UUID getId() {
        return id;
    }

    public Role getChild() {
        return child;
    }

    public Role getParent() {
        return parent;
    }
}
