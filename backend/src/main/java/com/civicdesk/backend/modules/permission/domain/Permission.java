package com.civicdesk.backend.modules.permission.domain;

import com.civicdesk.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Named capability. Built-in permissions are seeded by migration; others are registered at runtime.
 */
@Entity
@Table(name = "permission")
public class Permission extends AbstractTimestampedEntity {

    @Id
    @Column(name = "codename", nullable = false, length = 100)
    private String codename;

    @Column(name = "name", nullable = false, length = 150)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "category", nullable = false, length = 50)
    private String category;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "built_in", nullable = false)
    private boolean builtIn;

    protected Permission() {
    }

    public Permission(String codename, String name, String description, String category, boolean builtIn) {
        this.codename = codename;
        this.name = name;
        this.description = description;
        this.category = category;
        this.builtIn = builtIn;
    }

    public String getCodename() {
        return codename;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getCategory() {
        return category;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isBuiltIn() {
        return builtIn;
    }
}
