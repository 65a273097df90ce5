package com.civicdesk.backend.modules.role.domain;

import com.civicdesk.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Role in the office hierarchy. {@code level} is unique; a higher level carries more authority.
 */
@Entity
@Table(name = "role")
public class Role extends AbstractTimestampedEntity {

    @Id
    @Column(name = "code", nullable = false, length = 64)
    private String code;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "level", nullable = false, unique = true)
    private int level;

    protected Role() {
    }

    public Role(String code, String name, String description, int level) {
        this.code = code;
        this.name = name;
        this.description = description;
        this.level = level;
    }

    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public int getLevel() {
        return level;
    }
}
