package com.civicdesk.backend.modules.permission.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import com.civicdesk.backend.modules.permission.domain.Permission;

public interface PermissionRepository extends JpaRepository<Permission, String> {
}
