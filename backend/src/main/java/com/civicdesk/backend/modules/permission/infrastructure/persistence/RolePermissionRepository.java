package com.civicdesk.backend.modules.permission.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.civicdesk.backend.modules.permission.domain.RolePermission;

public interface RolePermissionRepository extends JpaRepository<RolePermission, UUID> {

    @Query("""
            select rp
              from RolePermission rp
              join fetch rp.role
              join fetch rp.permission
            """)
    List<RolePermission> findAllWithRoleAndPermission();

    @Query("""
            select rp
              from RolePermission rp
              join fetch rp.role r
              join fetch rp.permission p
             where r.code = :roleCode
               and p.codename = :codename
            """)
    Optional<RolePermission> findGrant(@Param("roleCode") String roleCode, @Param("codename") String codename);
}
