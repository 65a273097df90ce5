package com.civicdesk.backend.modules.role.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.civicdesk.backend.modules.role.domain.RoleInheritance;

public interface RoleInheritanceRepository extends JpaRepository<RoleInheritance, UUID> {

    @Query("""
            select ri.child.code as childCode, ri.parent.code as parentCode
              from RoleInheritance ri
            """)
    List<EdgeProjection> findAllEdges();

    @Query("""
            select ri
              from RoleInheritance ri
             where ri.child.code = :childCode
               and ri.parent.code = :parentCode
            """)
    Optional<RoleInheritance> findEdge(@Param("childCode") String childCode, @Param("parentCode") String parentCode);

    interface EdgeProjection {

        String getChildCode();

        String getParentCode();
    }
}
