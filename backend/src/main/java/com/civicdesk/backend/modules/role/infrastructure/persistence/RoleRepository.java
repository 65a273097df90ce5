package com.civicdesk.backend.modules.role.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import com.civicdesk.backend.modules.role.domain.Role;

public interface RoleRepository extends JpaRepository<Role, String> {

    boolean existsByLevel(int level);

    @Query("""
            select r
              from Role r
             order by r.level desc
            """)
    List<Role> findAllOrderByLevelDesc();
}
